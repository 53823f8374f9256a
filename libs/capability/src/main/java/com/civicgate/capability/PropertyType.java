package com.civicgate.capability;

import java.util.List;
import java.util.Map;

/**
 * JSON types an operation argument may declare.
 */
public enum PropertyType {

    STRING("string"),
    INTEGER("integer"),
    NUMBER("number"),
    BOOLEAN("boolean"),
    ARRAY("array"),
    OBJECT("object");

    private final String value;

    PropertyType(String value) {
        this.value = value;
    }

    /** The JSON-schema type name. */
    public String value() {
        return value;
    }

    /**
     * Checks whether a decoded JSON value has this type.
     */
    public boolean accepts(Object candidate) {
        return switch (this) {
            case STRING -> candidate instanceof String;
            case INTEGER -> candidate instanceof Integer || candidate instanceof Long
                    || candidate instanceof java.math.BigInteger;
            case NUMBER -> candidate instanceof Number;
            case BOOLEAN -> candidate instanceof Boolean;
            case ARRAY -> candidate instanceof List<?>;
            case OBJECT -> candidate instanceof Map<?, ?>;
        };
    }
}
