package com.civicgate.capability;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The argument contract of an operation: a flat set of typed properties, some required,
 * some restricted to an enumeration. Additional properties are allowed.
 */
public final class InputSchema {

    private static final InputSchema EMPTY = new InputSchema(List.of());

    private final List<Property> properties;

    private InputSchema(List<Property> properties) {
        this.properties = List.copyOf(properties);
    }

    /** A schema with no properties. */
    public static InputSchema empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Property> properties() {
        return properties;
    }

    /**
     * Checks {@code args} and reports every violation at once.
     *
     * @param args decoded JSON arguments (nullable, treated as empty)
     */
    public InputValidationResult validate(Map<String, Object> args) {
        Map<String, Object> actual = args == null ? Map.of() : args;
        List<String> errors = new ArrayList<>();
        for (Property property : properties) {
            Object value = actual.get(property.name());
            if (value == null) {
                if (property.required()) {
                    errors.add(property.name() + " is required");
                }
                continue;
            }
            if (!property.type().accepts(value)) {
                errors.add(property.name() + " must be of type " + property.type().value());
                continue;
            }
            checkAllowedValues(property, value, errors);
        }
        return errors.isEmpty() ? InputValidationResult.ok() : InputValidationResult.fail(errors);
    }

    /**
     * Renders the schema as a JSON-schema object ({@code type}, {@code properties},
     * {@code required}) for operation listings.
     */
    public Map<String, Object> toJson() {
        Map<String, Object> props = new LinkedHashMap<>();
        List<String> required = new ArrayList<>();
        for (Property property : properties) {
            props.put(property.name(), property.toJson());
            if (property.required()) {
                required.add(property.name());
            }
        }
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", props);
        if (!required.isEmpty()) {
            schema.put("required", required);
        }
        return schema;
    }

    private static void checkAllowedValues(Property property, Object value, List<String> errors) {
        if (property.allowedValues().isEmpty()) {
            return;
        }
        if (property.type() == PropertyType.ARRAY) {
            for (Object item : (List<?>) value) {
                if (!property.allowedValues().contains(String.valueOf(item))) {
                    errors.add(property.name() + " contains unsupported value '" + item
                            + "'; allowed: " + String.join(", ", property.allowedValues()));
                }
            }
        } else if (!property.allowedValues().contains(String.valueOf(value))) {
            errors.add(property.name() + " must be one of: " + String.join(", ", property.allowedValues()));
        }
    }

    /**
     * One argument.
     *
     * @param name          argument key
     * @param type          JSON type
     * @param description   text shown to callers
     * @param required      whether the argument must be present
     * @param allowedValues enumeration for the value (or for each item of an array); empty for none
     */
    public record Property(String name, PropertyType type, String description, boolean required,
                           List<String> allowedValues) {

        public Property {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("name must not be null or blank");
            }
            if (type == null) {
                throw new IllegalArgumentException("type must not be null");
            }
            allowedValues = allowedValues == null ? List.of() : List.copyOf(allowedValues);
        }

        Map<String, Object> toJson() {
            Map<String, Object> json = new LinkedHashMap<>();
            json.put("type", type.value());
            if (description != null) {
                json.put("description", description);
            }
            if (!allowedValues.isEmpty()) {
                if (type == PropertyType.ARRAY) {
                    json.put("items", Map.of("type", "string", "enum", allowedValues));
                } else {
                    json.put("enum", allowedValues);
                }
            }
            return json;
        }
    }

    /**
     * Collects properties in declaration order.
     */
    public static final class Builder {

        private final Map<String, Property> properties = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder required(String name, PropertyType type, String description) {
            return add(new Property(name, type, description, true, List.of()));
        }

        public Builder optional(String name, PropertyType type, String description) {
            return add(new Property(name, type, description, false, List.of()));
        }

        /**
         * Optional string restricted to {@code allowed}.
         */
        public Builder optionalEnum(String name, List<String> allowed, String description) {
            return add(new Property(name, PropertyType.STRING, description, false, allowed));
        }

        /**
         * Optional array whose items must be members of {@code allowed}.
         */
        public Builder optionalEnumArray(String name, List<String> allowed, String description) {
            return add(new Property(name, PropertyType.ARRAY, description, false, allowed));
        }

        public Builder add(Property property) {
            if (properties.putIfAbsent(property.name(), property) != null) {
                throw new IllegalArgumentException("Duplicate property: " + property.name());
            }
            return this;
        }

        public InputSchema build() {
            return new InputSchema(new ArrayList<>(properties.values()));
        }
    }
}
