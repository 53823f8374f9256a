package com.civicgate.capability;

/**
 * Immutable description of a remote operation and the handler that performs it.
 *
 * @param name                   unique operation name
 * @param group                  owning group id
 * @param category               free-form category shown in discovery
 * @param risk                   read or write
 * @param description            text shown to callers
 * @param inputSchema            argument contract
 * @param requiresAuthentication whether the dispatcher must log in before invoking the handler
 * @param handler                the implementation
 */
public record OperationDescriptor(
        String name,
        String group,
        String category,
        RiskLevel risk,
        String description,
        InputSchema inputSchema,
        boolean requiresAuthentication,
        OperationHandler handler
) {

    public OperationDescriptor {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (group == null || group.isBlank()) {
            throw new IllegalArgumentException("group must not be null or blank");
        }
        if (risk == null) {
            throw new IllegalArgumentException("risk must not be null");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler must not be null");
        }
        category = category == null ? group : category;
        description = description == null ? "" : description;
        inputSchema = inputSchema == null ? InputSchema.empty() : inputSchema;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Builder for descriptors; unauthenticated read operations in the {@code core} group by default.
     */
    public static final class Builder {

        private final String name;
        private String group = GroupCatalog.CORE;
        private String category;
        private RiskLevel risk = RiskLevel.READ;
        private String description;
        private InputSchema inputSchema = InputSchema.empty();
        private boolean requiresAuthentication;
        private OperationHandler handler;

        private Builder(String name) {
            this.name = name;
        }

        public Builder group(String group) {
            this.group = group;
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder risk(RiskLevel risk) {
            this.risk = risk;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder inputSchema(InputSchema inputSchema) {
            this.inputSchema = inputSchema;
            return this;
        }

        public Builder requiresAuthentication(boolean requiresAuthentication) {
            this.requiresAuthentication = requiresAuthentication;
            return this;
        }

        public Builder handler(OperationHandler handler) {
            this.handler = handler;
            return this;
        }

        public OperationDescriptor build() {
            return new OperationDescriptor(name, group, category, risk, description, inputSchema,
                    requiresAuthentication, handler);
        }
    }
}
