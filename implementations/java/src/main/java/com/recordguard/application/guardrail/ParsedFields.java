package com.recordguard.application.guardrail;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Field values extracted from one oracle response, keyed by field name.
 *
 * <p>Missing booleans read as false, missing sets as empty, missing
 * nullable strings as {@code null}.
 */
public final class ParsedFields {

    private final Map<String, Object> values;

    private ParsedFields(Map<String, Object> values) {
        this.values = values;
    }

    public boolean flag(String name) {
        return Boolean.TRUE.equals(values.get(name));
    }

    public String text(String name) {
        Object value = values.get(name);
        return value != null ? value.toString() : null;
    }

    @SuppressWarnings("unchecked")
    public Set<String> set(String name) {
        Object value = values.get(name);
        return value instanceof Set ? (Set<String>) value : Set.of();
    }

    public String nullable(String name) {
        return text(name);
    }

    /**
     * All-restrictive values for the given fields, with every text field set
     * to {@code reason}.
     */
    static ParsedFields defaults(List<FieldSpec> fields, String reason) {
        Builder builder = builder();
        for (FieldSpec field : fields) {
            switch (field.type()) {
                case BOOLEAN -> builder.flag(field.name(), false);
                case TEXT -> builder.text(field.name(), reason);
                case STRING_SET -> builder.set(field.name(), Set.of());
                case NULLABLE_STRING -> builder.nullable(field.name(), null);
            }
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private final Map<String, Object> values = new HashMap<>();

        public Builder flag(String name, boolean value) {
            values.put(name, value);
            return this;
        }

        public Builder text(String name, String value) {
            values.put(name, value);
            return this;
        }

        public Builder set(String name, Set<String> value) {
            values.put(name, value != null ? Set.copyOf(value) : Set.of());
            return this;
        }

        public Builder nullable(String name, String value) {
            values.put(name, value);
            return this;
        }

        Builder put(String name, Object value) {
            values.put(name, value);
            return this;
        }

        public ParsedFields build() {
            return new ParsedFields(new HashMap<>(values));
        }
    }
}
