package com.recordguard.application.guardrail;

import lombok.NonNull;

/**
 * One expected {@code key: value} line of an oracle response.
 */
public record FieldSpec(@NonNull String name, @NonNull FieldType type) {

    public static FieldSpec bool(String name) {
        return new FieldSpec(name, FieldType.BOOLEAN);
    }

    public static FieldSpec text(String name) {
        return new FieldSpec(name, FieldType.TEXT);
    }

    public static FieldSpec stringSet(String name) {
        return new FieldSpec(name, FieldType.STRING_SET);
    }

    public static FieldSpec nullable(String name) {
        return new FieldSpec(name, FieldType.NULLABLE_STRING);
    }
}
