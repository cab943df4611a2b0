package com.recordguard.domain.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Fixed taxonomy of record attributes that need extra handling even when
 * the owning principal asks for them.
 */
public enum SensitiveField {
    SSN("ssn"),
    PHONE_NUMBER("phone_number"),
    ADDRESS("address"),
    DATE_OF_BIRTH("date_of_birth");

    private final String column;

    SensitiveField(String column) {
        this.column = column;
    }

    public String getColumn() {
        return column;
    }

    /**
     * Resolve a column name (case-insensitive, optionally table-qualified).
     */
    public static Optional<SensitiveField> fromColumn(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        int dot = normalized.lastIndexOf('.');
        String bare = dot >= 0 ? normalized.substring(dot + 1) : normalized;
        return Arrays.stream(values())
            .filter(field -> field.column.equals(bare))
            .findFirst();
    }
}
