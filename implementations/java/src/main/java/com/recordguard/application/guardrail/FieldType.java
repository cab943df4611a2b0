package com.recordguard.application.guardrail;

/**
 * Parse rules a verdict field can carry.
 */
public enum FieldType {
    /** True only on an explicit {@code true} token; false otherwise. */
    BOOLEAN,
    /** Free text, trimmed. */
    TEXT,
    /** Bracketed, comma-separated tokens. */
    STRING_SET,
    /** Free text where {@code null} or empty means absent. */
    NULLABLE_STRING
}
