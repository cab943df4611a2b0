package com.recordguard.domain.model;

/**
 * Capability levels a principal can hold for the session lifetime.
 */
public enum CapabilityLevel {
    UNAUTHORIZED,
    BASIC,
    ADMIN
}
