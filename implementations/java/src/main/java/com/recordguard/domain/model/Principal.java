package com.recordguard.domain.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * The party on whose behalf a guarded session runs.
 *
 * <p>Created once at session start from the record store and never mutated.
 * Only these fields may be substituted into stage instructions.
 *
 * @since 1.0.0
 */
@Value
@Builder
public class Principal {
    long id;
    @NonNull String identityString;
    @NonNull String displayName;
    @NonNull CapabilityLevel capabilityLevel;
}
