package com.recordguard.domain.model;

import lombok.NonNull;
import lombok.Value;

/**
 * Authorization and safety fields returned by a single-pass oracle call.
 */
@Value
public class CombinedVerdict {
    @NonNull AuthorizationVerdict authorization;
    @NonNull SafetyVerdict safety;
}
