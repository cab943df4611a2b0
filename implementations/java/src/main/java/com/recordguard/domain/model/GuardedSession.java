package com.recordguard.domain.model;

import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * A conversation between one principal and the guarded pipeline.
 */
@Getter
@RequiredArgsConstructor
public class GuardedSession {

    @NonNull private final UUID sessionId;
    @NonNull private final Principal principal;
    @NonNull private final Instant startedAt;
    private final SessionState state = new SessionState();

    public static GuardedSession start(Principal principal) {
        return new GuardedSession(UUID.randomUUID(), principal, Instant.now());
    }
}
