package com.recordguard.interfaces.api.dto;

import com.recordguard.domain.model.GuardedSession;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionResponse {

    private UUID sessionId;
    private long principalId;
    private String displayName;
    private Instant startedAt;

    public static SessionResponse from(GuardedSession session) {
        return SessionResponse.builder()
            .sessionId(session.getSessionId())
            .principalId(session.getPrincipal().getId())
            .displayName(session.getPrincipal().getDisplayName())
            .startedAt(session.getStartedAt())
            .build();
    }
}
