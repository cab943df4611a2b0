package com.recordguard.application.exceptions;

import lombok.Getter;

import java.util.UUID;

@Getter
public class SessionNotFoundException extends RuntimeException {

    private final UUID sessionId;

    public SessionNotFoundException(UUID sessionId) {
        super("Session not found or expired: " + sessionId);
        this.sessionId = sessionId;
    }
}
