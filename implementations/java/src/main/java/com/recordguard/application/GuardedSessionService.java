package com.recordguard.application;

import com.github.benmanes.caffeine.cache.Cache;
import com.recordguard.application.exceptions.PrincipalNotFoundException;
import com.recordguard.application.exceptions.SessionNotFoundException;
import com.recordguard.domain.model.GuardedSession;
import com.recordguard.domain.model.PipelineResult;
import com.recordguard.domain.model.Principal;
import com.recordguard.domain.model.SessionState;
import com.recordguard.domain.repository.PrincipalRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Session lifecycle for hosts: the principal is looked up once when the
 * session starts and stays fixed until it ends or expires.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GuardedSessionService {

    private final PrincipalRepository principalRepository;
    private final PipelineOrchestrator orchestrator;
    private final Cache<UUID, GuardedSession> sessionCache;

    /**
     * Start a session for the given principal, or for any principal in the
     * store when {@code principalId} is null.
     */
    public GuardedSession startSession(Long principalId) {
        Optional<Principal> principal = principalId != null
            ? principalRepository.findById(principalId)
            : principalRepository.findAny();
        GuardedSession session = GuardedSession.start(principal.orElseThrow(() -> new PrincipalNotFoundException(
            principalId != null ? "Principal not found: " + principalId : "No principal available")));
        sessionCache.put(session.getSessionId(), session);
        log.info("Session {} started for principal {}", session.getSessionId(), session.getPrincipal().getId());
        return session;
    }

    public GuardedSession getSession(UUID sessionId) {
        GuardedSession session = sessionCache.getIfPresent(sessionId);
        if (session == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return session;
    }

    public PipelineResult submit(UUID sessionId, String request) {
        GuardedSession session = getSession(sessionId);
        PipelineResult result = orchestrator.handle(session, request);
        log.info("Session {} request finished: outcome={}", sessionId, result.getOutcome());
        return result;
    }

    public List<SessionState.Exchange> history(UUID sessionId) {
        return getSession(sessionId).getState().exchanges();
    }

    public void endSession(UUID sessionId) {
        getSession(sessionId);
        sessionCache.invalidate(sessionId);
        log.info("Session {} ended", sessionId);
    }
}
