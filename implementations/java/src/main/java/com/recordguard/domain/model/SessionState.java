package com.recordguard.domain.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Append-only conversation log of one session.
 *
 * <p>Owned by the pipeline orchestrator. Guardrail stages never see it.
 */
public final class SessionState {

    /**
     * One answered request and the response that was released for it.
     */
    public record Exchange(String request, String response) {}

    private final List<Exchange> exchanges = new ArrayList<>();

    public synchronized void append(String request, String response) {
        exchanges.add(new Exchange(request, response));
    }

    public synchronized List<Exchange> exchanges() {
        return List.copyOf(exchanges);
    }

    public synchronized int size() {
        return exchanges.size();
    }
}
