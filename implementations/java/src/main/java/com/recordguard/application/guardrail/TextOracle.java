package com.recordguard.application.guardrail;

/**
 * Untrusted text-completion collaborator consulted by every guardrail stage.
 *
 * <p>Implementations block until the full completion is available and throw
 * {@link com.recordguard.application.exceptions.OracleUnavailableException}
 * on failure or timeout. Output may be malformed and must never be trusted.
 */
public interface TextOracle {

    String complete(String systemInstruction, String userMessage);
}
