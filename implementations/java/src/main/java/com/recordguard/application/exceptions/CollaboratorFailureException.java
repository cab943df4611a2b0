package com.recordguard.application.exceptions;

/**
 * An external collaborator (text oracle or record store) raised, timed out
 * or returned an error. Always retryable by the requester.
 */
public abstract class CollaboratorFailureException extends RuntimeException {

    protected CollaboratorFailureException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Short collaborator name used in audit records.
     */
    public abstract String collaborator();
}
