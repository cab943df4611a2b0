package com.recordguard.application.exceptions;

public class OracleUnavailableException extends CollaboratorFailureException {

    public OracleUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String collaborator() {
        return "text-oracle";
    }
}
