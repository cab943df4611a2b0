package com.recordguard.application.exceptions;

public class RecordStoreException extends CollaboratorFailureException {

    public RecordStoreException(String message) {
        super(message, null);
    }

    public RecordStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String collaborator() {
        return "record-store";
    }
}
