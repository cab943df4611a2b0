package com.recordguard.domain.model;

/**
 * States a single request passes through in the guarded pipeline.
 */
public enum PipelineState {
    RECEIVED,
    AUTHORIZING,
    DENIED(true),
    AUTHORIZED,
    VERIFYING_SAFETY,
    BLOCKED(true),
    VERIFIED,
    EXECUTING,
    ANSWERING_OPENLY,
    SANITIZING,
    RESPONDED(true),
    ERRORED(true);

    private final boolean terminal;

    PipelineState() {
        this(false);
    }

    PipelineState(boolean terminal) {
        this.terminal = terminal;
    }

    public boolean isTerminal() {
        return terminal;
    }
}
