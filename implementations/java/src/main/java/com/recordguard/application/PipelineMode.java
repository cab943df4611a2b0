package com.recordguard.application;

public enum PipelineMode {
    /** Separate authorization and safety oracle calls. */
    LAYERED,
    /** One oracle call answers authorization and safety together. */
    COMBINED
}
