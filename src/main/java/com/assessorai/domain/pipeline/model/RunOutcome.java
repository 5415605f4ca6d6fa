package com.assessorai.domain.pipeline.model;

/**
 * Result classes at the core boundary, with their process exit codes.
 */
public enum RunOutcome {
    FINALIZED(0),
    BLOCKED(1),
    DEAD_LETTERED(2);

    private final int exitCode;

    RunOutcome(int exitCode) {
        this.exitCode = exitCode;
    }

    public int exitCode() {
        return exitCode;
    }
}
