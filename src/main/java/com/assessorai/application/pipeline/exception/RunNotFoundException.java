package com.assessorai.application.pipeline.exception;

public class RunNotFoundException extends RuntimeException {

    public RunNotFoundException(String runId) {
        super("No checkpoint found for run " + runId);
    }
}
