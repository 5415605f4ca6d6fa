package com.assessorai.application.pipeline.exception;

public class RunNotResumableException extends RuntimeException {

    public RunNotResumableException(String message) {
        super(message);
    }
}
