package com.assessorai.infrastructure.persistence;

public class PipelineStorageException extends RuntimeException {

    public PipelineStorageException(String message) {
        super(message);
    }

    public PipelineStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
