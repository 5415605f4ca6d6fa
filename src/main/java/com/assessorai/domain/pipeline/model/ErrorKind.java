package com.assessorai.domain.pipeline.model;

/**
 * Failure classes. TRANSIENT and TRUNCATION are absorbed by the model client
 * until its retry budget runs out.
 */
public enum ErrorKind {
    TRANSIENT,
    TRUNCATION,
    VALIDATION,
    GATE_FAILURE,
    FATAL
}
