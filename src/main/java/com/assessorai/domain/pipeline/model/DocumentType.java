package com.assessorai.domain.pipeline.model;

/**
 * Logical role of an input document within a run.
 * Exactly one PRIMARY document is required before Stage 1 may start.
 */
public enum DocumentType {
    PRIMARY,
    SUPPORTING,
    UNKNOWN
}
