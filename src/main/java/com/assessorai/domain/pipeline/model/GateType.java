package com.assessorai.domain.pipeline.model;

public enum GateType {
    EXTRACTION,
    CLASSIFICATION,
    COVERAGE,
    PAYLOAD,
    FIELD_EVIDENCE,
    CONFIDENCE,
    CONSENSUS,
    COHERENCE,
    UPSTREAM
}
