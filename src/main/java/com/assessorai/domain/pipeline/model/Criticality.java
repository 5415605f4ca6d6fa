package com.assessorai.domain.pipeline.model;

public enum Criticality {
    ROUTINE,
    CRITICAL
}
