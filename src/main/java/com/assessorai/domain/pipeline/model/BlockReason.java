package com.assessorai.domain.pipeline.model;

public enum BlockReason {
    GATE,
    ESCALATION,
    USER_ABORT,
    STAGE_TIMEOUT,
    RUN_TIMEOUT
}
