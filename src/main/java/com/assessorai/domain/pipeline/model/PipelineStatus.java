package com.assessorai.domain.pipeline.model;

public enum PipelineStatus {
    CLASSIFYING,
    STAGE1,
    STAGE2,
    STAGE3,
    FINALIZED,
    BLOCKED,
    DEAD_LETTERED;

    public boolean terminal() {
        return this == FINALIZED || this == DEAD_LETTERED;
    }

    public StageId stage() {
        return switch (this) {
            case CLASSIFYING -> StageId.CLASSIFICATION;
            case STAGE1 -> StageId.STAGE1;
            case STAGE2 -> StageId.STAGE2;
            case STAGE3 -> StageId.STAGE3;
            default -> null;
        };
    }
}
