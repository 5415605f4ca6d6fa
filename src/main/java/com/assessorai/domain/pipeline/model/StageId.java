package com.assessorai.domain.pipeline.model;

import java.util.List;

/**
 * Pipeline steps in execution order. Stage N+1 may only start after
 * every stage listed in {@link #upstream()} has a PASS verdict.
 */
public enum StageId {
    CLASSIFICATION(0, Criticality.ROUTINE),
    STAGE1(1, Criticality.CRITICAL),
    STAGE2(2, Criticality.CRITICAL),
    STAGE3(3, Criticality.CRITICAL);

    private final int index;
    private final Criticality criticality;

    StageId(int index, Criticality criticality) {
        this.index = index;
        this.criticality = criticality;
    }

    public int index() {
        return index;
    }

    public Criticality criticality() {
        return criticality;
    }

    public String resourceName() {
        return name().toLowerCase();
    }

    public List<StageId> upstream() {
        return switch (this) {
            case CLASSIFICATION, STAGE1 -> List.of();
            case STAGE2 -> List.of(STAGE1);
            case STAGE3 -> List.of(STAGE1, STAGE2);
        };
    }

    public PipelineStatus runningStatus() {
        return switch (this) {
            case CLASSIFICATION -> PipelineStatus.CLASSIFYING;
            case STAGE1 -> PipelineStatus.STAGE1;
            case STAGE2 -> PipelineStatus.STAGE2;
            case STAGE3 -> PipelineStatus.STAGE3;
        };
    }

    /**
     * Status entered once this stage passes.
     */
    public PipelineStatus nextStatus() {
        return switch (this) {
            case CLASSIFICATION -> PipelineStatus.STAGE1;
            case STAGE1 -> PipelineStatus.STAGE2;
            case STAGE2 -> PipelineStatus.STAGE3;
            case STAGE3 -> PipelineStatus.FINALIZED;
        };
    }

    public static List<StageId> analysisStages() {
        return List.of(STAGE1, STAGE2, STAGE3);
    }
}
