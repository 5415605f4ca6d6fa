package com.assessorai.domain.pipeline.model;

import java.util.List;

/**
 * Why a run stopped in BLOCKED. {@code gate} is null for aborts and timeouts.
 */
public record BlockInfo(BlockReason reason, StageId stage, GateType gate, List<String> details) {

    public BlockInfo {
        details = details == null ? List.of() : List.copyOf(details);
    }

    public static BlockInfo gate(StageId stage, GateOutcome outcome) {
        return new BlockInfo(BlockReason.GATE, stage, outcome.gate(), outcome.reasons());
    }
}
