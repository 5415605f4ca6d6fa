package com.assessorai.infrastructure.ai.stage;

import com.assessorai.domain.pipeline.model.ChunkPlan;
import com.assessorai.domain.pipeline.model.GateOutcome;
import com.assessorai.domain.pipeline.model.GateType;
import com.assessorai.domain.pipeline.model.GateVerdict;
import com.assessorai.domain.pipeline.model.StageResult;

import java.util.List;

/**
 * Attempts made for one stage in one orchestrator pass, oldest first.
 *
 * @param chunkPlan plan of the stage source, null when planning was not reached
 * @param aborted   true when an abort request stopped the stage between attempts
 */
public record StageExecution(List<StageResult> attempts, ChunkPlan chunkPlan, boolean aborted) {

    public StageExecution {
        attempts = List.copyOf(attempts);
    }

    public StageResult last() {
        return attempts.isEmpty() ? null : attempts.get(attempts.size() - 1);
    }

    /**
     * Gate that stopped the last attempt: the first blocking one, else the first retryable one,
     * else the advisory confidence outcome.
     */
    public GateOutcome blockingGate() {
        StageResult last = last();
        if (last == null) {
            return GateOutcome.pass(GateType.PAYLOAD);
        }
        return last.gates().stream().filter(g -> g.verdict() == GateVerdict.BLOCK).findFirst()
                .or(() -> last.gates().stream().filter(g -> g.verdict() == GateVerdict.RETRY).findFirst())
                .or(() -> last.gates().stream().filter(g -> g.verdict() == GateVerdict.ESCALATE).findFirst())
                .orElse(GateOutcome.pass(GateType.PAYLOAD));
    }
}
