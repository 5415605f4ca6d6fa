package com.assessorai.infrastructure.ai.stage;

import com.assessorai.domain.pipeline.model.RunConfiguration;
import com.assessorai.domain.pipeline.model.StageId;
import com.assessorai.domain.pipeline.model.StagePayload;

import java.time.Instant;
import java.util.Map;
import java.util.function.BooleanSupplier;

/**
 * Everything a stage attempt may read. Built by the orchestrator from the run state.
 *
 * @param firstAttempt   attempt number of the first attempt made in this execution
 * @param primaryText    extracted text of the primary document
 * @param supportingText extracted text of all supporting documents, joined
 * @param upstream       passed payloads of upstream stages
 * @param deadline       earliest of the stage and run deadlines
 */
public record StageContext(
        StageId stageId,
        int firstAttempt,
        String primaryText,
        String supportingText,
        Map<StageId, StagePayload> upstream,
        RunConfiguration config,
        Instant deadline,
        BooleanSupplier abortRequested
) {
    public StageContext {
        upstream = Map.copyOf(upstream);
    }
}
