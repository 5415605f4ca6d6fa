package com.assessorai.domain.pipeline.model;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Result of run or resume as seen from outside the core.
 */
public record RunReport(
        String runId,
        RunOutcome outcome,
        int exitCode,
        PipelineStatus status,
        BlockInfo block,
        ErrorKind errorKind,
        String message,
        Map<StageId, StagePayload> results,
        List<Alert> alerts,
        List<String> escalations,
        Double globalConfidence,
        long promptTokens,
        long completionTokens,
        double estimatedCostUsd
) {

    public static RunReport of(PipelineState state, ErrorKind errorKind, String message) {
        RunOutcome outcome = switch (state.getStatus()) {
            case FINALIZED -> RunOutcome.FINALIZED;
            case DEAD_LETTERED -> RunOutcome.DEAD_LETTERED;
            default -> RunOutcome.BLOCKED;
        };
        Map<StageId, StagePayload> payloads = new EnumMap<>(StageId.class);
        state.getResults().forEach((stage, result) -> {
            if (result.passed() && result.payload() != null) {
                payloads.put(stage, result.payload());
            }
        });
        return new RunReport(state.getRunId(), outcome, outcome.exitCode(), state.getStatus(), state.getBlock(),
                errorKind, message, payloads, List.copyOf(state.getAlerts()), List.copyOf(state.getEscalations()),
                state.getGlobalConfidence(), state.getPromptTokens(), state.getCompletionTokens(),
                state.getEstimatedCostUsd());
    }
}
