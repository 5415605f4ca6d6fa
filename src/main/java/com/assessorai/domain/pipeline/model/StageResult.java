package com.assessorai.domain.pipeline.model;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one stage attempt. A retry produces a new StageResult;
 * earlier attempts stay in {@link PipelineState#getAttempts()}.
 *
 * @param stageId            stage this attempt belongs to
 * @param attempt            1-based attempt number within the stage
 * @param payload            parsed payload, null when the response could not be parsed
 * @param rawResponses       raw model contents that produced the payload (one per call)
 * @param usage              tokens billed for this attempt, superseded calls included
 * @param retryCount         model-level retries absorbed by the client
 * @param verdict            combined gate verdict
 * @param gates              individual gate outcomes
 * @param escalations        items queued for human review
 * @param confidence         mean scored confidence of the payload entries
 * @param invocationAttempts superseded model calls (truncated or failed)
 * @param modelId            model that answered
 * @param instructionVersion version of the instruction set used
 * @param cacheHits          calls served from the response cache
 * @param errorKind          failure class when the attempt did not produce a usable payload
 * @param createdAt          when the attempt finished
 */
public record StageResult(
        StageId stageId,
        int attempt,
        StagePayload payload,
        List<String> rawResponses,
        TokenUsage usage,
        int retryCount,
        GateVerdict verdict,
        List<GateOutcome> gates,
        List<String> escalations,
        double confidence,
        List<InvocationAttempt> invocationAttempts,
        String modelId,
        String instructionVersion,
        int cacheHits,
        ErrorKind errorKind,
        Instant createdAt
) {
    public StageResult {
        rawResponses = rawResponses == null ? List.of() : List.copyOf(rawResponses);
        gates = gates == null ? List.of() : List.copyOf(gates);
        escalations = escalations == null ? List.of() : List.copyOf(escalations);
        invocationAttempts = invocationAttempts == null ? List.of() : List.copyOf(invocationAttempts);
        usage = usage == null ? TokenUsage.ZERO : usage;
    }

    public boolean passed() {
        return verdict == GateVerdict.PASS;
    }

    public StageResult withVerdict(GateVerdict newVerdict) {
        return new StageResult(stageId, attempt, payload, rawResponses, usage, retryCount, newVerdict, gates,
                escalations, confidence, invocationAttempts, modelId, instructionVersion, cacheHits, errorKind,
                createdAt);
    }
}
