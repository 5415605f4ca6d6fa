package com.assessorai.domain.pipeline.model;

import java.time.Instant;
import java.util.List;

/**
 * Write-once diagnostic record of a fatal failure.
 *
 * @param sequence     per-run suffix assigned by the queue on append
 * @param snapshot     full state at failure time
 * @param errorMessage sanitized error description, never raw provider text
 * @param retryHistory model calls of the failing stage that were retried or superseded
 */
public record DeadLetterRecord(
        int schemaVersion,
        String runId,
        int sequence,
        PipelineState snapshot,
        ErrorKind errorKind,
        String errorMessage,
        StageId failingStage,
        List<InvocationAttempt> retryHistory,
        Instant createdAt
) {
    public DeadLetterRecord {
        retryHistory = retryHistory == null ? List.of() : List.copyOf(retryHistory);
    }

    public DeadLetterRecord withSequence(int newSequence) {
        return new DeadLetterRecord(schemaVersion, runId, newSequence, snapshot, errorKind, errorMessage,
                failingStage, retryHistory, createdAt);
    }
}
