package com.assessorai.interfaces.api.dto;

import com.assessorai.domain.pipeline.model.DeadLetterRecord;
import com.assessorai.domain.pipeline.model.InvocationAttempt;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * Dead letter without the state snapshot, which stays on disk.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DeadLetterResponse(
        String runId,
        int sequence,
        String errorKind,
        String errorMessage,
        String failingStage,
        String lastStatus,
        List<RetryEntry> retryHistory,
        Instant createdAt
) {
    public record RetryEntry(int attempt, String errorKind, String finishReason, int maxTokens, String detail) {}

    public static DeadLetterResponse from(DeadLetterRecord record) {
        return new DeadLetterResponse(
                record.runId(),
                record.sequence(),
                record.errorKind().name(),
                record.errorMessage(),
                record.failingStage() == null ? null : record.failingStage().name(),
                record.snapshot() == null || record.snapshot().getStatus() == null
                        ? null : record.snapshot().getStatus().name(),
                record.retryHistory().stream().map(DeadLetterResponse::entry).toList(),
                record.createdAt());
    }

    private static RetryEntry entry(InvocationAttempt attempt) {
        return new RetryEntry(attempt.attempt(),
                attempt.errorKind() == null ? null : attempt.errorKind().name(),
                attempt.finishReason(), attempt.maxTokens(), attempt.detail());
    }
}
