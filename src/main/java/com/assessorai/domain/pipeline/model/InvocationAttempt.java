package com.assessorai.domain.pipeline.model;

import java.time.Instant;

/**
 * A superseded model call kept for audit. Truncated attempts keep their partial content.
 */
public record InvocationAttempt(
        int attempt,
        ErrorKind errorKind,
        String finishReason,
        int maxTokens,
        String content,
        String detail,
        TokenUsage usage,
        Instant at
) {}
