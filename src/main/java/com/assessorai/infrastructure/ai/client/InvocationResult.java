package com.assessorai.infrastructure.ai.client;

import com.assessorai.domain.pipeline.model.InvocationAttempt;
import com.assessorai.domain.pipeline.model.TokenUsage;

import java.util.List;

/**
 * Accepted response of an invocation.
 *
 * @param usage    tokens of every call made, superseded ones included
 * @param attempts superseded calls, oldest first
 */
public record InvocationResult(
        String content,
        String finishReason,
        TokenUsage usage,
        List<InvocationAttempt> attempts,
        String provider,
        String model
) {
    public InvocationResult {
        attempts = List.copyOf(attempts);
    }

    public int retryCount() {
        return attempts.size();
    }
}
