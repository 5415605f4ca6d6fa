package com.assessorai.infrastructure.ai.client;

import java.time.Duration;

/**
 * @param maxAttempts     total model calls per invocation, first one included
 * @param baseBackoff     wait after the first transient failure, doubled per attempt
 * @param maxBackoff      upper bound of a single wait
 * @param callTimeout     bound of a single provider call
 * @param maxTokensLimit  ceiling for the output budget raised after truncation
 * @param minTokenStep    minimum output budget increase after truncation
 */
public record RetryPolicy(
        int maxAttempts,
        Duration baseBackoff,
        Duration maxBackoff,
        Duration callTimeout,
        int maxTokensLimit,
        int minTokenStep
) {
    public Duration backoff(int failedAttempt) {
        long millis = baseBackoff.toMillis() << Math.min(failedAttempt - 1, 20);
        return Duration.ofMillis(Math.min(millis, maxBackoff.toMillis()));
    }

    /**
     * Output budget for the follow-up of a truncated response. Never below {@code current};
     * equal to it once the limit is reached.
     */
    public int raisedMaxTokens(int current) {
        if (current >= maxTokensLimit) {
            return current;
        }
        return Math.min(current + Math.max(minTokenStep, current / 2), maxTokensLimit);
    }
}
