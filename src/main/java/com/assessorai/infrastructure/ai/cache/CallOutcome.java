package com.assessorai.infrastructure.ai.cache;

import com.assessorai.domain.pipeline.model.InvocationAttempt;
import com.assessorai.domain.pipeline.model.TokenUsage;

import java.util.List;

/**
 * One model answer, either fresh from the client or served from the cache.
 *
 * @param usage tokens billed by this call; zero for cache hits
 */
public record CallOutcome(
        CacheKey key,
        String content,
        TokenUsage usage,
        List<InvocationAttempt> attempts,
        boolean fromCache,
        String provider,
        String model
) {
    public CallOutcome {
        attempts = List.copyOf(attempts);
    }
}
