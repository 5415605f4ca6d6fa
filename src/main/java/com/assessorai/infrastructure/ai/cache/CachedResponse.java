package com.assessorai.infrastructure.ai.cache;

import com.assessorai.domain.pipeline.model.TokenUsage;

import java.time.Duration;
import java.time.Instant;

public record CachedResponse(String content, TokenUsage originalUsage, Instant createdAt, Duration ttl) {

    public boolean expiredAt(Instant now) {
        return !now.isBefore(createdAt.plus(ttl));
    }
}
