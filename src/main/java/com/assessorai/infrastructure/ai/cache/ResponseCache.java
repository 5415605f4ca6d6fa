package com.assessorai.infrastructure.ai.cache;

import com.assessorai.domain.pipeline.model.TokenUsage;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Thread-safe response store. Entries are immutable: a live entry is never
 * replaced, and an expired entry reads as a miss.
 */
@Slf4j
public class ResponseCache {

    private final Cache<CacheKey, CachedResponse> store;
    private final Duration ttl;
    private final Clock clock;
    private final CacheMetricsTracker metrics;

    public ResponseCache(long maximumSize, Duration ttl, Clock clock, CacheMetricsTracker metrics) {
        this.store = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfterWrite(ttl)
                .build();
        this.ttl = ttl;
        this.clock = clock;
        this.metrics = metrics;
    }

    public Optional<CachedResponse> lookup(CacheKey key) {
        CachedResponse entry = store.getIfPresent(key);
        if (entry == null) {
            metrics.recordMiss(false);
            return Optional.empty();
        }
        if (entry.expiredAt(clock.instant())) {
            store.asMap().remove(key, entry);
            metrics.recordMiss(true);
            log.debug("[Cache] expired entry for stage={} model={}", key.stageId(), key.modelId());
            return Optional.empty();
        }
        metrics.recordHit();
        return Optional.of(entry);
    }

    /**
     * Stores a response unless a live entry already exists for the key.
     *
     * @return the entry held by the cache after the call
     */
    public CachedResponse store(CacheKey key, String content, TokenUsage usage) {
        Instant now = clock.instant();
        CachedResponse fresh = new CachedResponse(content, usage, now, ttl);
        return store.asMap().compute(key,
                (k, existing) -> existing != null && !existing.expiredAt(now) ? existing : fresh);
    }

    public long size() {
        return store.estimatedSize();
    }
}
