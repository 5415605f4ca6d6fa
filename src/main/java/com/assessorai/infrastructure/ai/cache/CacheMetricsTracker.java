package com.assessorai.infrastructure.ai.cache;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-wide response cache hit/miss counters.
 */
@Slf4j
@Component
public class CacheMetricsTracker {

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong expired = new AtomicLong();

    public void recordHit() {
        hits.incrementAndGet();
    }

    public void recordMiss(boolean dueToExpiry) {
        misses.incrementAndGet();
        if (dueToExpiry) {
            expired.incrementAndGet();
        }
    }

    public long hits() {
        return hits.get();
    }

    public long misses() {
        return misses.get();
    }

    public long expired() {
        return expired.get();
    }

    public double hitRate() {
        long total = hits.get() + misses.get();
        return total == 0 ? 0.0 : (double) hits.get() / total;
    }

    public void logSummary() {
        log.info("Response cache - hits: {}, misses: {} (expired: {}), hit rate: {}%",
                hits.get(), misses.get(), expired.get(), String.format("%.1f", hitRate() * 100));
    }
}
