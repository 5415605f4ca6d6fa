package com.assessorai.infrastructure.scheduling;

import com.assessorai.domain.pipeline.repository.CheckpointStore;
import com.assessorai.domain.pipeline.repository.DeadLetterQueue;
import com.assessorai.infrastructure.ai.cache.CacheMetricsTracker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

@Component
@RequiredArgsConstructor
@Slf4j
public class RetentionCleanupScheduler {

    private final CheckpointStore checkpointStore;
    private final DeadLetterQueue deadLetterQueue;
    private final CacheMetricsTracker cacheMetrics;
    private final Clock clock;

    @Value("${assessor.retention.checkpoint-days:7}")
    private int checkpointDays;

    @Value("${assessor.retention.dead-letter-days:30}")
    private int deadLetterDays;

    @Scheduled(fixedRateString = "${assessor.retention.interval-ms:3600000}")
    public void cleanup() {
        Instant now = clock.instant();
        int checkpoints = checkpointStore.purgeOlderThan(now.minus(Duration.ofDays(checkpointDays)));
        int deadLetters = deadLetterQueue.purgeOlderThan(now.minus(Duration.ofDays(deadLetterDays)));
        if (checkpoints > 0 || deadLetters > 0) {
            log.info("Retention cleanup removed {} checkpoint(s) and {} dead letter(s)", checkpoints, deadLetters);
        } else {
            log.debug("Retention cleanup found nothing older than {}d/{}d", checkpointDays, deadLetterDays);
        }
        cacheMetrics.logSummary();
    }
}
