package com.assessorai.domain.pipeline.repository;

import com.assessorai.domain.pipeline.model.DeadLetterRecord;

import java.time.Instant;
import java.util.List;

/**
 * Append-only store of fatal failures. Records are never updated.
 */
public interface DeadLetterQueue {

    /**
     * @return the stored record with its assigned sequence number
     */
    DeadLetterRecord append(DeadLetterRecord record);

    List<DeadLetterRecord> findByRunId(String runId);

    int purgeOlderThan(Instant cutoff);
}
