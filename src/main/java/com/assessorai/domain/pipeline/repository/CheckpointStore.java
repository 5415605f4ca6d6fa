package com.assessorai.domain.pipeline.repository;

import com.assessorai.domain.pipeline.model.PipelineState;

import java.time.Instant;
import java.util.Optional;

public interface CheckpointStore {

    /**
     * Durably writes the full state. Re-saving an unchanged state is a no-op.
     */
    void save(PipelineState state);

    /**
     * Loads the active checkpoint of a run, falling back to its archived copy.
     */
    Optional<PipelineState> load(String runId);

    /**
     * Moves a finalized run out of the active set.
     */
    void archive(PipelineState state);

    boolean delete(String runId);

    int purgeOlderThan(Instant cutoff);
}
