package com.assessorai.domain.pipeline.model;

import java.util.List;

/**
 * Segmentation of one logical source text.
 *
 * @param segments      kept segments in source order
 * @param totalTokens   estimated tokens of the whole source
 * @param ceiling       token ceiling the plan was built for
 * @param coverageRatio unique source tokens across segments over total tokens
 * @param chunked       false when the source fit under the ceiling
 */
public record ChunkPlan(
        List<ChunkSegment> segments,
        int totalTokens,
        int ceiling,
        double coverageRatio,
        boolean chunked
) {
    public ChunkPlan {
        segments = List.copyOf(segments);
    }

    public static ChunkPlan single(int textLength, int tokens, int ceiling) {
        return new ChunkPlan(List.of(new ChunkSegment(0, 0, textLength, 0, tokens, tokens, 0)),
                tokens, ceiling, 1.0, false);
    }
}
