package com.assessorai.infrastructure.ai.classification;

import com.assessorai.domain.pipeline.model.DocumentType;
import com.assessorai.domain.pipeline.model.TokenUsage;

/**
 * @param usage   tokens spent reaching the verdict; zero for heuristics
 * @param modelId model that answered, null for heuristics
 */
public record ClassificationVerdict(DocumentType type, double confidence, String strategy, TokenUsage usage,
                                    String modelId) {

    public static ClassificationVerdict heuristic(DocumentType type, double confidence, String strategy) {
        return new ClassificationVerdict(type, confidence, strategy, TokenUsage.ZERO, null);
    }
}
