package com.assessorai.domain.pipeline.model;

import lombok.Builder;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Per-run knobs: budgets, gate thresholds, escalation and consensus policy, timeouts.
 */
@Builder(toBuilder = true)
public record RunConfiguration(
        String profile,
        Map<StageId, Double> budgetRatios,
        int chunkOverlapTokens,
        int maxSegments,
        Map<StageId, Integer> maxOutputTokens,
        double temperature,
        GateThresholds thresholds,
        Map<StageId, List<String>> criticalFields,
        boolean validateReferences,
        int maxStageAttempts,
        EscalationPolicy escalation,
        ConsensusPolicy consensus,
        boolean parallelThemes,
        Duration workerTimeout,
        Duration stageTimeout,
        Duration runTimeout
) {

    private static final double DEFAULT_BUDGET_RATIO = 0.7;
    private static final int DEFAULT_MAX_OUTPUT_TOKENS = 1024;

    public double budgetRatio(StageId stageId) {
        return budgetRatios == null ? DEFAULT_BUDGET_RATIO : budgetRatios.getOrDefault(stageId, DEFAULT_BUDGET_RATIO);
    }

    public int maxOutputTokens(StageId stageId) {
        return maxOutputTokens == null
                ? DEFAULT_MAX_OUTPUT_TOKENS
                : maxOutputTokens.getOrDefault(stageId, DEFAULT_MAX_OUTPUT_TOKENS);
    }

    public List<String> criticalFields(StageId stageId) {
        return criticalFields == null ? List.of() : criticalFields.getOrDefault(stageId, List.of());
    }

    /**
     * @param minExtractionQuality        minimum mean page quality of a document
     * @param maxNoiseRatio               maximum share of non-text characters
     * @param minSupportingDocuments      supporting documents required next to the primary one
     * @param minCoverageRatio            minimum chunk coverage
     * @param minClassificationConfidence a strategy verdict below this falls through to the next strategy
     * @param fieldConfidence             escalation threshold for stage 1 and 3 fields
     * @param themeConfidence             escalation threshold for stage 2 themes
     * @param globalConfidence            escalation threshold for the weighted run score
     */
    public record GateThresholds(
            double minExtractionQuality,
            double maxNoiseRatio,
            int minSupportingDocuments,
            double minCoverageRatio,
            double minClassificationConfidence,
            double fieldConfidence,
            double themeConfidence,
            double globalConfidence
    ) {}

    public record EscalationPolicy(boolean blockOnEscalation) {}

    public record ConsensusPolicy(boolean enabled, TieBreak tieBreak) {

        public enum TieBreak {
            PREFER_HIGHER_CONFIDENCE,
            ESCALATE
        }

        public static ConsensusPolicy disabled() {
            return new ConsensusPolicy(false, TieBreak.PREFER_HIGHER_CONFIDENCE);
        }
    }
}
