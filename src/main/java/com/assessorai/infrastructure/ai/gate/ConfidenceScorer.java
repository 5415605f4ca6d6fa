package com.assessorai.infrastructure.ai.gate;

import com.assessorai.domain.pipeline.model.FieldValue;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.regex.Pattern;

/**
 * Scores a payload entry from its self-reported confidence and the checks it failed.
 * penalty = min(1, errorRatio^1.35 * 1.15); an inconclusive answer loses a further 0.35.
 */
@Component
public class ConfidenceScorer {

    static final double PENALTY_EXPONENT = 1.35;
    static final double PENALTY_FACTOR = 1.15;
    static final double INCONCLUSIVE_PENALTY = 0.35;

    static final double WEIGHT_STAGE1 = 0.35;
    static final double WEIGHT_STAGE2 = 0.35;
    static final double WEIGHT_STAGE3 = 0.30;

    private static final Pattern INCONCLUSIVE = Pattern.compile(
            "(?i)\\b(inconclusiv[oe]|n[aã]o\\s+identificad[oa]|not\\s+found|unknown|indeterminad[oa])\\b");

    public double score(FieldValue value, boolean evidenceMatched, boolean referencesRecognized) {
        int failed = 0;
        if (value.evidence().isBlank()) {
            failed++;
        }
        if (!evidenceMatched) {
            failed++;
        }
        if (!referencesRecognized) {
            failed++;
        }
        double errorRatio = failed / 3.0;
        double penalty = Math.min(1.0, Math.pow(errorRatio, PENALTY_EXPONENT) * PENALTY_FACTOR);
        double score = Math.min(value.confidence(), 1.0 - penalty);
        if (inconclusive(value.content())) {
            score -= INCONCLUSIVE_PENALTY;
        }
        return clamp(score);
    }

    public boolean inconclusive(String content) {
        return content == null || content.isBlank() || INCONCLUSIVE.matcher(content).find();
    }

    public double mean(Collection<Double> scores) {
        return scores.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }

    public double global(double stage1, double stage2, double stage3) {
        return clamp(WEIGHT_STAGE1 * stage1 + WEIGHT_STAGE2 * stage2 + WEIGHT_STAGE3 * stage3);
    }

    private double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
