package com.assessorai.infrastructure.ai.classification;

import com.assessorai.domain.pipeline.model.DocumentType;
import com.assessorai.domain.pipeline.model.InputDocument;
import com.assessorai.domain.pipeline.model.RunConfiguration;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Ordered strategy chain. The first confident, typed verdict wins; when no tier is
 * confident the document stays UNKNOWN and the classification gate decides.
 */
@Slf4j
public class DocumentClassifier {

    private final List<ClassificationStrategy> strategies;

    public DocumentClassifier(List<ClassificationStrategy> strategies) {
        this.strategies = List.copyOf(strategies);
    }

    /**
     * @param verdict   the winning verdict, UNKNOWN when none was confident
     * @param consulted every verdict produced, for usage accounting
     */
    public record Classification(ClassificationVerdict verdict, List<ClassificationVerdict> consulted) {}

    public Classification classify(InputDocument document, RunConfiguration config, Instant deadline) {
        double threshold = config.thresholds().minClassificationConfidence();
        List<ClassificationVerdict> consulted = new ArrayList<>();
        for (ClassificationStrategy strategy : strategies) {
            Optional<ClassificationVerdict> verdict = strategy.classify(document, config, deadline);
            if (verdict.isEmpty()) {
                continue;
            }
            consulted.add(verdict.get());
            if (verdict.get().type() != DocumentType.UNKNOWN && verdict.get().confidence() >= threshold) {
                log.info("[Classifier] {} -> {} by {} (confidence {})", document.id(), verdict.get().type(),
                        strategy.name(), verdict.get().confidence());
                return new Classification(verdict.get(), consulted);
            }
        }
        log.warn("[Classifier] {} -> UNKNOWN, no strategy reached confidence {}", document.id(), threshold);
        double best = consulted.stream().mapToDouble(ClassificationVerdict::confidence).max().orElse(0.0);
        return new Classification(ClassificationVerdict.heuristic(DocumentType.UNKNOWN, best, "none"), consulted);
    }
}
