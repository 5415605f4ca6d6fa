package com.assessorai.infrastructure.ai.classification;

import com.assessorai.domain.pipeline.model.InputDocument;
import com.assessorai.domain.pipeline.model.RunConfiguration;

import java.time.Instant;
import java.util.Optional;

/**
 * One tier of document classification. Tiers are tried in order and the first
 * verdict at or above the confidence threshold wins.
 */
public interface ClassificationStrategy {

    String name();

    Optional<ClassificationVerdict> classify(InputDocument document, RunConfiguration config, Instant deadline);
}
