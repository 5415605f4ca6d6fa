package com.assessorai.infrastructure.ai.cache;

import com.assessorai.domain.pipeline.model.StageId;

/**
 * Composite response cache key. An instruction or model change yields a different key.
 */
public record CacheKey(String fingerprint, String instructionVersion, String modelId, StageId stageId) {}
