package com.assessorai.infrastructure.ai.routing;

/**
 * @param contextWindow tokens the model accepts; the stage budget is a ratio of it
 */
public record ModelTarget(String provider, String model, int contextWindow) {}
