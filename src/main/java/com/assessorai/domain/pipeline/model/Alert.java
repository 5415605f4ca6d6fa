package com.assessorai.domain.pipeline.model;

import java.time.Instant;

/**
 * Non-fatal observation recorded on the run.
 */
public record Alert(String code, String message, StageId stage, Instant at) {}
