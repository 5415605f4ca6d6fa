package com.assessorai.domain.pipeline.service;

/**
 * Lookup of citation identifiers against a known reference set.
 */
public interface ReferenceTaxonomy {

    boolean isRecognized(String citationId);

    String version();
}
