package com.assessorai.domain.pipeline.service;

import com.assessorai.domain.pipeline.model.InputDocument;

import java.util.List;

/**
 * Turns a raw input into text plus a per-page quality signal.
 */
public interface ExtractionService {

    ExtractedText extract(InputDocument document);

    record ExtractedText(String text, List<Double> perPageQuality, int pageCount) {}
}
