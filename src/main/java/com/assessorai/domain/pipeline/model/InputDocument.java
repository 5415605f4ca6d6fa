package com.assessorai.domain.pipeline.model;

import java.util.List;

/**
 * One input of a run.
 *
 * @param id                       run-local identifier
 * @param rawRef                   location of the raw bytes (path or URI)
 * @param type                     logical type, UNKNOWN until classified
 * @param extractedText            text produced by the extraction collaborator (nullable before extraction)
 * @param pageCount                number of pages reported by extraction
 * @param perPageQuality           quality signal in [0,1] per page
 * @param classifiedBy             name of the strategy that fixed the type (null while unclassified)
 * @param classificationConfidence confidence reported by that strategy
 */
public record InputDocument(
        String id,
        String rawRef,
        DocumentType type,
        String extractedText,
        int pageCount,
        List<Double> perPageQuality,
        String classifiedBy,
        double classificationConfidence
) {
    public InputDocument {
        perPageQuality = perPageQuality == null ? List.of() : List.copyOf(perPageQuality);
        type = type == null ? DocumentType.UNKNOWN : type;
    }

    public static InputDocument unclassified(String id, String rawRef) {
        return new InputDocument(id, rawRef, DocumentType.UNKNOWN, null, 0, List.of(), null, 0.0);
    }

    public boolean extracted() {
        return extractedText != null;
    }

    public boolean classified() {
        return classifiedBy != null;
    }

    /**
     * Mean page quality; a document without pages scores zero.
     */
    public double qualityScore() {
        return perPageQuality.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }

    public InputDocument withExtraction(String text, int pages, List<Double> quality) {
        if (extracted()) {
            throw new IllegalStateException("Document " + id + " already extracted");
        }
        return new InputDocument(id, rawRef, type, text, pages, quality, classifiedBy, classificationConfidence);
    }

    public InputDocument withClassification(DocumentType newType, String strategy, double confidence) {
        if (classified()) {
            throw new IllegalStateException("Document " + id + " already classified as " + type);
        }
        return new InputDocument(id, rawRef, newType, extractedText, pageCount, perPageQuality, strategy, confidence);
    }
}
