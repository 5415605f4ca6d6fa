package com.assessorai.domain.pipeline.model;

import java.util.List;

/**
 * One entry of a stage payload.
 *
 * @param content    the model's answer for this field or theme
 * @param evidence   verbatim excerpt from the source backing the answer
 * @param confidence self-reported confidence in [0,1]
 * @param references citation identifiers used by the answer
 */
public record FieldValue(
        String content,
        String evidence,
        double confidence,
        List<String> references
) {
    public FieldValue {
        content = content == null ? "" : content;
        evidence = evidence == null ? "" : evidence;
        confidence = Math.max(0.0, Math.min(1.0, confidence));
        references = references == null ? List.of() : List.copyOf(references);
    }

    public static FieldValue incomplete() {
        return new FieldValue("", "", 0.0, List.of());
    }
}
