package com.assessorai.domain.pipeline.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Stage 3 output: the drafted decision fields, the references it cites and
 * the literal transcript it quotes from the supporting source.
 */
public record Stage3Payload(
        Map<String, FieldValue> fields,
        List<String> citedReferences,
        String transcript
) implements StagePayload {

    public static final String DECISION_FIELD = "decision";

    public Stage3Payload {
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(fields));
        citedReferences = citedReferences == null ? List.of() : List.copyOf(citedReferences);
        transcript = transcript == null ? "" : transcript;
    }

    @Override
    public StageId stageId() {
        return StageId.STAGE3;
    }

    @Override
    public Map<String, FieldValue> entries() {
        return fields;
    }
}
