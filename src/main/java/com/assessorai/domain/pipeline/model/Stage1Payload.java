package com.assessorai.domain.pipeline.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Stage 1 output: fields extracted from the primary document plus the
 * list of themes it raises, which drives the Stage 2 fan-out.
 */
public record Stage1Payload(Map<String, FieldValue> fields, List<String> themes) implements StagePayload {

    public Stage1Payload {
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(fields));
        themes = themes == null ? List.of() : List.copyOf(themes);
    }

    @Override
    public StageId stageId() {
        return StageId.STAGE1;
    }

    @Override
    public Map<String, FieldValue> entries() {
        return fields;
    }
}
