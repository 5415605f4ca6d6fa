package com.assessorai.domain.pipeline.model;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

public record Stage2Payload(Map<String, FieldValue> themes) implements StagePayload {

    public Stage2Payload {
        themes = themes == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(themes));
    }

    @Override
    public StageId stageId() {
        return StageId.STAGE2;
    }

    @Override
    public Map<String, FieldValue> entries() {
        return themes;
    }
}
