package com.assessorai.domain.pipeline.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Structured result of an analysis stage. One variant per stage,
 * selected by stage id, never by inspecting the response shape.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Stage1Payload.class, name = "stage1"),
        @JsonSubTypes.Type(value = Stage2Payload.class, name = "stage2"),
        @JsonSubTypes.Type(value = Stage3Payload.class, name = "stage3")
})
public interface StagePayload {

    StageId stageId();

    /**
     * Field or theme entries keyed by name.
     */
    Map<String, FieldValue> entries();

    default Set<String> allReferences() {
        Set<String> refs = new LinkedHashSet<>();
        entries().values().forEach(v -> refs.addAll(v.references()));
        return refs;
    }
}
