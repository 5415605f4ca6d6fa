package com.assessorai.infrastructure.ai.stage;

import com.assessorai.domain.pipeline.model.FieldValue;
import com.assessorai.domain.pipeline.model.Stage1Payload;
import com.assessorai.domain.pipeline.model.Stage2Payload;
import com.assessorai.domain.pipeline.model.Stage3Payload;
import com.assessorai.domain.pipeline.model.StageId;
import com.assessorai.domain.pipeline.model.StagePayload;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses a model answer into the payload variant of its stage.
 *
 * <pre>
 * stage1: {"fields": {name: entry}, "themes": [..]}
 * stage2: {"themes": {id: entry}}
 * stage3: {"fields": {name: entry}, "citedReferences": [..], "transcript": ".."}
 * entry:  {"content", "evidence", "confidence", "references": [..]}
 * </pre>
 */
@Component
@RequiredArgsConstructor
public class StagePayloadParser {

    private final ObjectMapper objectMapper;

    public StagePayload parse(StageId stageId, String content, Collection<String> requiredFields) {
        JsonNode root = readObject(content);
        return switch (stageId) {
            case STAGE1 -> new Stage1Payload(
                    requireEntries(root, "fields", requiredFields), stringList(root.path("themes")));
            case STAGE2 -> {
                Map<String, FieldValue> themes = requireEntries(root, "themes", requiredFields);
                if (themes.isEmpty()) {
                    throw new PayloadValidationException("object 'themes' is empty");
                }
                yield new Stage2Payload(themes);
            }
            case STAGE3 -> new Stage3Payload(
                    requireEntries(root, "fields", requiredFields),
                    stringList(root.path("citedReferences")),
                    root.path("transcript").asText(""));
            case CLASSIFICATION -> throw new IllegalArgumentException("Classification has no stage payload");
        };
    }

    /**
     * Parses the outermost JSON object of a model answer, tolerating markdown fences and prose around it.
     */
    public JsonNode readObject(String content) {
        if (content == null || content.isBlank()) {
            throw new PayloadValidationException("empty response");
        }
        int start = content.indexOf('{');
        int end = content.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new PayloadValidationException("response contains no JSON object");
        }
        try {
            JsonNode node = objectMapper.readTree(content.substring(start, end + 1));
            if (!node.isObject()) {
                throw new PayloadValidationException("response is not a JSON object");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new PayloadValidationException("malformed JSON: " + e.getOriginalMessage(), e);
        }
    }

    private Map<String, FieldValue> requireEntries(JsonNode root, String name, Collection<String> requiredFields) {
        JsonNode node = root.get(name);
        if (node == null || !node.isObject()) {
            throw new PayloadValidationException("missing object '" + name + "'");
        }
        Map<String, FieldValue> entries = new LinkedHashMap<>();
        node.fields().forEachRemaining(e -> entries.put(e.getKey(), toFieldValue(e.getValue())));

        List<String> missing = requiredFields.stream().filter(f -> !entries.containsKey(f)).toList();
        if (!missing.isEmpty()) {
            throw new PayloadValidationException("missing required field(s) " + missing + " in '" + name + "'");
        }
        return entries;
    }

    private FieldValue toFieldValue(JsonNode node) {
        if (node.isTextual()) {
            return new FieldValue(node.asText(), "", 0.0, List.of());
        }
        return new FieldValue(
                node.path("content").asText(""),
                node.path("evidence").asText(""),
                node.path("confidence").asDouble(0.0),
                stringList(node.path("references")));
    }

    private List<String> stringList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(n -> {
                String text = n.asText("").trim();
                if (!text.isEmpty()) {
                    values.add(text);
                }
            });
        }
        return values;
    }
}
