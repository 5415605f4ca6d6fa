package com.assessorai.infrastructure.ai.stage;

import com.assessorai.domain.pipeline.model.StageId;
import com.assessorai.domain.pipeline.model.StagePayload;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Builds the user message of a stage call. The layout is deterministic so identical
 * inputs always hash to the same cache fingerprint.
 */
@Component
@RequiredArgsConstructor
public class StageRequestBuilder {

    private final ObjectMapper objectMapper;

    public String build(StageId stageId,
                        Map<StageId, StagePayload> upstream,
                        String focus,
                        String segmentLabel,
                        String source,
                        List<String> corrections) {
        StringBuilder sb = new StringBuilder();
        sb.append("STAGE: ").append(stageId.name()).append('\n');
        if (focus != null) {
            sb.append("THEME: ").append(focus).append('\n');
        }
        if (segmentLabel != null) {
            sb.append("SEGMENT: ").append(segmentLabel).append('\n');
        }
        for (StageId upstreamStage : stageId.upstream()) {
            StagePayload payload = upstream.get(upstreamStage);
            if (payload != null) {
                sb.append("\nUPSTREAM ").append(upstreamStage.name()).append(":\n")
                        .append(toJson(payload)).append('\n');
            }
        }
        sb.append("\nSOURCE:\n<<<\n").append(source).append("\n>>>\n");
        if (!corrections.isEmpty()) {
            sb.append("\nCORRECTION: the previous answer was rejected for the reasons below. ")
                    .append("Answer again with valid JSON only and quote evidence verbatim from SOURCE.\n");
            corrections.forEach(c -> sb.append("- ").append(c).append('\n'));
        }
        return sb.toString();
    }

    private String toJson(StagePayload payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + payload.stageId() + " payload", e);
        }
    }
}
