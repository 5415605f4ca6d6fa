package com.assessorai.infrastructure.ai.orchestration;

import com.assessorai.domain.pipeline.model.StageId;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One {@code PIPELINE_EVENT {json}} line per transition, for log-based dashboards.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PipelineEventLogger {

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public void emit(String runId, StageId stage, String event, Map<String, ?> extras) {
        Map<String, Object> line = new LinkedHashMap<>();
        line.put("ts", clock.instant().toString());
        line.put("runId", runId);
        line.put("stage", stage);
        line.put("event", event);
        if (extras != null) {
            line.putAll(extras);
        }
        try {
            log.info("PIPELINE_EVENT {}", objectMapper.writeValueAsString(line));
        } catch (JsonProcessingException e) {
            log.warn("PIPELINE_EVENT run={} stage={} event={} (extras not serializable: {})",
                    runId, stage, event, e.getOriginalMessage());
        }
    }

    public void emit(String runId, StageId stage, String event) {
        emit(runId, stage, event, Map.of());
    }
}
