package com.assessorai.infrastructure.ai.routing;

import com.assessorai.domain.pipeline.model.Criticality;
import com.assessorai.domain.pipeline.model.StageId;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Picks the provider and model for a stage attempt. Stateless.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ModelRouter {

    private final RoutingTable table;

    public ModelTarget route(StageId stageId) {
        return route(stageId, stageId.criticality());
    }

    public ModelTarget route(StageId stageId, Criticality criticality) {
        ModelTarget override = table.overrides().get(stageId);
        if (override != null) {
            log.debug("[Router] {} -> {}/{} (stage override)", stageId, override.provider(), override.model());
            return override;
        }
        ModelTarget target = table.byCriticality().get(criticality);
        if (target == null) {
            throw new IllegalStateException("No model configured for criticality " + criticality);
        }
        log.debug("[Router] {} ({}) -> {}/{}", stageId, criticality, target.provider(), target.model());
        return target;
    }
}
