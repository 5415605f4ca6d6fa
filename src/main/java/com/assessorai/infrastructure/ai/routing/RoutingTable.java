package com.assessorai.infrastructure.ai.routing;

import com.assessorai.domain.pipeline.model.Criticality;
import com.assessorai.domain.pipeline.model.StageId;

import java.util.Map;

/**
 * Static routing configuration: one target per criticality class plus optional per-stage overrides.
 */
public record RoutingTable(Map<Criticality, ModelTarget> byCriticality, Map<StageId, ModelTarget> overrides) {

    public RoutingTable {
        byCriticality = Map.copyOf(byCriticality);
        overrides = overrides == null ? Map.of() : Map.copyOf(overrides);
    }
}
