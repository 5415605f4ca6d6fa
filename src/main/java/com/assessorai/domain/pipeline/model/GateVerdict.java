package com.assessorai.domain.pipeline.model;

import java.util.Collection;

/**
 * Gate decision, ordered by severity. ESCALATE is advisory, BLOCK is enforced.
 */
public enum GateVerdict {
    PASS,
    ESCALATE,
    RETRY,
    BLOCK;

    public GateVerdict worse(GateVerdict other) {
        return other.ordinal() > ordinal() ? other : this;
    }

    public static GateVerdict worstOf(Collection<GateOutcome> outcomes) {
        GateVerdict verdict = PASS;
        for (GateOutcome outcome : outcomes) {
            verdict = verdict.worse(outcome.verdict());
        }
        return verdict;
    }
}
