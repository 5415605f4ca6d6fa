package com.assessorai.domain.pipeline.model;

import java.util.List;

/**
 * Verdict of a single gate with the reasons behind it.
 * For ESCALATE outcomes the reasons are the escalated items.
 */
public record GateOutcome(GateType gate, GateVerdict verdict, List<String> reasons) {

    public GateOutcome {
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
    }

    public static GateOutcome pass(GateType gate) {
        return new GateOutcome(gate, GateVerdict.PASS, List.of());
    }

    public static GateOutcome of(GateType gate, GateVerdict failVerdict, List<String> reasons) {
        return reasons.isEmpty() ? pass(gate) : new GateOutcome(gate, failVerdict, reasons);
    }

    public static GateOutcome block(GateType gate, String reason) {
        return new GateOutcome(gate, GateVerdict.BLOCK, List.of(reason));
    }

    public boolean passed() {
        return verdict == GateVerdict.PASS;
    }
}
