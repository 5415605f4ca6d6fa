package com.assessorai.infrastructure.ai.stage;

import com.assessorai.domain.pipeline.model.FieldValue;
import com.assessorai.domain.pipeline.model.RunConfiguration.ConsensusPolicy.TieBreak;
import com.assessorai.domain.pipeline.model.Stage1Payload;
import com.assessorai.domain.pipeline.model.Stage3Payload;
import com.assessorai.domain.pipeline.model.StagePayload;
import com.assessorai.infrastructure.ai.gate.EvidenceIndex;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Merges two independent answers for the same stage field by field.
 * Agreeing fields keep the higher confidence. Disagreements follow the tie-break:
 * PREFER_HIGHER_CONFIDENCE picks the more confident answer and escalates only exact ties,
 * ESCALATE keeps the first answer and always escalates.
 */
@Slf4j
@Component
public class ConsensusResolver {

    public record Resolution(StagePayload payload, List<String> disagreements, List<String> escalations) {}

    public Resolution resolve(StagePayload first, StagePayload second, TieBreak tieBreak) {
        if (first.stageId() != second.stageId()) {
            throw new IllegalArgumentException("Cannot merge " + first.stageId() + " with " + second.stageId());
        }
        Map<String, FieldValue> merged = new LinkedHashMap<>();
        List<String> disagreements = new ArrayList<>();
        List<String> escalations = new ArrayList<>();
        boolean secondWinsDecision = false;

        Set<String> keys = new LinkedHashSet<>(first.entries().keySet());
        keys.addAll(second.entries().keySet());
        for (String key : keys) {
            FieldValue a = first.entries().get(key);
            FieldValue b = second.entries().get(key);
            if (a == null || b == null) {
                merged.put(key, a != null ? a : b);
                disagreements.add(key);
                escalations.add("consensus: field '" + key + "' produced by only one of two calls");
                continue;
            }
            if (EvidenceIndex.normalize(a.content()).equals(EvidenceIndex.normalize(b.content()))) {
                merged.put(key, a.confidence() >= b.confidence() ? a : b);
                continue;
            }
            disagreements.add(key);
            FieldValue chosen = a;
            if (tieBreak == TieBreak.PREFER_HIGHER_CONFIDENCE && a.confidence() != b.confidence()) {
                chosen = a.confidence() > b.confidence() ? a : b;
            } else {
                escalations.add(String.format(Locale.ROOT,
                        "consensus: field '%s' disagreement (confidence %.2f vs %.2f)", key,
                        a.confidence(), b.confidence()));
            }
            merged.put(key, chosen);
            if (chosen == b && Stage3Payload.DECISION_FIELD.equals(key)) {
                secondWinsDecision = true;
            }
        }
        if (!disagreements.isEmpty()) {
            log.info("[Consensus] {} disagreement(s) on {}: {}", disagreements.size(), first.stageId(), disagreements);
        }
        return new Resolution(rebuild(first, second, merged, secondWinsDecision), disagreements, escalations);
    }

    private StagePayload rebuild(StagePayload first, StagePayload second, Map<String, FieldValue> merged,
                                 boolean secondWinsDecision) {
        if (first instanceof Stage1Payload a && second instanceof Stage1Payload b) {
            Set<String> themes = new LinkedHashSet<>(a.themes());
            themes.addAll(b.themes());
            return new Stage1Payload(merged, List.copyOf(themes));
        }
        if (first instanceof Stage3Payload a && second instanceof Stage3Payload b) {
            Stage3Payload basis = secondWinsDecision ? b : a;
            return new Stage3Payload(merged, basis.citedReferences(), basis.transcript());
        }
        throw new IllegalArgumentException("Consensus is not supported for " + first.stageId());
    }
}
