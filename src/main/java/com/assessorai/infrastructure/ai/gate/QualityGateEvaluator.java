package com.assessorai.infrastructure.ai.gate;

import com.assessorai.domain.pipeline.model.ChunkPlan;
import com.assessorai.domain.pipeline.model.DocumentType;
import com.assessorai.domain.pipeline.model.FieldValue;
import com.assessorai.domain.pipeline.model.GateOutcome;
import com.assessorai.domain.pipeline.model.GateType;
import com.assessorai.domain.pipeline.model.GateVerdict;
import com.assessorai.domain.pipeline.model.InputDocument;
import com.assessorai.domain.pipeline.model.RunConfiguration.GateThresholds;
import com.assessorai.domain.pipeline.model.Stage2Payload;
import com.assessorai.domain.pipeline.model.Stage3Payload;
import com.assessorai.domain.pipeline.model.StagePayload;
import com.assessorai.domain.pipeline.service.ReferenceTaxonomy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Deterministic quality gates. Every method is a pure function of its arguments
 * (the taxonomy lookup aside) and returns PASS or a failing verdict with reasons.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QualityGateEvaluator {

    private final ReferenceTaxonomy taxonomy;
    private final ConfidenceScorer scorer;

    /**
     * Extraction gate: blocks on low page quality or a noisy text layer.
     */
    public GateOutcome evaluateExtraction(List<InputDocument> documents, GateThresholds thresholds) {
        List<String> reasons = new ArrayList<>();
        for (InputDocument doc : documents) {
            if (doc.extractedText() == null || doc.extractedText().isBlank()) {
                reasons.add(String.format(Locale.ROOT, "document %s: no extractable text", doc.id()));
                continue;
            }
            double quality = doc.qualityScore();
            if (quality < thresholds.minExtractionQuality()) {
                reasons.add(String.format(Locale.ROOT, "document %s: quality %.2f below minimum %.2f (%d pages)",
                        doc.id(), quality, thresholds.minExtractionQuality(), doc.pageCount()));
            }
            double noise = noiseRatio(doc.extractedText());
            if (noise > thresholds.maxNoiseRatio()) {
                reasons.add(String.format(Locale.ROOT, "document %s: noise ratio %.2f above maximum %.2f",
                        doc.id(), noise, thresholds.maxNoiseRatio()));
            }
        }
        return logged(GateOutcome.of(GateType.EXTRACTION, GateVerdict.BLOCK, reasons));
    }

    /**
     * Classification invariant: exactly one primary document and enough supporting ones.
     */
    public GateOutcome evaluateClassification(List<InputDocument> documents, GateThresholds thresholds) {
        List<String> reasons = new ArrayList<>();
        long primaries = documents.stream().filter(d -> d.type() == DocumentType.PRIMARY).count();
        long supporting = documents.stream().filter(d -> d.type() == DocumentType.SUPPORTING).count();
        if (primaries != 1) {
            reasons.add("expected exactly 1 PRIMARY document, found " + primaries);
        }
        if (supporting < thresholds.minSupportingDocuments()) {
            reasons.add("expected at least " + thresholds.minSupportingDocuments()
                    + " SUPPORTING document(s), found " + supporting);
        }
        return logged(GateOutcome.of(GateType.CLASSIFICATION, GateVerdict.BLOCK, reasons));
    }

    public GateOutcome evaluateCoverage(String label, ChunkPlan plan, GateThresholds thresholds) {
        if (plan.coverageRatio() < thresholds.minCoverageRatio()) {
            return logged(GateOutcome.block(GateType.COVERAGE, String.format(Locale.ROOT,
                    "%s: coverage %.3f below minimum %.3f (%d segments kept)",
                    label, plan.coverageRatio(), thresholds.minCoverageRatio(), plan.segments().size())));
        }
        return GateOutcome.pass(GateType.COVERAGE);
    }

    /**
     * Field-evidence gate: each critical entry must quote evidence found in the source;
     * with {@code checkReferences} every cited reference must be in the known set.
     * Failures are retryable with a refined request.
     */
    public GateOutcome evaluateFieldEvidence(StagePayload payload, EvidenceIndex source,
                                             Collection<String> criticalKeys, boolean checkReferences) {
        List<String> reasons = new ArrayList<>();
        Map<String, FieldValue> entries = payload.entries();
        for (String key : criticalKeys) {
            FieldValue value = entries.get(key);
            if (value == null) {
                reasons.add("field '" + key + "' missing");
            } else if (value.evidence().isBlank()) {
                reasons.add("field '" + key + "' has no evidence");
            } else if (!source.contains(value.evidence())) {
                reasons.add("field '" + key + "' evidence not found in source");
            }
        }
        if (checkReferences) {
            for (String reference : references(payload)) {
                if (!taxonomy.isRecognized(reference)) {
                    reasons.add("reference '" + reference + "' not in known set (taxonomy " + taxonomy.version() + ")");
                }
            }
        }
        return logged(GateOutcome.of(GateType.FIELD_EVIDENCE, GateVerdict.RETRY, reasons));
    }

    /**
     * Scores every entry of a payload, skipping the given keys.
     */
    public Map<String, Double> scoreEntries(StagePayload payload, EvidenceIndex source, boolean checkReferences,
                                            Set<String> skip) {
        Map<String, Double> scores = new LinkedHashMap<>();
        payload.entries().forEach((key, value) -> {
            if (skip.contains(key)) {
                return;
            }
            boolean recognized = !checkReferences || value.references().stream().allMatch(taxonomy::isRecognized);
            scores.put(key, scorer.score(value, source.contains(value.evidence()), recognized));
        });
        return scores;
    }

    /**
     * Advisory gate: entries scored below the threshold are escalated, never blocked here.
     */
    public GateOutcome evaluateConfidence(Map<String, Double> scores, double threshold, String entryLabel) {
        List<String> escalations = new ArrayList<>();
        scores.forEach((key, score) -> {
            if (score < threshold) {
                escalations.add(String.format(Locale.ROOT, "%s '%s' confidence %.2f below %.2f",
                        entryLabel, key, score, threshold));
            }
        });
        return logged(GateOutcome.of(GateType.CONFIDENCE, GateVerdict.ESCALATE, escalations));
    }

    /**
     * Coherence gate for Stage 3: every cited reference must come from the Stage 2
     * analysis and the quoted transcript must appear in the supporting source.
     */
    public GateOutcome evaluateCoherence(Stage3Payload decision, Stage2Payload analysis, EvidenceIndex supporting) {
        List<String> reasons = new ArrayList<>();
        Set<String> known = new LinkedHashSet<>();
        analysis.allReferences().forEach(r -> known.add(EvidenceIndex.normalize(r)));
        for (String cited : references(decision)) {
            if (!known.contains(EvidenceIndex.normalize(cited))) {
                reasons.add("cited reference '" + cited + "' absent from stage 2 analysis");
            }
        }
        if (decision.transcript().isBlank()) {
            reasons.add("transcript missing");
        } else if (!supporting.contains(decision.transcript())) {
            reasons.add("transcript not found in supporting source");
        }
        return logged(GateOutcome.of(GateType.COHERENCE, GateVerdict.BLOCK, reasons));
    }

    /**
     * Share of characters that are neither letters, digits, whitespace nor common punctuation.
     */
    public static double noiseRatio(String text) {
        if (text == null || text.isEmpty()) {
            return 1.0;
        }
        long noisy = text.codePoints()
                .filter(c -> !Character.isLetterOrDigit(c) && !Character.isWhitespace(c) && ".,;:!?()[]-\"'/§ºª°%$".indexOf(c) < 0)
                .count();
        return (double) noisy / text.codePointCount(0, text.length());
    }

    private Set<String> references(StagePayload payload) {
        Set<String> refs = new LinkedHashSet<>();
        if (payload instanceof Stage3Payload decision) {
            refs.addAll(decision.citedReferences());
        }
        refs.addAll(payload.allReferences());
        return refs;
    }

    private GateOutcome logged(GateOutcome outcome) {
        if (!outcome.passed()) {
            log.info("[Gate] {} -> {} {}", outcome.gate(), outcome.verdict(), outcome.reasons());
        }
        return outcome;
    }
}
