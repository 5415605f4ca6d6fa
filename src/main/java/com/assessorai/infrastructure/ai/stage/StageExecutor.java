package com.assessorai.infrastructure.ai.stage;

import com.assessorai.domain.pipeline.model.ChunkPlan;
import com.assessorai.domain.pipeline.model.ChunkSegment;
import com.assessorai.domain.pipeline.model.ErrorKind;
import com.assessorai.domain.pipeline.model.FieldValue;
import com.assessorai.domain.pipeline.model.GateOutcome;
import com.assessorai.domain.pipeline.model.GateType;
import com.assessorai.domain.pipeline.model.GateVerdict;
import com.assessorai.domain.pipeline.model.InvocationAttempt;
import com.assessorai.domain.pipeline.model.RunConfiguration;
import com.assessorai.domain.pipeline.model.Stage1Payload;
import com.assessorai.domain.pipeline.model.Stage2Payload;
import com.assessorai.domain.pipeline.model.Stage3Payload;
import com.assessorai.domain.pipeline.model.StageId;
import com.assessorai.domain.pipeline.model.StagePayload;
import com.assessorai.domain.pipeline.model.StageResult;
import com.assessorai.domain.pipeline.model.TokenUsage;
import com.assessorai.domain.pipeline.service.InstructionSetProvider;
import com.assessorai.domain.pipeline.service.InstructionSetProvider.InstructionSet;
import com.assessorai.infrastructure.ai.cache.CachedModelInvoker;
import com.assessorai.infrastructure.ai.cache.CallOutcome;
import com.assessorai.infrastructure.ai.chunking.TextChunker;
import com.assessorai.infrastructure.ai.chunking.TokenCounter;
import com.assessorai.infrastructure.ai.client.InvocationRequest;
import com.assessorai.infrastructure.ai.client.ModelInvocationException;
import com.assessorai.infrastructure.ai.gate.EvidenceIndex;
import com.assessorai.infrastructure.ai.gate.QualityGateEvaluator;
import com.assessorai.infrastructure.ai.routing.ModelRouter;
import com.assessorai.infrastructure.ai.routing.ModelTarget;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs one analysis stage: budget and chunk the source, check coverage, call the
 * model per segment (through the cache), parse, evaluate gates, and retry with a
 * corrective message while the verdict is RETRY and attempts remain.
 * A RETRY verdict on the last attempt becomes BLOCK. Fresh answers are cached
 * only when their attempt passed or escalated.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StageExecutor {

    private final InstructionSetProvider instructionProvider;
    private final ModelRouter router;
    private final TokenCounter tokenCounter;
    private final TextChunker chunker;
    private final StageRequestBuilder requestBuilder;
    private final CachedModelInvoker invoker;
    private final StagePayloadParser parser;
    private final QualityGateEvaluator gates;
    private final ConsensusResolver consensusResolver;
    private final ThemeAnalysisExecutor themeExecutor;
    private final Clock clock;

    /**
     * Per-attempt scope shared by the calls of one attempt.
     */
    private record Scope(StageContext ctx, int attempt, InstructionSet instructions, ModelTarget target,
                         String source, ChunkPlan plan, List<String> corrections, CallLog calls) {}

    /**
     * Thread-safe record of the calls made by one attempt.
     */
    private static final class CallLog {
        private final List<String> contents = new ArrayList<>();
        private final List<InvocationAttempt> superseded = new ArrayList<>();
        private final List<CallOutcome> fresh = new ArrayList<>();
        private TokenUsage usage = TokenUsage.ZERO;
        private int cacheHits;

        synchronized void add(CallOutcome outcome) {
            contents.add(outcome.content());
            superseded.addAll(outcome.attempts());
            usage = usage.plus(outcome.usage());
            if (outcome.fromCache()) {
                cacheHits++;
            } else {
                fresh.add(outcome);
            }
        }

        synchronized List<CallOutcome> fresh() {
            return List.copyOf(fresh);
        }

        synchronized void addFailure(ModelInvocationException e) {
            superseded.addAll(e.getAttempts());
            usage = usage.plus(e.usage());
        }
    }

    public StageExecution execute(StageContext ctx) {
        StageId stage = ctx.stageId();
        RunConfiguration cfg = ctx.config();
        InstructionSet instructions = instructionProvider.loadInstructions(stage, cfg.profile());
        ModelTarget target = router.route(stage);
        String source = stage == StageId.STAGE1 ? ctx.primaryText() : ctx.supportingText();

        int budget = (int) Math.floor(target.contextWindow() * cfg.budgetRatio(stage));
        int fixed = tokenCounter.count(instructions.text())
                + tokenCounter.count(requestBuilder.build(stage, ctx.upstream(), "", "000/000", "", List.of()));
        int ceiling = budget - fixed;
        log.info("[Stage {}] model={}/{} budget={} fixed={} ceiling={} sourceTokens~{}",
                stage, target.provider(), target.model(), budget, fixed, ceiling, tokenCounter.count(source));

        if (ceiling <= cfg.chunkOverlapTokens()) {
            GateOutcome exhausted = GateOutcome.block(GateType.COVERAGE, "token budget " + budget
                    + " exhausted by instructions and upstream context (" + fixed + " tokens)");
            return new StageExecution(List.of(blockedBeforeCall(ctx, ctx.firstAttempt(), target, instructions,
                    exhausted)), null, false);
        }

        ChunkPlan plan = chunker.plan(source, ceiling, cfg.chunkOverlapTokens(), cfg.maxSegments());
        GateOutcome coverage = gates.evaluateCoverage(stage.name() + " source", plan, cfg.thresholds());
        if (!coverage.passed()) {
            return new StageExecution(List.of(blockedBeforeCall(ctx, ctx.firstAttempt(), target, instructions,
                    coverage)), plan, false);
        }

        List<StageResult> attempts = new ArrayList<>();
        List<String> corrections = List.of();
        for (int n = 0; n < cfg.maxStageAttempts(); n++) {
            if (ctx.abortRequested().getAsBoolean()) {
                log.info("[Stage {}] abort requested before attempt {}", stage, ctx.firstAttempt() + n);
                return new StageExecution(attempts, plan, true);
            }
            Scope scope = new Scope(ctx, ctx.firstAttempt() + n, instructions, target, source, plan, corrections,
                    new CallLog());
            StageResult result = runAttempt(scope);
            attempts.add(result);
            if (result.verdict() == GateVerdict.PASS || result.verdict() == GateVerdict.ESCALATE) {
                scope.calls().fresh().forEach(invoker::remember);
            }
            if (result.verdict() != GateVerdict.RETRY) {
                return new StageExecution(attempts, plan, false);
            }
            corrections = result.gates().stream()
                    .filter(g -> g.verdict() == GateVerdict.RETRY)
                    .flatMap(g -> g.reasons().stream())
                    .toList();
            log.info("[Stage {}] attempt {} rejected, retrying with corrections: {}",
                    stage, scope.attempt(), corrections);
        }

        StageResult exhausted = attempts.remove(attempts.size() - 1).withVerdict(GateVerdict.BLOCK);
        attempts.add(exhausted);
        log.warn("[Stage {}] blocked after {} attempt(s)", stage, cfg.maxStageAttempts());
        return new StageExecution(attempts, plan, false);
    }

    private StageResult runAttempt(Scope scope) {
        StageId stage = scope.ctx().stageId();
        Map<String, String> incomplete = new LinkedHashMap<>();
        List<String> consensusEscalations = new ArrayList<>();
        StagePayload payload;
        try {
            payload = produce(scope, incomplete, consensusEscalations);
        } catch (PayloadValidationException e) {
            log.warn("[Stage {}] attempt {} returned an invalid payload: {}", stage, scope.attempt(), e.getMessage());
            GateOutcome invalid = new GateOutcome(GateType.PAYLOAD, GateVerdict.RETRY, List.of(e.getMessage()));
            return result(scope, null, List.of(invalid), List.of(), 0.0, ErrorKind.VALIDATION);
        } catch (ModelInvocationException e) {
            if (e.getKind() != ErrorKind.GATE_FAILURE) {
                throw e;
            }
            GateOutcome truncated = GateOutcome.block(GateType.PAYLOAD,
                    "model output incomplete after retries: " + e.getMessage());
            return result(scope, null, List.of(truncated), List.of(), 0.0, ErrorKind.GATE_FAILURE);
        }

        RunConfiguration cfg = scope.ctx().config();
        boolean checkReferences = cfg.validateReferences() && stage != StageId.STAGE1;
        EvidenceIndex evidence = new EvidenceIndex(stage == StageId.STAGE1
                ? scope.ctx().primaryText()
                : scope.ctx().supportingText() + "\n\n" + scope.ctx().primaryText());

        Set<String> critical = new LinkedHashSet<>(cfg.criticalFields(stage));
        if (stage == StageId.STAGE2) {
            payload.entries().keySet().stream().filter(k -> !incomplete.containsKey(k)).forEach(critical::add);
        }

        List<GateOutcome> outcomes = new ArrayList<>();
        outcomes.add(GateOutcome.pass(GateType.COVERAGE));
        outcomes.add(GateOutcome.pass(GateType.PAYLOAD));
        outcomes.add(gates.evaluateFieldEvidence(payload, evidence, critical, checkReferences));
        if (stage == StageId.STAGE3) {
            Stage2Payload analysis = (Stage2Payload) scope.ctx().upstream().get(StageId.STAGE2);
            outcomes.add(gates.evaluateCoherence((Stage3Payload) payload, analysis,
                    new EvidenceIndex(scope.ctx().supportingText())));
        }

        Map<String, Double> scores = new LinkedHashMap<>(
                gates.scoreEntries(payload, evidence, checkReferences, incomplete.keySet()));
        boolean themeStage = stage == StageId.STAGE2;
        double threshold = themeStage ? cfg.thresholds().themeConfidence() : cfg.thresholds().fieldConfidence();
        outcomes.add(gates.evaluateConfidence(scores, threshold, themeStage ? "theme" : "field"));

        if (!incomplete.isEmpty()) {
            List<String> reasons = new ArrayList<>();
            incomplete.forEach((theme, why) -> {
                reasons.add("theme '" + theme + "' incomplete: " + why);
                scores.put(theme, 0.0);
            });
            outcomes.add(new GateOutcome(GateType.CONFIDENCE, GateVerdict.ESCALATE, reasons));
        }
        if (!consensusEscalations.isEmpty()) {
            outcomes.add(new GateOutcome(GateType.CONSENSUS, GateVerdict.ESCALATE, consensusEscalations));
        }

        List<String> escalations = outcomes.stream()
                .filter(g -> g.verdict() == GateVerdict.ESCALATE)
                .flatMap(g -> g.reasons().stream())
                .toList();
        double confidence = scores.values().stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        return result(scope, payload, outcomes, escalations, confidence, null);
    }

    private StagePayload produce(Scope scope, Map<String, String> incomplete, List<String> consensusEscalations) {
        StageId stage = scope.ctx().stageId();
        RunConfiguration cfg = scope.ctx().config();
        List<String> required = cfg.criticalFields(stage);

        if (stage == StageId.STAGE2 && cfg.parallelThemes()) {
            Stage1Payload stage1 = (Stage1Payload) scope.ctx().upstream().get(StageId.STAGE1);
            if (stage1 != null && !stage1.themes().isEmpty()) {
                return fanOutThemes(scope, stage1.themes(), incomplete);
            }
        }

        StagePayload first = requireFields(callSegments(scope, null, false), required);
        boolean consensus = cfg.consensus() != null && cfg.consensus().enabled()
                && (stage == StageId.STAGE1 || stage == StageId.STAGE3);
        if (!consensus) {
            return first;
        }
        StagePayload second = requireFields(callSegments(scope, null, true), required);
        ConsensusResolver.Resolution resolution =
                consensusResolver.resolve(first, second, cfg.consensus().tieBreak());
        consensusEscalations.addAll(resolution.escalations());
        return resolution.payload();
    }

    private Stage2Payload fanOutThemes(Scope scope, List<String> themes, Map<String, String> incomplete) {
        ThemeAnalysisExecutor.ThemeMerge<FieldValue> merge = themeExecutor.analyze(themes,
                theme -> singleTheme(theme, (Stage2Payload) callSegments(scope, theme, false)),
                scope.ctx().config().workerTimeout());
        if (merge.completed().isEmpty()) {
            throw new PayloadValidationException("no theme analysis completed: " + merge.incomplete());
        }
        Map<String, FieldValue> merged = new LinkedHashMap<>(merge.completed());
        merge.incomplete().forEach((theme, why) -> {
            merged.put(theme, FieldValue.incomplete());
            incomplete.put(theme, why);
        });
        return new Stage2Payload(merged);
    }

    private FieldValue singleTheme(String theme, Stage2Payload answer) {
        FieldValue value = answer.themes().get(theme);
        if (value != null) {
            return value;
        }
        if (answer.themes().size() == 1) {
            return answer.themes().values().iterator().next();
        }
        throw new PayloadValidationException("answer for theme '" + theme + "' has keys " + answer.themes().keySet());
    }

    /**
     * One call per kept segment; segment answers are merged into one payload.
     */
    private StagePayload callSegments(Scope scope, String focus, boolean uncached) {
        StageContext ctx = scope.ctx();
        StageId stage = ctx.stageId();
        RunConfiguration cfg = ctx.config();
        List<ChunkSegment> segments = scope.plan().segments();
        List<StagePayload> answers = new ArrayList<>();
        for (ChunkSegment segment : segments) {
            String label = scope.plan().chunked()
                    ? String.format("%03d/%03d", answers.size() + 1, segments.size())
                    : null;
            String payloadText = requestBuilder.build(stage, ctx.upstream(), focus, label,
                    segment.slice(scope.source()), scope.corrections());
            InvocationRequest request = new InvocationRequest(scope.target().provider(), scope.target().model(),
                    scope.instructions().text(), payloadText, cfg.maxOutputTokens(stage), cfg.temperature());

            CallOutcome outcome;
            try {
                outcome = uncached
                        ? invoker.callUncached(stage, scope.instructions().version(), request, ctx.deadline())
                        : invoker.call(stage, scope.instructions().version(), request, ctx.deadline());
            } catch (ModelInvocationException e) {
                scope.calls().addFailure(e);
                throw e;
            }
            scope.calls().add(outcome);
            answers.add(parser.parse(stage, outcome.content(), List.of()));
        }
        return mergeSegments(stage, answers);
    }

    private StagePayload requireFields(StagePayload payload, List<String> required) {
        List<String> missing = required.stream().filter(f -> !payload.entries().containsKey(f)).toList();
        if (!missing.isEmpty()) {
            throw new PayloadValidationException("missing required field(s) " + missing);
        }
        return payload;
    }

    /**
     * Keeps, per key, the most confident answer across segments; lists are unioned in order.
     */
    static StagePayload mergeSegments(StageId stage, List<StagePayload> answers) {
        if (answers.size() == 1) {
            return answers.get(0);
        }
        Map<String, FieldValue> entries = new LinkedHashMap<>();
        Set<String> themes = new LinkedHashSet<>();
        Set<String> cited = new LinkedHashSet<>();
        String transcript = "";
        for (StagePayload answer : answers) {
            answer.entries().forEach((key, value) -> entries.merge(key, value,
                    (kept, candidate) -> candidate.confidence() > kept.confidence() ? candidate : kept));
            if (answer instanceof Stage1Payload s1) {
                themes.addAll(s1.themes());
            } else if (answer instanceof Stage3Payload s3) {
                cited.addAll(s3.citedReferences());
                if (transcript.isBlank()) {
                    transcript = s3.transcript();
                }
            }
        }
        return switch (stage) {
            case STAGE1 -> new Stage1Payload(entries, List.copyOf(themes));
            case STAGE2 -> new Stage2Payload(entries);
            case STAGE3 -> new Stage3Payload(entries, List.copyOf(cited), transcript);
            case CLASSIFICATION -> throw new IllegalArgumentException("Classification has no stage payload");
        };
    }

    private StageResult result(Scope scope, StagePayload payload, List<GateOutcome> outcomes,
                               List<String> escalations, double confidence, ErrorKind errorKind) {
        CallLog calls = scope.calls();
        synchronized (calls) {
            return new StageResult(scope.ctx().stageId(), scope.attempt(), payload, calls.contents, calls.usage,
                    calls.superseded.size(), GateVerdict.worstOf(outcomes), outcomes, escalations, confidence,
                    calls.superseded, scope.target().model(), scope.instructions().version(), calls.cacheHits,
                    errorKind, clock.instant());
        }
    }

    private StageResult blockedBeforeCall(StageContext ctx, int attempt, ModelTarget target,
                                          InstructionSet instructions, GateOutcome gate) {
        return new StageResult(ctx.stageId(), attempt, null, List.of(), TokenUsage.ZERO, 0, GateVerdict.BLOCK,
                List.of(gate), List.of(), 0.0, List.of(), target.model(), instructions.version(), 0,
                ErrorKind.GATE_FAILURE, clock.instant());
    }
}
