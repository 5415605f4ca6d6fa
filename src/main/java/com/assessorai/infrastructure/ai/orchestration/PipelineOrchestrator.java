package com.assessorai.infrastructure.ai.orchestration;

import com.assessorai.domain.pipeline.model.BlockInfo;
import com.assessorai.domain.pipeline.model.BlockReason;
import com.assessorai.domain.pipeline.model.DeadLetterRecord;
import com.assessorai.domain.pipeline.model.DocumentType;
import com.assessorai.domain.pipeline.model.ErrorKind;
import com.assessorai.domain.pipeline.model.GateOutcome;
import com.assessorai.domain.pipeline.model.GateType;
import com.assessorai.domain.pipeline.model.GateVerdict;
import com.assessorai.domain.pipeline.model.InputDocument;
import com.assessorai.domain.pipeline.model.InvocationAttempt;
import com.assessorai.domain.pipeline.model.PipelineState;
import com.assessorai.domain.pipeline.model.PipelineStatus;
import com.assessorai.domain.pipeline.model.RunConfiguration;
import com.assessorai.domain.pipeline.model.RunReport;
import com.assessorai.domain.pipeline.model.StageId;
import com.assessorai.domain.pipeline.model.StagePayload;
import com.assessorai.domain.pipeline.model.StageResult;
import com.assessorai.domain.pipeline.repository.CheckpointStore;
import com.assessorai.domain.pipeline.repository.DeadLetterQueue;
import com.assessorai.domain.pipeline.service.ExtractionException;
import com.assessorai.domain.pipeline.service.ExtractionService;
import com.assessorai.domain.pipeline.service.ExtractionService.ExtractedText;
import com.assessorai.domain.pipeline.service.InstructionSetProvider;
import com.assessorai.infrastructure.ai.cache.CacheKeyBuilder;
import com.assessorai.infrastructure.ai.classification.ClassificationVerdict;
import com.assessorai.infrastructure.ai.classification.DocumentClassifier;
import com.assessorai.infrastructure.ai.client.ModelInvocationException;
import com.assessorai.infrastructure.ai.gate.ConfidenceScorer;
import com.assessorai.infrastructure.ai.gate.QualityGateEvaluator;
import com.assessorai.infrastructure.ai.stage.StageContext;
import com.assessorai.infrastructure.ai.stage.StageExecution;
import com.assessorai.infrastructure.ai.stage.StageExecutor;
import com.assessorai.infrastructure.logging.LogSanitizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Drives a run through CLASSIFYING, STAGE1, STAGE2, STAGE3 and FINALIZED.
 *
 * A stage starts only when every upstream stage holds a PASS result. Any gate
 * failure stops the run in BLOCKED; a fatal error moves it to DEAD_LETTERED.
 * The state is checkpointed after every transition, before control moves on.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PipelineOrchestrator {

    static final String MDC_RUN_ID = "runId";

    private final ExtractionService extractionService;
    private final DocumentClassifier classifier;
    private final QualityGateEvaluator gates;
    private final StageExecutor stageExecutor;
    private final InstructionSetProvider instructionProvider;
    private final CacheKeyBuilder keyBuilder;
    private final ConfidenceScorer scorer;
    private final CheckpointStore checkpointStore;
    private final DeadLetterQueue deadLetterQueue;
    private final CostEstimator costEstimator;
    private final PipelineEventLogger events;
    private final Clock clock;

    private final Set<String> activeRuns = ConcurrentHashMap.newKeySet();
    private final Set<String> abortRequests = ConcurrentHashMap.newKeySet();

    /**
     * Thrown inside a pass to stop it in BLOCKED.
     */
    private static final class Blocked extends RuntimeException {
        private final BlockInfo info;

        Blocked(BlockInfo info) {
            super(info.reason() + " at " + info.stage(), null, false, false);
            this.info = info;
        }
    }

    /**
     * Starts a new run. The run id must not have an active checkpoint.
     */
    public RunReport run(String runId, List<InputDocument> documents, RunConfiguration config) {
        if (checkpointStore.load(runId).isPresent()) {
            throw new IllegalArgumentException("Run " + runId + " already exists");
        }
        PipelineState state = PipelineState.start(runId, config.profile(), documents, clock.instant());
        state.setPromptSignature(promptSignature(config.profile()));
        checkpointStore.save(state);
        events.emit(runId, StageId.CLASSIFICATION, "RUN_STARTED",
                Map.of("documents", documents.size(), "profile", config.profile()));
        return drive(state, config);
    }

    /**
     * Continues a checkpointed run at the first stage without a PASS result.
     * A finalized run returns its report unchanged.
     */
    public RunReport resume(PipelineState state, RunConfiguration config) {
        if (state.getStatus() == PipelineStatus.DEAD_LETTERED) {
            throw new IllegalStateException("Run " + state.getRunId() + " is dead-lettered");
        }
        if (state.getStatus() == PipelineStatus.FINALIZED) {
            return RunReport.of(state, null, "run already finalized");
        }
        String signature = promptSignature(state.getProfile());
        if (!signature.equals(state.getPromptSignature())) {
            log.warn("[Orchestrator] run {} instruction sets changed since start", state.getRunId());
            state.addAlert("PROMPT_SIGNATURE_CHANGED",
                    "instruction sets changed since the run started; earlier results used the recorded signature",
                    null, clock.instant());
        }
        events.emit(state.getRunId(), firstPending(state), "RUN_RESUMED",
                Map.of("from", String.valueOf(state.getStatus()), "checkpoint", state.getCheckpointKey()));
        return drive(state, config.toBuilder().profile(state.getProfile()).build());
    }

    /**
     * Requests a cooperative stop of an active run. The run ends in BLOCKED/USER_ABORT
     * at the next stage or attempt boundary.
     *
     * @return false when the run is not active in this process
     */
    public boolean abort(String runId) {
        if (!activeRuns.contains(runId)) {
            return false;
        }
        abortRequests.add(runId);
        log.info("[Orchestrator] abort requested for run {}", runId);
        return true;
    }

    public boolean isActive(String runId) {
        return activeRuns.contains(runId);
    }

    private RunReport drive(PipelineState state, RunConfiguration config) {
        String runId = state.getRunId();
        if (!activeRuns.add(runId)) {
            throw new IllegalStateException("Run " + runId + " is already executing");
        }
        MDC.put(MDC_RUN_ID, runId);
        Instant runDeadline = clock.instant().plus(config.runTimeout());
        try {
            state.setBlock(null);
            if (!state.isClassificationPassed()) {
                intake(state, config, runDeadline);
            }
            for (StageId stage : StageId.analysisStages()) {
                if (!state.passed(stage)) {
                    runStage(state, stage, config, runDeadline);
                }
            }
            return finalizeRun(state, config);
        } catch (Blocked blocked) {
            return block(state, blocked.info);
        } catch (ModelInvocationException e) {
            return failed(state, e, e.getKind(), e.getAttempts(), runDeadline);
        } catch (RuntimeException e) {
            return failed(state, e, ErrorKind.FATAL, List.of(), runDeadline);
        } finally {
            abortRequests.remove(runId);
            activeRuns.remove(runId);
            MDC.remove(MDC_RUN_ID);
        }
    }

    // --- Intake ---

    private void intake(PipelineState state, RunConfiguration config, Instant runDeadline) {
        transition(state, PipelineStatus.CLASSIFYING);
        checkInterrupts(state, StageId.CLASSIFICATION, runDeadline);

        List<InputDocument> extracted = new ArrayList<>();
        for (InputDocument doc : state.getDocuments()) {
            extracted.add(doc.extracted() ? doc : extract(state, doc));
        }
        state.setDocuments(extracted);
        GateOutcome extraction = gates.evaluateExtraction(extracted, config.thresholds());
        state.setIntakeGates(new ArrayList<>(List.of(extraction)));
        checkpoint(state);
        events.emit(state.getRunId(), StageId.CLASSIFICATION, "EXTRACTED",
                Map.of("verdict", extraction.verdict().name(), "documents", extracted.size()));
        if (!extraction.passed()) {
            throw new Blocked(BlockInfo.gate(StageId.CLASSIFICATION, extraction));
        }

        Instant deadline = stageDeadline(config, runDeadline);
        List<InputDocument> classified = new ArrayList<>();
        for (InputDocument doc : extracted) {
            checkInterrupts(state, StageId.CLASSIFICATION, runDeadline);
            if (doc.classified()) {
                classified.add(doc);
                continue;
            }
            DocumentClassifier.Classification result = classifier.classify(doc, config, deadline);
            for (ClassificationVerdict consulted : result.consulted()) {
                if (consulted.modelId() != null) {
                    state.addUsage(consulted.modelId(), consulted.usage(),
                            costEstimator.estimate(consulted.modelId(), consulted.usage()));
                }
            }
            ClassificationVerdict verdict = result.verdict();
            classified.add(doc.withClassification(verdict.type(), verdict.strategy(), verdict.confidence()));
            state.setDocuments(merge(extracted, classified));
            checkpoint(state);
        }
        state.setDocuments(classified);

        GateOutcome classification = gates.evaluateClassification(classified, config.thresholds());
        state.getIntakeGates().add(classification);
        state.setClassificationPassed(classification.passed());
        events.emit(state.getRunId(), StageId.CLASSIFICATION, "CLASSIFIED", Map.of(
                "verdict", classification.verdict().name(),
                "types", classified.stream().collect(Collectors.toMap(InputDocument::id,
                        d -> d.type().name(), (a, b) -> a, LinkedHashMap::new))));
        if (!classification.passed()) {
            checkpoint(state);
            throw new Blocked(BlockInfo.gate(StageId.CLASSIFICATION, classification));
        }
        transition(state, StageId.CLASSIFICATION.nextStatus());
    }

    private InputDocument extract(PipelineState state, InputDocument doc) {
        try {
            ExtractedText text = extractionService.extract(doc);
            return doc.withExtraction(text.text(), text.pageCount(), text.perPageQuality());
        } catch (ExtractionException e) {
            log.warn("[Orchestrator] extraction failed for document {}: {}", doc.id(),
                    LogSanitizer.sanitize(e.getMessage()));
            state.addAlert("EXTRACTION_FAILED", "document " + doc.id() + ": "
                    + LogSanitizer.sanitize(e.getMessage()), StageId.CLASSIFICATION, clock.instant());
            return doc.withExtraction("", 0, List.of());
        }
    }

    private List<InputDocument> merge(List<InputDocument> all, List<InputDocument> done) {
        List<InputDocument> merged = new ArrayList<>(done);
        merged.addAll(all.subList(done.size(), all.size()));
        return merged;
    }

    // --- Analysis stages ---

    private void runStage(PipelineState state, StageId stage, RunConfiguration config, Instant runDeadline) {
        checkInterrupts(state, stage, runDeadline);
        Map<StageId, StagePayload> upstream = new EnumMap<>(StageId.class);
        List<String> missing = new ArrayList<>();
        if (!state.passed(StageId.CLASSIFICATION)) {
            missing.add("upstream CLASSIFICATION has no PASS verdict");
        }
        for (StageId required : stage.upstream()) {
            StageResult result = state.result(required);
            if (result == null || !result.passed() || result.payload() == null) {
                missing.add("upstream " + required + " has no PASS verdict");
            } else {
                upstream.put(required, result.payload());
            }
        }
        if (!missing.isEmpty()) {
            throw new Blocked(new BlockInfo(BlockReason.GATE, stage, GateType.UPSTREAM, missing));
        }

        transition(state, stage.runningStatus());
        events.emit(state.getRunId(), stage, "STAGE_STARTED", Map.of("attempt", state.nextAttempt(stage)));

        Instant deadline = stageDeadline(config, runDeadline);
        StageContext ctx = new StageContext(stage, state.nextAttempt(stage), primaryText(state),
                supportingText(state), upstream, config, deadline,
                () -> abortRequests.contains(state.getRunId()));
        StageExecution execution;
        try {
            execution = stageExecutor.execute(ctx);
        } catch (ModelInvocationException e) {
            throw timeoutOr(e, state, stage, deadline, runDeadline);
        }

        if (execution.chunkPlan() != null) {
            state.getChunkPlans().put(stage, execution.chunkPlan());
        }
        for (StageResult attempt : execution.attempts()) {
            StageResult recorded = attempt.verdict() == GateVerdict.ESCALATE
                    && !config.escalation().blockOnEscalation()
                    ? attempt.withVerdict(GateVerdict.PASS)
                    : attempt;
            state.recordAttempt(recorded);
            state.addUsage(recorded.modelId(), recorded.usage(),
                    costEstimator.estimate(recorded.modelId(), recorded.usage()));
            events.emit(state.getRunId(), stage, "STAGE_ATTEMPT", Map.of(
                    "attempt", recorded.attempt(),
                    "verdict", recorded.verdict().name(),
                    "cacheHits", recorded.cacheHits(),
                    "retries", recorded.retryCount(),
                    "tokens", recorded.usage().total()));
        }
        checkpoint(state);

        if (execution.aborted()) {
            throw new Blocked(new BlockInfo(BlockReason.USER_ABORT, stage, null, List.of("abort requested")));
        }
        StageResult last = state.result(stage);
        if (!last.escalations().isEmpty()) {
            last.escalations().forEach(reason -> state.getEscalations().add(stage + ": " + reason));
            state.addAlert("ESCALATION", last.escalations().size() + " item(s) queued for review", stage,
                    clock.instant());
        }
        if (last.verdict() == GateVerdict.ESCALATE) {
            throw new Blocked(new BlockInfo(BlockReason.ESCALATION, stage, GateType.CONFIDENCE,
                    last.escalations()));
        }
        if (!last.passed()) {
            throw new Blocked(BlockInfo.gate(stage, execution.blockingGate()));
        }
        state.advanceCursor(stage);
        events.emit(state.getRunId(), stage, "STAGE_PASSED", Map.of(
                "attempt", last.attempt(), "confidence", last.confidence()));
        if (stage != StageId.STAGE3) {
            transition(state, stage.nextStatus());
        }
    }

    private String primaryText(PipelineState state) {
        return state.documentsOfType(DocumentType.PRIMARY).stream()
                .map(InputDocument::extractedText)
                .findFirst()
                .orElse("");
    }

    private String supportingText(PipelineState state) {
        return state.documentsOfType(DocumentType.SUPPORTING).stream()
                .map(InputDocument::extractedText)
                .collect(Collectors.joining("\n\n"));
    }

    // --- Finalize ---

    private RunReport finalizeRun(PipelineState state, RunConfiguration config) {
        double global = scorer.global(
                state.result(StageId.STAGE1).confidence(),
                state.result(StageId.STAGE2).confidence(),
                state.result(StageId.STAGE3).confidence());
        state.setGlobalConfidence(global);
        double threshold = config.thresholds().globalConfidence();
        if (global < threshold) {
            String reason = String.format(Locale.ROOT,
                    "global confidence %.2f below %.2f", global, threshold);
            state.getEscalations().add(reason);
            state.addAlert("LOW_GLOBAL_CONFIDENCE", reason, null, clock.instant());
            if (config.escalation().blockOnEscalation()) {
                throw new Blocked(new BlockInfo(BlockReason.ESCALATION, StageId.STAGE3, GateType.CONFIDENCE,
                        List.of(reason)));
            }
        }
        state.setStatus(PipelineStatus.FINALIZED);
        state.setUpdatedAt(clock.instant());
        checkpointStore.archive(state);
        events.emit(state.getRunId(), StageId.STAGE3, "RUN_FINALIZED", Map.of(
                "globalConfidence", global,
                "tokens", state.getPromptTokens() + state.getCompletionTokens(),
                "costUsd", state.getEstimatedCostUsd(),
                "escalations", state.getEscalations().size()));
        log.info("[Orchestrator] run {} finalized, global confidence {}", state.getRunId(),
                String.format(Locale.ROOT, "%.2f", global));
        return RunReport.of(state, null, "finalized");
    }

    // --- Stops ---

    private void checkInterrupts(PipelineState state, StageId stage, Instant runDeadline) {
        if (abortRequests.contains(state.getRunId())) {
            throw new Blocked(new BlockInfo(BlockReason.USER_ABORT, stage, null, List.of("abort requested")));
        }
        if (!clock.instant().isBefore(runDeadline)) {
            throw new Blocked(new BlockInfo(BlockReason.RUN_TIMEOUT, stage, null,
                    List.of("run timeout reached before " + stage)));
        }
    }

    /**
     * A model failure at or past a deadline is a timeout, which leaves the run resumable.
     */
    private RuntimeException timeoutOr(ModelInvocationException e, PipelineState state, StageId stage,
                                       Instant stageDeadline, Instant runDeadline) {
        Instant now = clock.instant();
        if (abortRequests.contains(state.getRunId())) {
            return new Blocked(new BlockInfo(BlockReason.USER_ABORT, stage, null, List.of("abort requested")));
        }
        if (!now.isBefore(runDeadline)) {
            return new Blocked(new BlockInfo(BlockReason.RUN_TIMEOUT, stage, null,
                    List.of(LogSanitizer.sanitize(e.getMessage()))));
        }
        if (!now.isBefore(stageDeadline)) {
            return new Blocked(new BlockInfo(BlockReason.STAGE_TIMEOUT, stage, null,
                    List.of(LogSanitizer.sanitize(e.getMessage()))));
        }
        return e;
    }

    private RunReport block(PipelineState state, BlockInfo info) {
        state.setStatus(PipelineStatus.BLOCKED);
        state.setBlock(info);
        checkpoint(state);
        String message = info.gate() != null
                ? "blocked at " + info.stage() + " by " + info.gate() + ": " + String.join("; ", info.details())
                : "blocked at " + info.stage() + ": " + info.reason();
        log.warn("[Orchestrator] run {} {}", state.getRunId(), message);
        events.emit(state.getRunId(), info.stage(), "RUN_BLOCKED", Map.of(
                "reason", info.reason().name(),
                "gate", info.gate() == null ? "" : info.gate().name(),
                "details", info.details()));
        ErrorKind kind = info.reason() == BlockReason.GATE || info.reason() == BlockReason.ESCALATION
                ? ErrorKind.GATE_FAILURE
                : null;
        return RunReport.of(state, kind, message);
    }

    private RunReport failed(PipelineState state, RuntimeException e, ErrorKind kind,
                             List<InvocationAttempt> history, Instant runDeadline) {
        StageId stage = state.getStatus() == null ? null : state.getStatus().stage();
        if (abortRequests.contains(state.getRunId())) {
            return block(state, new BlockInfo(BlockReason.USER_ABORT, stage, null, List.of("abort requested")));
        }
        if (!clock.instant().isBefore(runDeadline)) {
            return block(state, new BlockInfo(BlockReason.RUN_TIMEOUT, stage, null,
                    List.of(LogSanitizer.sanitize(e.getMessage()))));
        }
        ErrorKind recorded = kind == ErrorKind.GATE_FAILURE ? ErrorKind.FATAL : kind;
        String message = LogSanitizer.sanitize(e.getClass().getSimpleName() + ": " + e.getMessage());
        log.error("[Orchestrator] run {} failed fatally at {}: {}", state.getRunId(), stage, message, e);

        state.setStatus(PipelineStatus.DEAD_LETTERED);
        state.setUpdatedAt(clock.instant());
        DeadLetterRecord record = deadLetterQueue.append(new DeadLetterRecord(PipelineState.SCHEMA_VERSION,
                state.getRunId(), 0, state, recorded, message, stage, history, clock.instant()));
        checkpointStore.save(state);
        events.emit(state.getRunId(), stage, "RUN_DEAD_LETTERED", Map.of(
                "errorKind", recorded.name(), "sequence", record.sequence()));
        return RunReport.of(state, recorded, "dead-lettered as " + state.getRunId() + "-" + record.sequence()
                + " (" + recorded + ")");
    }

    // --- Helpers ---

    private void transition(PipelineState state, PipelineStatus status) {
        state.setStatus(status);
        checkpoint(state);
    }

    private void checkpoint(PipelineState state) {
        state.setUpdatedAt(clock.instant());
        checkpointStore.save(state);
    }

    private Instant stageDeadline(RunConfiguration config, Instant runDeadline) {
        Instant stageDeadline = clock.instant().plus(config.stageTimeout());
        return stageDeadline.isBefore(runDeadline) ? stageDeadline : runDeadline;
    }

    private StageId firstPending(PipelineState state) {
        if (!state.isClassificationPassed()) {
            return StageId.CLASSIFICATION;
        }
        return StageId.analysisStages().stream().filter(s -> !state.passed(s)).findFirst().orElse(StageId.STAGE3);
    }

    String promptSignature(String profile) {
        List<String> parts = new ArrayList<>();
        parts.add(profile);
        for (StageId stage : StageId.values()) {
            parts.add(stage.name() + "=" + instructionProvider.loadInstructions(stage, profile).version());
        }
        return keyBuilder.hash(parts.toArray(new String[0]));
    }
}
