package com.assessorai.infrastructure.ai.orchestration;

import com.assessorai.domain.pipeline.model.Alert;
import com.assessorai.domain.pipeline.model.BlockReason;
import com.assessorai.domain.pipeline.model.DeadLetterRecord;
import com.assessorai.domain.pipeline.model.ErrorKind;
import com.assessorai.domain.pipeline.model.GateType;
import com.assessorai.domain.pipeline.model.GateVerdict;
import com.assessorai.domain.pipeline.model.InputDocument;
import com.assessorai.domain.pipeline.model.PipelineState;
import com.assessorai.domain.pipeline.model.PipelineStatus;
import com.assessorai.domain.pipeline.model.RunConfiguration;
import com.assessorai.domain.pipeline.model.RunConfiguration.EscalationPolicy;
import com.assessorai.domain.pipeline.model.RunOutcome;
import com.assessorai.domain.pipeline.model.RunReport;
import com.assessorai.domain.pipeline.model.StageId;
import com.assessorai.domain.pipeline.model.StageResult;
import com.assessorai.infrastructure.ai.provider.ModelRequest;
import com.assessorai.infrastructure.ai.provider.ModelResponse;
import com.assessorai.infrastructure.ai.provider.ProviderCallException;
import com.assessorai.support.PipelineHarness;
import com.assessorai.support.TestConfigurations;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.function.Function;

import static com.assessorai.support.ScriptedModelProvider.complete;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PipelineOrchestratorTest {

    private static final String PRIMARY_TEXT = """
            RECURSO ESPECIAL

            O recorrente alega violação ao art. 489 do CPC.

            Requer o provimento do recurso.""";

    private static final String SUPPORTING_TEXT = """
            ACÓRDÃO

            EMENTA: Apelação cível. Recurso desprovido por unanimidade.

            Incide a Súmula 7/STJ.""";

    private static final String STAGE1_JSON = """
            {"fields": {"appeal_type": {"content": "Recurso especial", "evidence": "RECURSO ESPECIAL",
              "confidence": 0.95, "references": []}},
             "themes": ["violacao_art_489"]}""";

    private static final String STAGE1_UNSUPPORTED_JSON = """
            {"fields": {"appeal_type": {"content": "Recurso extraordinário", "evidence": "RECURSO EXTRAORDINÁRIO",
              "confidence": 0.95, "references": []}},
             "themes": ["violacao_art_489"]}""";

    private static final String STAGE2_JSON = """
            {"themes": {"violacao_art_489": {"content": "Óbice da Súmula 7", "evidence": "Incide a Súmula 7/STJ.",
              "confidence": 0.9, "references": ["STJ-7"]}}}""";

    private static final String STAGE2_WEAK_JSON = """
            {"themes": {"violacao_art_489": {"content": "Óbice da Súmula 7", "evidence": "Incide a Súmula 7/STJ.",
              "confidence": 0.5, "references": ["STJ-7"]}}}""";

    private static final String STAGE3_JSON = """
            {"fields": {"decision": {"content": "Inadmito o recurso especial",
              "evidence": "Recurso desprovido por unanimidade.", "confidence": 0.9, "references": ["STJ-7"]}},
             "citedReferences": ["STJ-7"],
             "transcript": "Apelação cível. Recurso desprovido por unanimidade."}""";

    private static final String STAGE3_CITES_X_JSON = """
            {"fields": {"decision": {"content": "Inadmito o recurso especial",
              "evidence": "Recurso desprovido por unanimidade.", "confidence": 0.9, "references": ["STJ-7"]}},
             "citedReferences": ["STJ-7", "X"],
             "transcript": "Apelação cível. Recurso desprovido por unanimidade."}""";

    private static final String STAGE1_MARKER = "STAGE: STAGE1";
    private static final String STAGE2_MARKER = "STAGE: STAGE2";
    private static final String STAGE3_MARKER = "STAGE: STAGE3";

    @TempDir
    Path dataDir;

    private PipelineHarness harness;
    private RunConfiguration config;

    @BeforeEach
    void setUp() {
        harness = new PipelineHarness(dataDir);
        config = TestConfigurations.runConfiguration();
    }

    @AfterEach
    void tearDown() {
        harness.close();
    }

    private static Function<ModelRequest, ModelResponse> script(Function<ModelRequest, ModelResponse> stage1,
                                                                Function<ModelRequest, ModelResponse> stage2,
                                                                Function<ModelRequest, ModelResponse> stage3) {
        return request -> {
            String payload = request.payload();
            if (payload.startsWith(STAGE1_MARKER)) {
                return stage1.apply(request);
            }
            if (payload.startsWith(STAGE2_MARKER)) {
                return stage2.apply(request);
            }
            if (payload.startsWith(STAGE3_MARKER)) {
                return stage3.apply(request);
            }
            return complete("{\"type\": \"UNKNOWN\", \"confidence\": 0.0}");
        };
    }

    private static Function<ModelRequest, ModelResponse> answer(String json) {
        return request -> complete(json);
    }

    private static Function<ModelRequest, ModelResponse> happyPath() {
        return script(answer(STAGE1_JSON), answer(STAGE2_JSON), answer(STAGE3_JSON));
    }

    private List<InputDocument> standardInputs() {
        return List.of(
                harness.input("doc-01", PRIMARY_TEXT, 3, 0.95),
                harness.input("doc-02", SUPPORTING_TEXT, 2, 0.9));
    }

    private PipelineState checkpoint(String runId) {
        return harness.checkpoints.load(runId).orElseThrow();
    }

    @Test
    @DisplayName("A complete run finalizes with exit code 0 and archives its checkpoint")
    void happy_path() {
        harness.script.set(happyPath());

        RunReport report = harness.orchestrator.run("run-happy", standardInputs(), config);

        assertThat(report.outcome()).isEqualTo(RunOutcome.FINALIZED);
        assertThat(report.exitCode()).isZero();
        assertThat(report.results()).containsOnlyKeys(StageId.STAGE1, StageId.STAGE2, StageId.STAGE3);
        assertThat(report.globalConfidence()).isGreaterThan(0.75);
        assertThat(report.escalations()).isEmpty();
        assertThat(report.promptTokens()).isEqualTo(300);
        assertThat(report.completionTokens()).isEqualTo(150);
        assertThat(report.estimatedCostUsd()).isPositive();
        assertThat(harness.provider.requests()).hasSize(3);
        assertThat(checkpoint("run-happy").getStatus()).isEqualTo(PipelineStatus.FINALIZED);
        assertThat(dataDir.resolve("checkpoints").resolve("run-happy.json")).doesNotExist();
        assertThat(dataDir.resolve("checkpoints").resolve("archive").resolve("run-happy.json")).exists();
    }

    @Test
    @DisplayName("A 50-page document at quality 0.1 blocks at extraction before any model call")
    void extraction_blocks_low_quality() {
        harness.script.set(happyPath());
        List<InputDocument> inputs = List.of(
                harness.input("doc-01", PRIMARY_TEXT, 50, 0.1),
                harness.input("doc-02", SUPPORTING_TEXT, 2, 0.9));

        RunReport report = harness.orchestrator.run("run-scan", inputs, config);

        assertThat(report.exitCode()).isEqualTo(1);
        assertThat(report.block().reason()).isEqualTo(BlockReason.GATE);
        assertThat(report.block().gate()).isEqualTo(GateType.EXTRACTION);
        assertThat(report.block().stage()).isEqualTo(StageId.CLASSIFICATION);
        assertThat(report.message()).contains("quality 0.10 below minimum 0.20", "50 pages");
        assertThat(report.errorKind()).isEqualTo(ErrorKind.GATE_FAILURE);
        assertThat(harness.provider.requests()).isEmpty();
        assertThat(checkpoint("run-scan").getStatus()).isEqualTo(PipelineStatus.BLOCKED);
    }

    @Test
    @DisplayName("A failed extraction is recorded as an alert and blocks the run")
    void extraction_failure_alert() {
        harness.script.set(happyPath());
        List<InputDocument> inputs = List.of(
                harness.input("doc-01", PRIMARY_TEXT, 3, 0.95),
                InputDocument.unclassified("doc-02", "missing.pdf"));

        RunReport report = harness.orchestrator.run("run-missing", inputs, config);

        assertThat(report.exitCode()).isEqualTo(1);
        assertThat(report.block().gate()).isEqualTo(GateType.EXTRACTION);
        assertThat(report.alerts()).extracting(Alert::code).containsExactly("EXTRACTION_FAILED");
    }

    @Test
    @DisplayName("No primary document blocks at classification")
    void no_primary_blocks() {
        harness.script.set(happyPath());
        List<InputDocument> inputs = List.of(
                harness.input("doc-01", SUPPORTING_TEXT, 2, 0.9),
                harness.input("doc-02", SUPPORTING_TEXT, 2, 0.9));

        RunReport report = harness.orchestrator.run("run-no-primary", inputs, config);

        assertThat(report.exitCode()).isEqualTo(1);
        assertThat(report.block().gate()).isEqualTo(GateType.CLASSIFICATION);
        assertThat(report.message()).contains("expected exactly 1 PRIMARY document, found 0");
        assertThat(harness.provider.requestsContaining(STAGE1_MARKER)).isEmpty();
    }

    @Test
    @DisplayName("Two primary documents block at classification")
    void two_primaries_block() {
        harness.script.set(happyPath());
        List<InputDocument> inputs = List.of(
                harness.input("doc-01", PRIMARY_TEXT, 3, 0.95),
                harness.input("doc-02", PRIMARY_TEXT, 3, 0.95),
                harness.input("doc-03", SUPPORTING_TEXT, 2, 0.9));

        RunReport report = harness.orchestrator.run("run-two-primaries", inputs, config);

        assertThat(report.exitCode()).isEqualTo(1);
        assertThat(report.message()).contains("found 2");
        assertThat(harness.provider.requestsContaining(STAGE1_MARKER)).isEmpty();
    }

    @Test
    @DisplayName("Unmatched Stage 1 evidence is retried with corrections, then blocks; Stage 2 never runs")
    void stage1_blocked_stops_the_run() {
        harness.script.set(script(answer(STAGE1_UNSUPPORTED_JSON), answer(STAGE2_JSON), answer(STAGE3_JSON)));

        RunReport report = harness.orchestrator.run("run-stage1", standardInputs(), config);

        assertThat(report.exitCode()).isEqualTo(1);
        assertThat(report.block().stage()).isEqualTo(StageId.STAGE1);
        assertThat(report.block().gate()).isEqualTo(GateType.FIELD_EVIDENCE);
        assertThat(report.results()).isEmpty();
        List<ModelRequest> stage1Calls = harness.provider.requestsContaining(STAGE1_MARKER);
        assertThat(stage1Calls).hasSize(2);
        assertThat(stage1Calls.get(0).payload()).doesNotContain("CORRECTION");
        assertThat(stage1Calls.get(1).payload()).contains("CORRECTION", "field 'appeal_type' evidence not found");
        assertThat(harness.provider.requestsContaining(STAGE2_MARKER)).isEmpty();
        assertThat(checkpoint("run-stage1").getAttempts()).hasSize(2);
    }

    @Test
    @DisplayName("Resuming a run blocked on field evidence asks the model again instead of replaying rejected answers")
    void resume_after_evidence_block_reaches_the_model() {
        harness.script.set(script(answer(STAGE1_UNSUPPORTED_JSON), answer(STAGE2_JSON), answer(STAGE3_JSON)));
        RunReport blocked = harness.orchestrator.run("run-evidence", standardInputs(), config);
        assertThat(blocked.block().gate()).isEqualTo(GateType.FIELD_EVIDENCE);

        harness.script.set(happyPath());
        RunReport resumed = harness.orchestrator.resume(checkpoint("run-evidence"), config);

        assertThat(resumed.exitCode()).isZero();
        assertThat(resumed.block()).isNull();
        assertThat(harness.provider.requestsContaining(STAGE1_MARKER)).hasSize(3);
        assertThat(checkpoint("run-evidence").getAttempts()).extracting(StageResult::verdict)
                .startsWith(GateVerdict.RETRY, GateVerdict.BLOCK, GateVerdict.PASS);
    }

    @Test
    @DisplayName("Stage 3 citing a reference absent from Stage 2 blocks with the reason naming it")
    void stage3_incoherent_citation() {
        harness.script.set(script(answer(STAGE1_JSON), answer(STAGE2_JSON), answer(STAGE3_CITES_X_JSON)));

        RunReport report = harness.orchestrator.run("run-cites-x", standardInputs(), config);

        assertThat(report.exitCode()).isEqualTo(1);
        assertThat(report.block().stage()).isEqualTo(StageId.STAGE3);
        assertThat(report.block().gate()).isEqualTo(GateType.COHERENCE);
        assertThat(report.block().details()).contains("cited reference 'X' absent from stage 2 analysis");
        assertThat(report.message()).contains("'X'");
        assertThat(report.results()).containsOnlyKeys(StageId.STAGE1, StageId.STAGE2);
        assertThat(harness.provider.requestsContaining(STAGE3_MARKER)).hasSize(1);
    }

    @Test
    @DisplayName("Resuming after an abort does not repeat the passed Stage 1")
    void abort_then_resume_is_idempotent() {
        String runId = "run-abort";
        Function<ModelRequest, ModelResponse> abortingStage1 = request -> {
            harness.orchestrator.abort(runId);
            return complete(STAGE1_JSON);
        };
        harness.script.set(script(abortingStage1, answer(STAGE2_JSON), answer(STAGE3_JSON)));

        RunReport blocked = harness.orchestrator.run(runId, standardInputs(), config);

        assertThat(blocked.exitCode()).isEqualTo(1);
        assertThat(blocked.block().reason()).isEqualTo(BlockReason.USER_ABORT);
        assertThat(blocked.block().stage()).isEqualTo(StageId.STAGE2);
        assertThat(harness.orchestrator.isActive(runId)).isFalse();

        harness.script.set(happyPath());
        RunReport resumed = harness.orchestrator.resume(checkpoint(runId), config);

        assertThat(resumed.exitCode()).isZero();
        assertThat(resumed.block()).isNull();
        assertThat(harness.provider.requestsContaining(STAGE1_MARKER)).hasSize(1);
        assertThat(harness.provider.requestsContaining(STAGE2_MARKER)).hasSize(1);
        assertThat(checkpoint(runId).getAttempts()).extracting(StageResult::stageId)
                .containsExactly(StageId.STAGE1, StageId.STAGE2, StageId.STAGE3);
    }

    @Test
    @DisplayName("Resuming with changed instruction sets records an alert")
    void resume_with_changed_instructions() {
        String runId = "run-signature";
        Function<ModelRequest, ModelResponse> abortingStage1 = request -> {
            harness.orchestrator.abort(runId);
            return complete(STAGE1_JSON);
        };
        harness.script.set(script(abortingStage1, answer(STAGE2_JSON), answer(STAGE3_JSON)));
        harness.orchestrator.run(runId, standardInputs(), config);

        harness.instructionVersion.set("v2");
        harness.script.set(happyPath());
        RunReport resumed = harness.orchestrator.resume(checkpoint(runId), config);

        assertThat(resumed.exitCode()).isZero();
        assertThat(resumed.alerts()).extracting(Alert::code).contains("PROMPT_SIGNATURE_CHANGED");
    }

    @Test
    @DisplayName("A fatal provider error dead-letters the run with exit code 2")
    void fatal_error_dead_letters() {
        Function<ModelRequest, ModelResponse> unauthorized = request -> {
            throw new ProviderCallException(ErrorKind.FATAL, "401 Unauthorized: invalid key sk-live-abcdefgh12345");
        };
        harness.script.set(script(unauthorized, answer(STAGE2_JSON), answer(STAGE3_JSON)));

        RunReport report = harness.orchestrator.run("run-fatal", standardInputs(), config);

        assertThat(report.outcome()).isEqualTo(RunOutcome.DEAD_LETTERED);
        assertThat(report.exitCode()).isEqualTo(2);
        assertThat(report.errorKind()).isEqualTo(ErrorKind.FATAL);
        assertThat(report.message()).contains("dead-lettered as run-fatal-1");

        List<DeadLetterRecord> letters = harness.deadLetters.findByRunId("run-fatal");
        assertThat(letters).singleElement().satisfies(letter -> {
            assertThat(letter.sequence()).isEqualTo(1);
            assertThat(letter.errorKind()).isEqualTo(ErrorKind.FATAL);
            assertThat(letter.failingStage()).isEqualTo(StageId.STAGE1);
            assertThat(letter.errorMessage()).doesNotContain("abcdefgh12345");
            assertThat(letter.retryHistory()).hasSize(1);
            assertThat(letter.snapshot().getStatus()).isEqualTo(PipelineStatus.DEAD_LETTERED);
        });
        PipelineState state = checkpoint("run-fatal");
        assertThat(state.getStatus()).isEqualTo(PipelineStatus.DEAD_LETTERED);
        assertThatThrownBy(() -> harness.orchestrator.resume(state, config))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("A stage that runs out of time blocks resumably instead of dead-lettering")
    void stage_timeout_is_resumable() {
        Function<ModelRequest, ModelResponse> overloaded = request -> {
            throw new ProviderCallException(ErrorKind.TRANSIENT, "503 overloaded");
        };
        harness.script.set(script(overloaded, answer(STAGE2_JSON), answer(STAGE3_JSON)));
        RunConfiguration tight = config.toBuilder().stageTimeout(Duration.ofSeconds(2)).build();

        RunReport blocked = harness.orchestrator.run("run-slow", standardInputs(), tight);

        assertThat(blocked.exitCode()).isEqualTo(1);
        assertThat(blocked.block().reason()).isEqualTo(BlockReason.STAGE_TIMEOUT);
        assertThat(blocked.block().stage()).isEqualTo(StageId.STAGE1);
        assertThat(harness.deadLetters.findByRunId("run-slow")).isEmpty();

        harness.script.set(happyPath());
        RunReport resumed = harness.orchestrator.resume(checkpoint("run-slow"), config);

        assertThat(resumed.exitCode()).isZero();
    }

    @Test
    @DisplayName("A low-confidence theme is queued for review and the run still finalizes")
    void escalation_does_not_block_by_default() {
        harness.script.set(script(answer(STAGE1_JSON), answer(STAGE2_WEAK_JSON), answer(STAGE3_JSON)));

        RunReport report = harness.orchestrator.run("run-escalate", standardInputs(), config);

        assertThat(report.exitCode()).isZero();
        assertThat(report.escalations()).singleElement().asString()
                .startsWith("STAGE2: theme 'violacao_art_489' confidence 0.50");
        assertThat(report.alerts()).extracting(Alert::code).contains("ESCALATION");
    }

    @Test
    @DisplayName("With block-on-escalation a low-confidence theme blocks the run")
    void escalation_blocks_when_configured() {
        harness.script.set(script(answer(STAGE1_JSON), answer(STAGE2_WEAK_JSON), answer(STAGE3_JSON)));
        RunConfiguration strict = config.toBuilder().escalation(new EscalationPolicy(true)).build();

        RunReport report = harness.orchestrator.run("run-strict", standardInputs(), strict);

        assertThat(report.exitCode()).isEqualTo(1);
        assertThat(report.block().reason()).isEqualTo(BlockReason.ESCALATION);
        assertThat(report.block().stage()).isEqualTo(StageId.STAGE2);
        assertThat(harness.provider.requestsContaining(STAGE3_MARKER)).isEmpty();
    }

    @Test
    @DisplayName("A run id cannot be started twice, and a finalized run resumes to the same report")
    void run_ids_are_unique() {
        harness.script.set(happyPath());
        harness.orchestrator.run("run-once", standardInputs(), config);
        int calls = harness.provider.requests().size();

        assertThatThrownBy(() -> harness.orchestrator.run("run-once", standardInputs(), config))
                .isInstanceOf(IllegalArgumentException.class);
        RunReport again = harness.orchestrator.resume(checkpoint("run-once"), config);

        assertThat(again.exitCode()).isZero();
        assertThat(harness.provider.requests()).hasSize(calls);
    }

    @Test
    @DisplayName("Identical runs are served from the response cache")
    void second_run_hits_cache() {
        harness.script.set(happyPath());
        harness.orchestrator.run("run-first", standardInputs(), config);

        RunReport second = harness.orchestrator.run("run-second", standardInputs(), config);

        assertThat(second.exitCode()).isZero();
        assertThat(harness.provider.requests()).hasSize(3);
        assertThat(second.promptTokens()).isZero();
    }
}
