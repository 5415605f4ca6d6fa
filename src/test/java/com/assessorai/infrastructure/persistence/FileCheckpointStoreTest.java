package com.assessorai.infrastructure.persistence;

import com.assessorai.domain.pipeline.model.DocumentType;
import com.assessorai.domain.pipeline.model.FieldValue;
import com.assessorai.domain.pipeline.model.GateOutcome;
import com.assessorai.domain.pipeline.model.GateType;
import com.assessorai.domain.pipeline.model.GateVerdict;
import com.assessorai.domain.pipeline.model.InputDocument;
import com.assessorai.domain.pipeline.model.PipelineState;
import com.assessorai.domain.pipeline.model.PipelineStatus;
import com.assessorai.domain.pipeline.model.Stage1Payload;
import com.assessorai.domain.pipeline.model.StageId;
import com.assessorai.domain.pipeline.model.StageResult;
import com.assessorai.domain.pipeline.model.TokenUsage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileCheckpointStoreTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    @TempDir
    Path dir;

    private FileCheckpointStore store;

    @BeforeEach
    void setUp() {
        store = new FileCheckpointStore(dir, PipelineJson.create());
    }

    private PipelineState sampleState(String runId) {
        InputDocument primary = InputDocument.unclassified("doc-01", "doc-01.txt")
                .withExtraction("RECURSO ESPECIAL", 1, List.of(0.9))
                .withClassification(DocumentType.PRIMARY, "heuristic", 1.0);
        PipelineState state = PipelineState.start(runId, "default", List.of(primary), NOW);
        state.setClassificationPassed(true);
        state.getIntakeGates().add(GateOutcome.pass(GateType.EXTRACTION));
        Stage1Payload payload = new Stage1Payload(Map.of("appeal_type",
                new FieldValue("Recurso especial", "RECURSO ESPECIAL", 0.95, List.of())), List.of("tema"));
        state.recordAttempt(new StageResult(StageId.STAGE1, 1, payload, List.of("{}"), new TokenUsage(100, 50), 0,
                GateVerdict.PASS, List.of(GateOutcome.pass(GateType.FIELD_EVIDENCE)), List.of(), 0.95, List.of(),
                "gpt-4.1", "v1", 0, null, NOW));
        state.addUsage("gpt-4.1", new TokenUsage(100, 50), 0.0006);
        state.setStatus(PipelineStatus.STAGE2);
        return state;
    }

    @Test
    @DisplayName("A saved state loads back equal, payload variant included")
    void save_and_load() {
        PipelineState state = sampleState("run-1");

        store.save(state);
        PipelineState loaded = store.load("run-1").orElseThrow();

        assertThat(loaded).isEqualTo(state);
        assertThat(loaded.result(StageId.STAGE1).payload()).isInstanceOf(Stage1Payload.class);
        assertThat(loaded.passed(StageId.STAGE1)).isTrue();
        assertThat(loaded.getCheckpointKey()).isEqualTo("1:1");
    }

    @Test
    @DisplayName("Re-saving a loaded state leaves the file byte-identical")
    void reload_is_byte_identical() throws Exception {
        store.save(sampleState("run-1"));
        Path file = dir.resolve("run-1.json");
        byte[] before = Files.readAllBytes(file);

        store.save(store.load("run-1").orElseThrow());

        assertThat(Files.readAllBytes(file)).isEqualTo(before);
    }

    @Test
    @DisplayName("Archived runs leave the active set but still load")
    void archive() {
        PipelineState state = sampleState("run-1");
        store.save(state);
        state.setStatus(PipelineStatus.FINALIZED);

        store.archive(state);

        assertThat(dir.resolve("run-1.json")).doesNotExist();
        assertThat(dir.resolve("archive").resolve("run-1.json")).exists();
        assertThat(store.load("run-1")).hasValueSatisfying(
                s -> assertThat(s.getStatus()).isEqualTo(PipelineStatus.FINALIZED));
    }

    @Test
    @DisplayName("Unknown runs load empty and delete reports false")
    void unknown_run() {
        assertThat(store.load("run-none")).isEmpty();
        assertThat(store.delete("run-none")).isFalse();
    }

    @Test
    @DisplayName("Run ids that could escape the directory are rejected")
    void invalid_run_id() {
        assertThatThrownBy(() -> store.load("../etc/passwd")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.save(sampleState("a/b"))).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Purge removes checkpoints older than the cutoff")
    void purge() throws Exception {
        store.save(sampleState("run-old"));
        store.save(sampleState("run-new"));
        Files.setLastModifiedTime(dir.resolve("run-old.json"),
                FileTime.from(Instant.now().minusSeconds(86_400 * 10)));

        int removed = store.purgeOlderThan(Instant.now().minusSeconds(86_400 * 7));

        assertThat(removed).isEqualTo(1);
        assertThat(store.load("run-old")).isEmpty();
        assertThat(store.load("run-new")).isPresent();
    }
}
