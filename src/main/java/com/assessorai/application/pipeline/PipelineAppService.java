package com.assessorai.application.pipeline;

import com.assessorai.application.pipeline.exception.RunNotFoundException;
import com.assessorai.application.pipeline.exception.RunNotResumableException;
import com.assessorai.domain.pipeline.model.DeadLetterRecord;
import com.assessorai.domain.pipeline.model.InputDocument;
import com.assessorai.domain.pipeline.model.PipelineState;
import com.assessorai.domain.pipeline.model.PipelineStatus;
import com.assessorai.domain.pipeline.model.RunConfiguration;
import com.assessorai.domain.pipeline.model.RunReport;
import com.assessorai.domain.pipeline.repository.CheckpointStore;
import com.assessorai.domain.pipeline.repository.DeadLetterQueue;
import com.assessorai.infrastructure.ai.orchestration.PipelineOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * The operations exposed to front-ends: run, resume and inspect-deadletter, plus abort and discard.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PipelineAppService {

    private final PipelineOrchestrator orchestrator;
    private final CheckpointStore checkpointStore;
    private final DeadLetterQueue deadLetterQueue;
    private final RunConfiguration defaultConfiguration;

    /**
     * Starts a run over the given input files.
     *
     * @param runId   caller-chosen id, or null for a generated one
     * @param profile instruction profile, or null for the configured default
     */
    public RunReport run(String runId, List<String> inputs, String profile) {
        if (inputs == null || inputs.isEmpty()) {
            throw new IllegalArgumentException("At least one input is required");
        }
        String id = runId == null || runId.isBlank() ? newRunId() : runId.trim();
        List<InputDocument> documents = new ArrayList<>();
        for (int i = 0; i < inputs.size(); i++) {
            documents.add(InputDocument.unclassified(documentId(i, inputs.get(i)), inputs.get(i)));
        }
        RunConfiguration config = profile == null || profile.isBlank()
                ? defaultConfiguration
                : defaultConfiguration.toBuilder().profile(profile.trim()).build();
        log.info("[Pipeline] starting run {} with {} input(s), profile={}", id, documents.size(), config.profile());
        return orchestrator.run(id, documents, config);
    }

    public RunReport resume(String runId) {
        PipelineState state = checkpointStore.load(runId).orElseThrow(() -> new RunNotFoundException(runId));
        if (state.getStatus() == PipelineStatus.DEAD_LETTERED) {
            throw new RunNotResumableException("Run " + runId + " is dead-lettered; inspect its dead letters");
        }
        if (orchestrator.isActive(runId)) {
            throw new RunNotResumableException("Run " + runId + " is already executing");
        }
        log.info("[Pipeline] resuming run {} from {} ({})", runId, state.getStatus(), state.getCheckpointKey());
        return orchestrator.resume(state, defaultConfiguration);
    }

    public List<DeadLetterRecord> inspectDeadLetters(String runId) {
        return deadLetterQueue.findByRunId(runId);
    }

    public boolean abort(String runId) {
        return orchestrator.abort(runId);
    }

    /**
     * Drops the checkpoint of a run that will not be resumed.
     */
    public void discard(String runId) {
        if (orchestrator.isActive(runId)) {
            throw new RunNotResumableException("Run " + runId + " is executing; abort it first");
        }
        if (!checkpointStore.delete(runId)) {
            throw new RunNotFoundException(runId);
        }
        log.info("[Pipeline] discarded run {}", runId);
    }

    private static String documentId(int index, String ref) {
        Path name = Path.of(ref).getFileName();
        String base = name == null ? "" : name.toString().replaceAll("[^A-Za-z0-9._-]", "_");
        return String.format("doc-%02d%s", index + 1, base.isEmpty() ? "" : "-" + base);
    }

    private static String newRunId() {
        return "run-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
