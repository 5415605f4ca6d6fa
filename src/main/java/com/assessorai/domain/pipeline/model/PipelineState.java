package com.assessorai.domain.pipeline.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Full state of one run. Owned by the orchestrator and checkpointed after
 * every transition; the serialized form is what resume reads back.
 */
@Data
@NoArgsConstructor
public class PipelineState {

    public static final int SCHEMA_VERSION = 1;

    private int schemaVersion = SCHEMA_VERSION;
    private String runId;
    private PipelineStatus status;
    private int stageCursor;
    private String profile;
    private String promptSignature;
    private String checkpointKey;

    // --- Inputs ---
    private List<InputDocument> documents = new ArrayList<>();
    private List<GateOutcome> intakeGates = new ArrayList<>();
    private boolean classificationPassed;

    // --- Stage results ---
    private Map<StageId, StageResult> results = new EnumMap<>(StageId.class);
    private List<StageResult> attempts = new ArrayList<>();
    private Map<StageId, ChunkPlan> chunkPlans = new EnumMap<>(StageId.class);

    // --- Accounting ---
    private long promptTokens;
    private long completionTokens;
    private double estimatedCostUsd;
    private Map<String, TokenUsage> usageByModel = new TreeMap<>();

    // --- Review ---
    private List<Alert> alerts = new ArrayList<>();
    private List<String> escalations = new ArrayList<>();
    private Double globalConfidence;
    private BlockInfo block;

    private Instant createdAt;
    private Instant updatedAt;

    public static PipelineState start(String runId, String profile, List<InputDocument> documents, Instant now) {
        PipelineState state = new PipelineState();
        state.setRunId(runId);
        state.setProfile(profile);
        state.setStatus(PipelineStatus.CLASSIFYING);
        state.setDocuments(new ArrayList<>(documents));
        state.setCreatedAt(now);
        state.setUpdatedAt(now);
        state.setCheckpointKey("0:0");
        return state;
    }

    public StageResult result(StageId stageId) {
        return results.get(stageId);
    }

    public boolean passed(StageId stageId) {
        if (stageId == StageId.CLASSIFICATION) {
            return classificationPassed;
        }
        StageResult result = results.get(stageId);
        return result != null && result.passed();
    }

    public int nextAttempt(StageId stageId) {
        return (int) attempts.stream().filter(a -> a.stageId() == stageId).count() + 1;
    }

    /**
     * Appends an attempt to the audit trail and makes it the current result of its stage.
     */
    public void recordAttempt(StageResult result) {
        attempts.add(result);
        results.put(result.stageId(), result);
        checkpointKey = result.stageId().index() + ":" + result.attempt();
    }

    public void advanceCursor(StageId stageId) {
        stageCursor = Math.max(stageCursor, stageId.index());
    }

    public void addUsage(String modelId, TokenUsage usage, double costUsd) {
        promptTokens += usage.promptTokens();
        completionTokens += usage.completionTokens();
        estimatedCostUsd += costUsd;
        usageByModel.merge(modelId, usage, TokenUsage::plus);
    }

    public void addAlert(String code, String message, StageId stage, Instant at) {
        alerts.add(new Alert(code, message, stage, at));
    }

    public List<InputDocument> documentsOfType(DocumentType type) {
        return documents.stream().filter(d -> d.type() == type).toList();
    }
}
