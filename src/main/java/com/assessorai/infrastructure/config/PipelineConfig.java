package com.assessorai.infrastructure.config;

import com.assessorai.domain.pipeline.model.Criticality;
import com.assessorai.domain.pipeline.model.RunConfiguration;
import com.assessorai.domain.pipeline.model.RunConfiguration.ConsensusPolicy;
import com.assessorai.domain.pipeline.model.RunConfiguration.EscalationPolicy;
import com.assessorai.domain.pipeline.model.RunConfiguration.GateThresholds;
import com.assessorai.domain.pipeline.model.StageId;
import com.assessorai.domain.pipeline.repository.CheckpointStore;
import com.assessorai.domain.pipeline.repository.DeadLetterQueue;
import com.assessorai.domain.pipeline.service.InstructionSetProvider;
import com.assessorai.infrastructure.ai.cache.CacheMetricsTracker;
import com.assessorai.infrastructure.ai.cache.ResponseCache;
import com.assessorai.infrastructure.ai.classification.DocumentClassifier;
import com.assessorai.infrastructure.ai.classification.HeuristicClassificationStrategy;
import com.assessorai.infrastructure.ai.classification.ModelClassificationStrategy;
import com.assessorai.infrastructure.ai.client.ModelInvocationClient;
import com.assessorai.infrastructure.ai.client.RetryPolicy;
import com.assessorai.infrastructure.ai.client.Sleeper;
import com.assessorai.infrastructure.ai.orchestration.CostEstimator;
import com.assessorai.infrastructure.ai.routing.ModelRouter;
import com.assessorai.infrastructure.ai.routing.ModelTarget;
import com.assessorai.infrastructure.ai.routing.RoutingTable;
import com.assessorai.infrastructure.ai.stage.StagePayloadParser;
import com.assessorai.infrastructure.persistence.FileCheckpointStore;
import com.assessorai.infrastructure.persistence.FileDeadLetterQueue;
import com.assessorai.infrastructure.persistence.PipelineJson;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Builds the immutable settings objects of the pipeline from {@code assessor.*} properties.
 */
@Slf4j
@Configuration
public class PipelineConfig {

    // --- Budget ---

    @Value("${assessor.profile:default}")
    private String profile;

    @Value("${assessor.budget.ratio:0.7}")
    private double budgetRatio;

    @Value("${assessor.budget.overlap-tokens:500}")
    private int overlapTokens;

    @Value("${assessor.budget.max-segments:0}")
    private int maxSegments;

    @Value("${assessor.output-tokens.classification:200}")
    private int classificationOutputTokens;

    @Value("${assessor.output-tokens.stage1:1400}")
    private int stage1OutputTokens;

    @Value("${assessor.output-tokens.stage2:2200}")
    private int stage2OutputTokens;

    @Value("${assessor.output-tokens.stage3:3200}")
    private int stage3OutputTokens;

    @Value("${assessor.temperature:0.0}")
    private double temperature;

    // --- Gates ---

    @Value("${assessor.gates.min-extraction-quality:0.2}")
    private double minExtractionQuality;

    @Value("${assessor.gates.max-noise-ratio:0.95}")
    private double maxNoiseRatio;

    @Value("${assessor.gates.min-supporting-documents:1}")
    private int minSupportingDocuments;

    @Value("${assessor.gates.min-coverage-ratio:0.9}")
    private double minCoverageRatio;

    @Value("${assessor.gates.min-classification-confidence:0.7}")
    private double minClassificationConfidence;

    @Value("${assessor.gates.field-confidence:0.75}")
    private double fieldConfidence;

    @Value("${assessor.gates.theme-confidence:0.70}")
    private double themeConfidence;

    @Value("${assessor.gates.global-confidence:0.75}")
    private double globalConfidence;

    @Value("${assessor.gates.validate-references:true}")
    private boolean validateReferences;

    @Value("${assessor.gates.max-stage-attempts:2}")
    private int maxStageAttempts;

    @Value("${assessor.gates.block-on-escalation:false}")
    private boolean blockOnEscalation;

    @Value("${assessor.stages.stage1.critical-fields:}")
    private List<String> stage1CriticalFields;

    @Value("${assessor.stages.stage3.critical-fields:decision}")
    private List<String> stage3CriticalFields;

    @Value("${assessor.consensus.enabled:false}")
    private boolean consensusEnabled;

    @Value("${assessor.consensus.tie-break:PREFER_HIGHER_CONFIDENCE}")
    private ConsensusPolicy.TieBreak tieBreak;

    // --- Timeouts and retries ---

    @Value("${assessor.timeouts.call-seconds:90}")
    private long callTimeoutSeconds;

    @Value("${assessor.timeouts.stage-seconds:600}")
    private long stageTimeoutSeconds;

    @Value("${assessor.timeouts.run-seconds:1800}")
    private long runTimeoutSeconds;

    @Value("${assessor.timeouts.worker-seconds:240}")
    private long workerTimeoutSeconds;

    @Value("${assessor.retry.max-attempts:3}")
    private int retryAttempts;

    @Value("${assessor.retry.base-backoff-ms:1000}")
    private long baseBackoffMs;

    @Value("${assessor.retry.max-backoff-ms:30000}")
    private long maxBackoffMs;

    @Value("${assessor.retry.max-tokens-limit:8192}")
    private int maxTokensLimit;

    @Value("${assessor.retry.min-token-step:256}")
    private int minTokenStep;

    // --- Routing ---

    @Value("${assessor.routing.routine.provider:openai}")
    private String routineProvider;

    @Value("${assessor.routing.routine.model:gpt-4.1-mini}")
    private String routineModel;

    @Value("${assessor.routing.critical.provider:openai}")
    private String criticalProvider;

    @Value("${assessor.routing.critical.model:gpt-4.1}")
    private String criticalModel;

    @Value("${assessor.routing.context-window:25000}")
    private int contextWindow;

    // --- Pools, cache, storage ---

    @Value("${assessor.stage2.parallel-themes:true}")
    private boolean parallelThemes;

    @Value("${assessor.stage2.workers:3}")
    private int themeWorkers;

    @Value("${assessor.cache.maximum-size:10000}")
    private long cacheMaximumSize;

    @Value("${assessor.cache.ttl-hours:24}")
    private long cacheTtlHours;

    @Value("${assessor.storage.checkpoint-dir:data/checkpoints}")
    private String checkpointDir;

    @Value("${assessor.storage.dead-letter-dir:data/dead-letters}")
    private String deadLetterDir;

    @Bean
    public RunConfiguration runConfiguration() {
        Map<StageId, Integer> outputTokens = new EnumMap<>(StageId.class);
        outputTokens.put(StageId.CLASSIFICATION, classificationOutputTokens);
        outputTokens.put(StageId.STAGE1, stage1OutputTokens);
        outputTokens.put(StageId.STAGE2, stage2OutputTokens);
        outputTokens.put(StageId.STAGE3, stage3OutputTokens);

        Map<StageId, Double> ratios = new EnumMap<>(StageId.class);
        StageId.analysisStages().forEach(stage -> ratios.put(stage, budgetRatio));

        Map<StageId, List<String>> criticalFields = new EnumMap<>(StageId.class);
        criticalFields.put(StageId.STAGE1, clean(stage1CriticalFields));
        criticalFields.put(StageId.STAGE3, clean(stage3CriticalFields));

        return RunConfiguration.builder()
                .profile(profile)
                .budgetRatios(ratios)
                .chunkOverlapTokens(overlapTokens)
                .maxSegments(maxSegments)
                .maxOutputTokens(outputTokens)
                .temperature(temperature)
                .thresholds(new GateThresholds(minExtractionQuality, maxNoiseRatio, minSupportingDocuments,
                        minCoverageRatio, minClassificationConfidence, fieldConfidence, themeConfidence,
                        globalConfidence))
                .criticalFields(criticalFields)
                .validateReferences(validateReferences)
                .maxStageAttempts(maxStageAttempts)
                .escalation(new EscalationPolicy(blockOnEscalation))
                .consensus(new ConsensusPolicy(consensusEnabled, tieBreak))
                .parallelThemes(parallelThemes)
                .workerTimeout(Duration.ofSeconds(workerTimeoutSeconds))
                .stageTimeout(Duration.ofSeconds(stageTimeoutSeconds))
                .runTimeout(Duration.ofSeconds(runTimeoutSeconds))
                .build();
    }

    @Bean
    public RetryPolicy retryPolicy() {
        return new RetryPolicy(retryAttempts, Duration.ofMillis(baseBackoffMs), Duration.ofMillis(maxBackoffMs),
                Duration.ofSeconds(callTimeoutSeconds), maxTokensLimit, minTokenStep);
    }

    @Bean
    public RoutingTable routingTable() {
        return new RoutingTable(Map.of(
                Criticality.ROUTINE, new ModelTarget(routineProvider, routineModel, contextWindow),
                Criticality.CRITICAL, new ModelTarget(criticalProvider, criticalModel, contextWindow)),
                Map.of());
    }

    @Bean
    public ResponseCache responseCache(Clock clock, CacheMetricsTracker metrics) {
        log.info("Response cache: maximumSize={}, ttl={}h", cacheMaximumSize, cacheTtlHours);
        return new ResponseCache(cacheMaximumSize, Duration.ofHours(cacheTtlHours), clock, metrics);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.threadSleep();
    }

    @Bean(destroyMethod = "shutdownNow")
    @Qualifier("modelCallExecutor")
    public ExecutorService modelCallExecutor() {
        return Executors.newCachedThreadPool(named("model-call"));
    }

    @Bean(destroyMethod = "shutdownNow")
    @Qualifier("themeAnalysisPool")
    public ExecutorService themeAnalysisPool() {
        return Executors.newFixedThreadPool(Math.max(1, themeWorkers), named("theme-worker"));
    }

    @Bean
    public DocumentClassifier documentClassifier(Environment environment,
                                                 ModelInvocationClient client,
                                                 ModelRouter router,
                                                 InstructionSetProvider instructionProvider,
                                                 StagePayloadParser parser) {
        Binder binder = Binder.get(environment);
        List<String> primary = binder.bind("assessor.classification.primary-patterns",
                Bindable.listOf(String.class)).orElse(List.of());
        List<String> supporting = binder.bind("assessor.classification.supporting-patterns",
                Bindable.listOf(String.class)).orElse(List.of());
        log.info("Classifier: {} primary and {} supporting patterns, model fallback enabled",
                primary.size(), supporting.size());
        return new DocumentClassifier(List.of(
                new HeuristicClassificationStrategy(primary, supporting),
                new ModelClassificationStrategy(client, router, instructionProvider, parser)));
    }

    @Bean
    public CostEstimator costEstimator() {
        return new CostEstimator(CostEstimator.DEFAULT_PRICES);
    }

    @Bean
    public CheckpointStore checkpointStore() {
        return new FileCheckpointStore(Path.of(checkpointDir), PipelineJson.create());
    }

    @Bean
    public DeadLetterQueue deadLetterQueue() {
        return new FileDeadLetterQueue(Path.of(deadLetterDir), PipelineJson.create());
    }

    private static List<String> clean(List<String> values) {
        return values == null ? List.of() : values.stream().map(String::trim).filter(v -> !v.isEmpty()).toList();
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
