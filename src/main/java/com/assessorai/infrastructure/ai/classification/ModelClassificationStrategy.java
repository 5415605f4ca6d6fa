package com.assessorai.infrastructure.ai.classification;

import com.assessorai.domain.pipeline.model.DocumentType;
import com.assessorai.domain.pipeline.model.ErrorKind;
import com.assessorai.domain.pipeline.model.InputDocument;
import com.assessorai.domain.pipeline.model.RunConfiguration;
import com.assessorai.domain.pipeline.model.StageId;
import com.assessorai.domain.pipeline.service.InstructionSetProvider;
import com.assessorai.domain.pipeline.service.InstructionSetProvider.InstructionSet;
import com.assessorai.infrastructure.ai.client.InvocationRequest;
import com.assessorai.infrastructure.ai.client.InvocationResult;
import com.assessorai.infrastructure.ai.client.ModelInvocationClient;
import com.assessorai.infrastructure.ai.client.ModelInvocationException;
import com.assessorai.infrastructure.ai.routing.ModelRouter;
import com.assessorai.infrastructure.ai.routing.ModelTarget;
import com.assessorai.infrastructure.ai.stage.PayloadValidationException;
import com.assessorai.infrastructure.ai.stage.StagePayloadParser;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Locale;
import java.util.Optional;

/**
 * Routine-model fallback. Expects {"type": "PRIMARY|SUPPORTING|UNKNOWN", "confidence": 0..1}.
 * An unparseable or truncated answer yields UNKNOWN with zero confidence.
 */
@Slf4j
@RequiredArgsConstructor
public class ModelClassificationStrategy implements ClassificationStrategy {

    static final int EXCERPT_CHARS = 4000;

    private final ModelInvocationClient client;
    private final ModelRouter router;
    private final InstructionSetProvider instructionProvider;
    private final StagePayloadParser parser;

    @Override
    public String name() {
        return "model";
    }

    @Override
    public Optional<ClassificationVerdict> classify(InputDocument document, RunConfiguration config, Instant deadline) {
        InstructionSet instructions = instructionProvider.loadInstructions(StageId.CLASSIFICATION, config.profile());
        ModelTarget target = router.route(StageId.CLASSIFICATION);
        String text = document.extractedText() == null ? "" : document.extractedText();
        String excerpt = text.length() > EXCERPT_CHARS ? text.substring(0, EXCERPT_CHARS) : text;

        InvocationRequest request = new InvocationRequest(target.provider(), target.model(), instructions.text(),
                "DOCUMENT " + document.id() + ":\n<<<\n" + excerpt + "\n>>>",
                config.maxOutputTokens(StageId.CLASSIFICATION), 0.0);
        InvocationResult result;
        try {
            result = client.invoke(request, deadline);
        } catch (ModelInvocationException e) {
            if (e.getKind() != ErrorKind.GATE_FAILURE) {
                throw e;
            }
            log.warn("[Classifier] model answer for {} incomplete after retries", document.id());
            return Optional.of(new ClassificationVerdict(DocumentType.UNKNOWN, 0.0, name(), e.usage(),
                    target.model()));
        }

        try {
            JsonNode node = parser.readObject(result.content());
            DocumentType type = DocumentType.valueOf(node.path("type").asText("UNKNOWN").trim().toUpperCase(Locale.ROOT));
            double confidence = Math.max(0.0, Math.min(1.0, node.path("confidence").asDouble(0.0)));
            log.info("[Classifier] model verdict {} -> {} ({})", document.id(), type, confidence);
            return Optional.of(new ClassificationVerdict(type, confidence, name(), result.usage(), target.model()));
        } catch (PayloadValidationException | IllegalArgumentException e) {
            log.warn("[Classifier] unusable model answer for {}: {}", document.id(), e.getMessage());
            return Optional.of(new ClassificationVerdict(DocumentType.UNKNOWN, 0.0, name(), result.usage(),
                    target.model()));
        }
    }
}
