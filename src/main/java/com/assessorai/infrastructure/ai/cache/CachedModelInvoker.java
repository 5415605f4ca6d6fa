package com.assessorai.infrastructure.ai.cache;

import com.assessorai.domain.pipeline.model.StageId;
import com.assessorai.domain.pipeline.model.TokenUsage;
import com.assessorai.infrastructure.ai.client.InvocationRequest;
import com.assessorai.infrastructure.ai.client.InvocationResult;
import com.assessorai.infrastructure.ai.client.ModelInvocationClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Lookup-before-invoke around the model client. Storing is a separate step so
 * callers only cache answers that cleared their quality gates.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CachedModelInvoker {

    private final ResponseCache cache;
    private final CacheKeyBuilder keyBuilder;
    private final ModelInvocationClient client;

    public CallOutcome call(StageId stageId, String instructionVersion, InvocationRequest request, Instant deadline) {
        CacheKey key = keyBuilder.key(stageId, request.payload(), instructionVersion, request.model());
        Optional<CachedResponse> cached = cache.lookup(key);
        if (cached.isPresent()) {
            log.info("[Cache] hit stage={} model={} fingerprint={}",
                    stageId, request.model(), key.fingerprint().substring(0, 12));
            return new CallOutcome(key, cached.get().content(), TokenUsage.ZERO, List.of(), true,
                    request.provider(), request.model());
        }
        return invoke(key, request, deadline);
    }

    /**
     * Always calls the model, e.g. for the second vote of a consensus pair.
     */
    public CallOutcome callUncached(StageId stageId, String instructionVersion, InvocationRequest request,
                                    Instant deadline) {
        CacheKey key = keyBuilder.key(stageId, request.payload(), instructionVersion, request.model());
        return invoke(key, request, deadline);
    }

    public void remember(CallOutcome outcome) {
        if (!outcome.fromCache()) {
            cache.store(outcome.key(), outcome.content(), outcome.usage());
        }
    }

    private CallOutcome invoke(CacheKey key, InvocationRequest request, Instant deadline) {
        InvocationResult result = client.invoke(request, deadline);
        return new CallOutcome(key, result.content(), result.usage(), result.attempts(), false,
                result.provider(), result.model());
    }
}
