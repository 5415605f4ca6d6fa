package com.assessorai.infrastructure.ai.client;

import com.assessorai.domain.pipeline.model.ErrorKind;
import com.assessorai.domain.pipeline.model.InvocationAttempt;
import com.assessorai.domain.pipeline.model.TokenUsage;
import com.assessorai.infrastructure.ai.provider.ModelProvider;
import com.assessorai.infrastructure.ai.provider.ModelProviderRegistry;
import com.assessorai.infrastructure.ai.provider.ModelRequest;
import com.assessorai.infrastructure.ai.provider.ModelResponse;
import com.assessorai.infrastructure.ai.provider.ProviderCallException;
import com.assessorai.infrastructure.logging.LogSanitizer;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Uniform model call with per-call timeout, exponential backoff on transient
 * failures and a raised output budget after truncation.
 *
 * Transient and truncation failures never leave this class while budget remains.
 * Once it is spent the caller gets GATE_FAILURE if a truncated answer exists,
 * FATAL otherwise. Authentication and request errors are FATAL immediately.
 */
@Slf4j
@Component
public class ModelInvocationClient {

    private final ModelProviderRegistry providers;
    private final RetryPolicy policy;
    private final Sleeper sleeper;
    private final Clock clock;
    private final ExecutorService callExecutor;

    public ModelInvocationClient(ModelProviderRegistry providers,
                                 RetryPolicy policy,
                                 Sleeper sleeper,
                                 Clock clock,
                                 @Qualifier("modelCallExecutor") ExecutorService callExecutor) {
        this.providers = providers;
        this.policy = policy;
        this.sleeper = sleeper;
        this.clock = clock;
        this.callExecutor = callExecutor;
    }

    /**
     * @param deadline stage deadline; no call starts after it and no call outlives it
     */
    public InvocationResult invoke(InvocationRequest request, Instant deadline) {
        ModelProvider provider;
        try {
            provider = providers.get(request.provider());
        } catch (ProviderCallException e) {
            throw new ModelInvocationException(ErrorKind.FATAL, e.getMessage(), List.of(), e);
        }

        List<InvocationAttempt> history = new ArrayList<>();
        TokenUsage total = TokenUsage.ZERO;
        int maxTokens = request.maxTokens();
        String partial = null;

        for (int attempt = 1; attempt <= policy.maxAttempts(); attempt++) {
            Duration remaining = Duration.between(clock.instant(), deadline);
            if (remaining.isNegative() || remaining.isZero()) {
                throw exhausted("stage deadline reached after " + (attempt - 1) + " attempt(s)", history, partial);
            }
            Duration timeout = remaining.compareTo(policy.callTimeout()) < 0 ? remaining : policy.callTimeout();

            ModelResponse response;
            try {
                response = callWithTimeout(provider, request.toModelRequest(maxTokens), timeout);
            } catch (ProviderCallException e) {
                String detail = LogSanitizer.sanitize(e.getMessage());
                history.add(new InvocationAttempt(attempt, e.getKind(), null, maxTokens, null, detail,
                        TokenUsage.ZERO, clock.instant()));
                if (e.getKind() == ErrorKind.FATAL) {
                    log.error("[ModelClient] fatal failure provider={} model={}: {}",
                            provider.name(), request.model(), detail);
                    throw new ModelInvocationException(ErrorKind.FATAL, detail, history, e);
                }
                log.warn("[ModelClient] transient failure {}/{} provider={} model={}: {}",
                        attempt, policy.maxAttempts(), provider.name(), request.model(), detail);
                if (attempt < policy.maxAttempts()) {
                    backoff(attempt, deadline, history);
                }
                continue;
            }

            total = total.plus(response.usage());
            if (response.complete()) {
                if (!history.isEmpty()) {
                    log.info("[ModelClient] accepted response on attempt {}/{} model={}",
                            attempt, policy.maxAttempts(), request.model());
                }
                return new InvocationResult(response.content(), response.finishReason(), total, history,
                        provider.name(), request.model());
            }

            partial = response.content();
            history.add(new InvocationAttempt(attempt, ErrorKind.TRUNCATION, response.finishReason(), maxTokens,
                    response.content(), "output truncated", response.usage(), clock.instant()));
            int raised = policy.raisedMaxTokens(maxTokens);
            if (raised <= maxTokens) {
                throw exhausted("output truncated at the " + maxTokens + "-token limit", history, partial);
            }
            log.warn("[ModelClient] truncated output {}/{} model={} finish={}, maxTokens {} -> {}",
                    attempt, policy.maxAttempts(), request.model(), response.finishReason(), maxTokens, raised);
            maxTokens = raised;
        }
        throw exhausted("retry budget of " + policy.maxAttempts() + " attempts exhausted", history, partial);
    }

    private ModelResponse callWithTimeout(ModelProvider provider, ModelRequest modelRequest, Duration timeout) {
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        Future<ModelResponse> future = callExecutor.submit(() -> {
            if (mdc != null) {
                MDC.setContextMap(mdc);
            }
            try {
                return provider.complete(modelRequest);
            } finally {
                MDC.clear();
            }
        });
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ProviderCallException(ErrorKind.TRANSIENT,
                    "call timed out after " + timeout.toMillis() + " ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ProviderCallException providerFailure) {
                throw providerFailure;
            }
            throw new ProviderCallException(ErrorKind.TRANSIENT,
                    "provider call failed: " + cause.getClass().getSimpleName(), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ProviderCallException(ErrorKind.FATAL, "model call interrupted", e);
        }
    }

    private void backoff(int failedAttempt, Instant deadline, List<InvocationAttempt> history) {
        Duration wait = policy.backoff(failedAttempt);
        Duration remaining = Duration.between(clock.instant(), deadline);
        if (wait.compareTo(remaining) > 0) {
            wait = remaining.isNegative() ? Duration.ZERO : remaining;
        }
        try {
            sleeper.sleep(wait);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ModelInvocationException(ErrorKind.FATAL, "interrupted during backoff", history, e);
        }
    }

    private ModelInvocationException exhausted(String reason, List<InvocationAttempt> history, String partial) {
        ErrorKind kind = partial != null ? ErrorKind.GATE_FAILURE : ErrorKind.FATAL;
        log.error("[ModelClient] {} -> {}", reason, kind);
        return new ModelInvocationException(kind, reason, history, partial);
    }
}
