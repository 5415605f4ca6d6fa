package com.assessorai.infrastructure.ai.client;

import com.assessorai.domain.pipeline.model.ErrorKind;
import com.assessorai.domain.pipeline.model.InvocationAttempt;
import com.assessorai.domain.pipeline.model.TokenUsage;
import com.assessorai.infrastructure.ai.provider.ModelProviderRegistry;
import com.assessorai.infrastructure.ai.provider.ModelRequest;
import com.assessorai.infrastructure.ai.provider.ModelResponse;
import com.assessorai.infrastructure.ai.provider.ProviderCallException;
import com.assessorai.support.MutableClock;
import com.assessorai.support.ScriptedModelProvider;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;

import static com.assessorai.support.ScriptedModelProvider.complete;
import static com.assessorai.support.ScriptedModelProvider.truncated;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelInvocationClientTest {

    private static final RetryPolicy POLICY = new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(30),
            Duration.ofSeconds(5), 8192, 256);

    private MutableClock clock;
    private List<Duration> sleeps;
    private ExecutorService executor;
    private InvocationRequest request;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atDefaultStart();
        sleeps = new ArrayList<>();
        executor = Executors.newCachedThreadPool();
        request = new InvocationRequest("openai", "gpt-4.1", "system", "payload", 1000, 0.0);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @SafeVarargs
    private ScriptedModelProvider provider(Supplier<ModelResponse>... steps) {
        Iterator<Supplier<ModelResponse>> script = List.of(steps).iterator();
        return new ScriptedModelProvider("openai", r -> script.next().get());
    }

    private ModelInvocationClient client(ScriptedModelProvider provider, RetryPolicy policy) {
        Sleeper sleeper = d -> {
            sleeps.add(d);
            clock.advance(d);
        };
        return new ModelInvocationClient(new ModelProviderRegistry(List.of(provider)), policy, sleeper, clock,
                executor);
    }

    private Instant deadline() {
        return clock.instant().plus(Duration.ofMinutes(10));
    }

    private static Supplier<ModelResponse> fails(ErrorKind kind, String message) {
        return () -> {
            throw new ProviderCallException(kind, message);
        };
    }

    @Test
    @DisplayName("Truncated twice then complete: the third response is used, the first two stay in the history")
    void truncated_twice_then_complete() {
        ScriptedModelProvider provider = provider(
                () -> truncated("{\"fields\": {\"a\""),
                () -> truncated("{\"fields\": {\"a\": 1, \"b\""),
                () -> complete("{\"fields\": {\"a\": 1, \"b\": 2}}"));

        InvocationResult result = client(provider, POLICY).invoke(request, deadline());

        assertThat(result.content()).isEqualTo("{\"fields\": {\"a\": 1, \"b\": 2}}");
        assertThat(result.attempts()).hasSize(2)
                .allSatisfy(a -> assertThat(a.errorKind()).isEqualTo(ErrorKind.TRUNCATION));
        assertThat(result.attempts()).extracting(InvocationAttempt::content)
                .containsExactly("{\"fields\": {\"a\"", "{\"fields\": {\"a\": 1, \"b\"");
        assertThat(provider.requests()).extracting(ModelRequest::maxTokens).containsExactly(1000, 1500, 2250);
        assertThat(result.usage()).isEqualTo(new TokenUsage(300, 150));
        assertThat(sleeps).isEmpty();
    }

    @Test
    @DisplayName("Transient failures back off exponentially and then succeed")
    void transient_then_success() {
        ScriptedModelProvider provider = provider(
                fails(ErrorKind.TRANSIENT, "rate limited"),
                fails(ErrorKind.TRANSIENT, "server error 503"),
                () -> complete("{}"));

        InvocationResult result = client(provider, POLICY).invoke(request, deadline());

        assertThat(result.content()).isEqualTo("{}");
        assertThat(result.retryCount()).isEqualTo(2);
        assertThat(sleeps).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2));
        assertThat(provider.requests()).extracting(ModelRequest::maxTokens).containsOnly(1000);
    }

    @Test
    @DisplayName("Authentication failures are fatal without retry")
    void fatal_is_not_retried() {
        ScriptedModelProvider provider = provider(fails(ErrorKind.FATAL, "401 invalid key sk-abcdefghijklmnop"));

        assertThatThrownBy(() -> client(provider, POLICY).invoke(request, deadline()))
                .isInstanceOfSatisfying(ModelInvocationException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(ErrorKind.FATAL);
                    assertThat(e.getMessage()).doesNotContain("abcdefghijklmnop");
                    assertThat(e.getAttempts()).hasSize(1);
                });
        assertThat(provider.requests()).hasSize(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    @DisplayName("Exhausted transient retries without any response are fatal")
    void transient_exhausted_is_fatal() {
        ScriptedModelProvider provider = provider(
                fails(ErrorKind.TRANSIENT, "timeout"),
                fails(ErrorKind.TRANSIENT, "timeout"),
                fails(ErrorKind.TRANSIENT, "timeout"));

        assertThatThrownBy(() -> client(provider, POLICY).invoke(request, deadline()))
                .isInstanceOfSatisfying(ModelInvocationException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(ErrorKind.FATAL);
                    assertThat(e.getAttempts()).hasSize(3);
                });
        assertThat(sleeps).hasSize(2);
    }

    @Test
    @DisplayName("Exhausted truncation retries surface the partial answer as a gate failure")
    void truncation_exhausted_is_gate_failure() {
        ScriptedModelProvider provider = provider(
                () -> truncated("{\"a"),
                () -> truncated("{\"a\": "),
                () -> truncated("{\"a\": 1"));

        assertThatThrownBy(() -> client(provider, POLICY).invoke(request, deadline()))
                .isInstanceOfSatisfying(ModelInvocationException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(ErrorKind.GATE_FAILURE);
                    assertThat(e.getPartialContent()).isEqualTo("{\"a\": 1");
                    assertThat(e.usage()).isEqualTo(new TokenUsage(300, 150));
                });
    }

    @Test
    @DisplayName("Truncation at the output limit is not retried with the same budget")
    void truncation_at_limit_stops_without_identical_retry() {
        ScriptedModelProvider provider = provider(
                () -> truncated("{\"a"),
                () -> truncated("{\"a\": "),
                () -> complete("{\"a\": 1}"));
        InvocationRequest nearLimit = new InvocationRequest("openai", "gpt-4.1", "system", "payload", 6000, 0.0);

        assertThatThrownBy(() -> client(provider, POLICY).invoke(nearLimit, deadline()))
                .isInstanceOfSatisfying(ModelInvocationException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(ErrorKind.GATE_FAILURE);
                    assertThat(e.getPartialContent()).isEqualTo("{\"a\": ");
                    assertThat(e.getAttempts()).extracting(InvocationAttempt::maxTokens)
                            .containsExactly(6000, 8192);
                });
        assertThat(provider.requests()).extracting(ModelRequest::maxTokens).containsExactly(6000, 8192);
        assertThat(POLICY.raisedMaxTokens(8192)).isEqualTo(8192);
        assertThat(POLICY.raisedMaxTokens(9000)).isEqualTo(9000);
    }

    @Test
    @DisplayName("No call starts after the stage deadline")
    void deadline_stops_retries() {
        ScriptedModelProvider provider = provider(
                fails(ErrorKind.TRANSIENT, "rate limited"),
                () -> complete("{}"));
        Instant deadline = clock.instant().plusMillis(500);

        assertThatThrownBy(() -> client(provider, POLICY).invoke(request, deadline))
                .isInstanceOfSatisfying(ModelInvocationException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.FATAL));
        assertThat(provider.requests()).hasSize(1);
        assertThat(sleeps).containsExactly(Duration.ofMillis(500));
    }

    @Test
    @DisplayName("A call exceeding the per-call timeout is retried as transient")
    void per_call_timeout() {
        RetryPolicy tight = new RetryPolicy(2, Duration.ofMillis(10), Duration.ofMillis(10),
                Duration.ofMillis(200), 8192, 256);
        ScriptedModelProvider provider = provider(
                () -> {
                    try {
                        Thread.sleep(5_000);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return complete("late");
                },
                () -> complete("{\"ok\": true}"));

        InvocationResult result = client(provider, tight).invoke(request, deadline());

        assertThat(result.content()).isEqualTo("{\"ok\": true}");
        assertThat(result.attempts()).singleElement()
                .satisfies(a -> assertThat(a.errorKind()).isEqualTo(ErrorKind.TRANSIENT));
    }

    @Test
    @DisplayName("An unknown provider is a fatal configuration error")
    void unknown_provider() {
        ScriptedModelProvider provider = provider(() -> complete("{}"));
        InvocationRequest other = new InvocationRequest("google", "gemini", "system", "payload", 100, 0.0);

        assertThatThrownBy(() -> client(provider, POLICY).invoke(other, deadline()))
                .isInstanceOfSatisfying(ModelInvocationException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.FATAL));
        assertThat(provider.requests()).isEmpty();
    }
}
