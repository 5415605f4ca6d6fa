package com.assessorai.infrastructure.ai.stage;

import com.assessorai.domain.pipeline.model.ErrorKind;
import com.assessorai.infrastructure.ai.client.ModelInvocationException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Runs independent per-theme analyses on a bounded pool and merges whatever
 * finished within the worker timeout. Themes that time out or fail are
 * reported as incomplete; a FATAL failure in any worker fails the whole merge.
 */
@Slf4j
@Component
public class ThemeAnalysisExecutor {

    private final ExecutorService pool;

    public ThemeAnalysisExecutor(@Qualifier("themeAnalysisPool") ExecutorService pool) {
        this.pool = pool;
    }

    /**
     * @param completed  results of finished themes, in input order
     * @param incomplete reason per theme that did not finish
     */
    public record ThemeMerge<T>(Map<String, T> completed, Map<String, String> incomplete) {}

    public <T> ThemeMerge<T> analyze(List<String> themes, Function<String, T> worker, Duration workerTimeout) {
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        Map<String, Future<T>> futures = new LinkedHashMap<>();
        for (String theme : themes) {
            futures.put(theme, pool.submit(() -> {
                if (mdc != null) {
                    MDC.setContextMap(mdc);
                }
                try {
                    return worker.apply(theme);
                } finally {
                    MDC.clear();
                }
            }));
        }

        long deadline = System.nanoTime() + workerTimeout.toNanos();
        Map<String, T> completed = new LinkedHashMap<>();
        Map<String, String> incomplete = new LinkedHashMap<>();
        for (Map.Entry<String, Future<T>> entry : futures.entrySet()) {
            String theme = entry.getKey();
            Future<T> future = entry.getValue();
            try {
                long remaining = Math.max(0L, deadline - System.nanoTime());
                completed.put(theme, future.get(remaining, TimeUnit.NANOSECONDS));
            } catch (TimeoutException e) {
                // interrupts the worker and frees its pool slot
                future.cancel(true);
                incomplete.put(theme, "timed out after " + workerTimeout.toSeconds() + "s");
            } catch (CancellationException e) {
                incomplete.put(theme, "cancelled");
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                if (cause instanceof ModelInvocationException failure && failure.getKind() == ErrorKind.FATAL) {
                    cancelAll(futures);
                    throw failure;
                }
                incomplete.put(theme, "failed: " + cause.getMessage());
            } catch (InterruptedException e) {
                cancelAll(futures);
                Thread.currentThread().interrupt();
                throw new ModelInvocationException(ErrorKind.FATAL, "theme analysis interrupted", List.of(), e);
            }
        }
        if (completed.size() < themes.size()) {
            log.warn("[Themes] merged {} of {} theme(s), incomplete: {}",
                    completed.size(), themes.size(), incomplete);
        } else {
            log.info("[Themes] merged {} theme(s)", completed.size());
        }
        return new ThemeMerge<>(completed, incomplete);
    }

    private static void cancelAll(Map<String, ? extends Future<?>> futures) {
        futures.values().forEach(f -> f.cancel(true));
    }
}
