package com.assessorai.infrastructure.ai.orchestration;

import com.assessorai.domain.pipeline.model.TokenUsage;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * USD estimate from a per-million-token price table. Unknown models cost zero.
 */
@Slf4j
public class CostEstimator {

    public record Price(double promptPerMillion, double completionPerMillion) {}

    public static final Map<String, Price> DEFAULT_PRICES = Map.of(
            "gpt-4o", new Price(2.50, 10.00),
            "gpt-4o-mini", new Price(0.15, 0.60),
            "gpt-4.1", new Price(2.00, 8.00),
            "gpt-4.1-mini", new Price(0.40, 1.60)
    );

    private final Map<String, Price> prices;

    public CostEstimator(Map<String, Price> prices) {
        this.prices = Map.copyOf(prices);
    }

    public double estimate(String modelId, TokenUsage usage) {
        if (modelId == null || usage == null) {
            return 0.0;
        }
        Price price = prices.get(modelId);
        if (price == null) {
            log.debug("[Cost] no price configured for model {}", modelId);
            return 0.0;
        }
        return (usage.promptTokens() * price.promptPerMillion()
                + usage.completionTokens() * price.completionPerMillion()) / 1_000_000.0;
    }
}
