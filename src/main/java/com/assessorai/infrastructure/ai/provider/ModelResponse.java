package com.assessorai.infrastructure.ai.provider;

import com.assessorai.domain.pipeline.model.TokenUsage;

/**
 * @param finishReason "complete" when the model stopped on its own, the provider's reason otherwise
 */
public record ModelResponse(String content, String finishReason, TokenUsage usage) {

    public static final String COMPLETE = "complete";

    public boolean complete() {
        return COMPLETE.equals(finishReason);
    }
}
