package com.assessorai.infrastructure.ai.client;

import com.assessorai.infrastructure.ai.provider.ModelRequest;

public record InvocationRequest(
        String provider,
        String model,
        String systemInstructions,
        String payload,
        int maxTokens,
        double temperature
) {
    ModelRequest toModelRequest(int tokens) {
        return new ModelRequest(model, systemInstructions, payload, tokens, temperature, true);
    }
}
