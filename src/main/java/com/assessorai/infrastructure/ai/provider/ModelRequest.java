package com.assessorai.infrastructure.ai.provider;

public record ModelRequest(
        String model,
        String systemInstructions,
        String payload,
        int maxTokens,
        double temperature,
        boolean jsonResponse
) {
    public ModelRequest withMaxTokens(int newMaxTokens) {
        return new ModelRequest(model, systemInstructions, payload, newMaxTokens, temperature, jsonResponse);
    }
}
