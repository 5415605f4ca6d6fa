package com.assessorai.infrastructure.ai.provider;

/**
 * Narrow capability behind which every model vendor sits.
 * Implementations classify their failures as {@link ProviderCallException}.
 */
public interface ModelProvider {

    String name();

    ModelResponse complete(ModelRequest request);
}
