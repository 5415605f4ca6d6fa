package com.assessorai.infrastructure.ai.provider;

import com.assessorai.domain.pipeline.model.ErrorKind;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Providers by name. An unknown provider is a configuration error and therefore fatal.
 */
public class ModelProviderRegistry {

    private final Map<String, ModelProvider> providers;

    public ModelProviderRegistry(List<ModelProvider> providers) {
        this.providers = providers.stream()
                .collect(Collectors.toUnmodifiableMap(ModelProvider::name, Function.identity()));
    }

    public ModelProvider get(String name) {
        ModelProvider provider = providers.get(name);
        if (provider == null) {
            throw new ProviderCallException(ErrorKind.FATAL, "Unknown model provider: " + name);
        }
        return provider;
    }

    public boolean contains(String name) {
        return providers.containsKey(name);
    }
}
