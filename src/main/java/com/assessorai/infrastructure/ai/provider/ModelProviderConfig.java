package com.assessorai.infrastructure.ai.provider;

import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * One OpenAI-compatible client per configured vendor. Vendors without an API key are skipped.
 */
@Slf4j
@Configuration
public class ModelProviderConfig {

    @Value("${assessor.providers.openai.api-key:}")
    private String openAiKey;

    @Value("${assessor.providers.openai.base-url:https://api.openai.com/v1}")
    private String openAiBaseUrl;

    @Value("${assessor.providers.openrouter.api-key:}")
    private String openRouterKey;

    @Value("${assessor.providers.openrouter.base-url:https://openrouter.ai/api/v1}")
    private String openRouterBaseUrl;

    @Value("${assessor.providers.google.api-key:}")
    private String googleKey;

    @Value("${assessor.providers.google.base-url:https://generativelanguage.googleapis.com/v1beta/openai/}")
    private String googleBaseUrl;

    @Value("${assessor.timeouts.call-seconds:90}")
    private long callTimeoutSeconds;

    @Bean
    public ModelProviderRegistry modelProviderRegistry() {
        List<ModelProvider> providers = new ArrayList<>();
        register(providers, "openai", openAiKey, openAiBaseUrl);
        register(providers, "openrouter", openRouterKey, openRouterBaseUrl);
        register(providers, "google", googleKey, googleBaseUrl);
        if (providers.isEmpty()) {
            log.warn("No model provider has an API key configured; every model call will fail as FATAL");
        }
        return new ModelProviderRegistry(providers);
    }

    private void register(List<ModelProvider> providers, String name, String apiKey, String baseUrl) {
        if (apiKey == null || apiKey.isBlank()) {
            return;
        }
        OpenAIClient client = OpenAIOkHttpClient.builder()
                .apiKey(apiKey)
                .baseUrl(baseUrl)
                .maxRetries(0)
                .timeout(Duration.ofSeconds(callTimeoutSeconds))
                .build();
        providers.add(new OpenAiCompatibleModelProvider(name, client));
        log.info("Registered model provider '{}' at {}", name, baseUrl);
    }
}
