package org.example.blueprint.config;

import org.example.blueprint.service.llm.LlmProvider;
import org.example.blueprint.service.llm.OllamaLlmProvider;
import org.example.blueprint.service.llm.OpenAiCompatibleLlmProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the generation backend used by batch compilation.
 */
@Configuration
public class GenerationClientConfig {

    private static final Logger log = LoggerFactory.getLogger(GenerationClientConfig.class);

    @Value("${generation.provider:openai}")
    private String provider;

    @Value("${generation.timeout-seconds:180}")
    private int timeoutSeconds;

    @Value("${generation.openai.base-url:https://api.openai.com/v1}")
    private String openAiBaseUrl;

    @Value("${generation.openai.api-key:}")
    private String openAiApiKey;

    @Value("${generation.openai.model:gpt-4o-mini}")
    private String openAiModel;

    @Value("${generation.ollama.base-url:http://localhost:11434}")
    private String ollamaBaseUrl;

    @Value("${generation.ollama.model:llama3.1:latest}")
    private String ollamaModel;

    @Bean
    @Qualifier("generationLlmProvider")
    public LlmProvider generationLlmProvider() {
        log.info("Configuring generation LLM provider: {}", provider);
        return createProvider(provider);
    }

    LlmProvider createProvider(String providerType) {
        return switch (providerType.toLowerCase()) {
            case "ollama" -> {
                log.info("Creating Ollama provider: baseUrl={}, model={}", ollamaBaseUrl, ollamaModel);
                yield new OllamaLlmProvider(ollamaBaseUrl, ollamaModel, timeoutSeconds);
            }
            case "openai" -> {
                if (openAiApiKey == null || openAiApiKey.isBlank()) {
                    log.warn("No API key configured for {}; requests will be sent unauthenticated", openAiBaseUrl);
                }
                yield new OpenAiCompatibleLlmProvider(openAiBaseUrl, openAiApiKey, openAiModel, timeoutSeconds);
            }
            default -> {
                log.warn("Unknown provider type '{}', falling back to Ollama", providerType);
                yield new OllamaLlmProvider(ollamaBaseUrl, ollamaModel, timeoutSeconds);
            }
        };
    }
}
