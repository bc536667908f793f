package org.example.mystery.config;

import org.example.mystery.service.llm.GenerationBackend;
import org.example.mystery.service.llm.LlmGenerationBackend;
import org.example.mystery.service.llm.LlmProvider;
import org.example.mystery.service.llm.OllamaLlmProvider;
import org.example.mystery.service.llm.XaiLlmProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the LLM provider behind every generation call of a session.
 */
@Configuration
public class LlmProviderConfig {

    private static final Logger log = LoggerFactory.getLogger(LlmProviderConfig.class);

    @Value("${ai.generation.provider:ollama}")
    private String generationProvider;

    @Value("${ai.generation.timeout-seconds:120}")
    private int timeoutSeconds;

    @Value("${ai.generation.ollama.base-url:http://localhost:11434}")
    private String ollamaBaseUrl;

    @Value("${ai.generation.ollama.model:llama3.1:latest}")
    private String ollamaModel;

    @Value("${ai.generation.xai.api-key:}")
    private String xaiApiKey;

    @Value("${ai.generation.xai.model:grok-4-1-fast-non-reasoning}")
    private String xaiModel;

    @Value("${ai.generation.temperature:0.8}")
    private double temperature;

    @Value("${mystery.conversation.max-context-messages:12}")
    private int maxContextMessages;

    @Bean
    public LlmProvider generationLlmProvider() {
        log.info("Configuring generation LLM provider: {}", generationProvider);
        return createProvider(generationProvider);
    }

    @Bean
    public GenerationBackend generationBackend(LlmProvider generationLlmProvider) {
        return new LlmGenerationBackend(generationLlmProvider, temperature, maxContextMessages);
    }

    private LlmProvider createProvider(String providerType) {
        return switch (providerType.toLowerCase()) {
            case "ollama" -> {
                log.info("Creating Ollama provider: baseUrl={}, model={}", ollamaBaseUrl, ollamaModel);
                yield new OllamaLlmProvider(ollamaBaseUrl, ollamaModel, timeoutSeconds);
            }
            case "xai" -> {
                if (xaiApiKey == null || xaiApiKey.isBlank()) {
                    log.warn("xAI API key not configured, falling back to Ollama");
                    yield new OllamaLlmProvider(ollamaBaseUrl, ollamaModel, timeoutSeconds);
                }
                log.info("Creating xAI provider: model={}", xaiModel);
                yield new XaiLlmProvider(xaiApiKey, xaiModel, timeoutSeconds);
            }
            default -> {
                log.warn("Unknown provider type '{}', falling back to Ollama", providerType);
                yield new OllamaLlmProvider(ollamaBaseUrl, ollamaModel, timeoutSeconds);
            }
        };
    }
}
