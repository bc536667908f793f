package org.example.mystery.service.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.mystery.model.ChatMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * {@link GenerationBackend} over a single {@link LlmProvider}. Conversation history is rendered
 * into the prompt, most recent messages only.
 */
public class LlmGenerationBackend implements GenerationBackend {

    private static final Logger log = LoggerFactory.getLogger(LlmGenerationBackend.class);

    private static final String TEXT_SYSTEM_PROMPT = """
            You are the storyteller of an interactive murder mystery set in the world of Sherlock Holmes.
            Reply with the requested text only: no stage directions, no speaker labels, no markdown.""";

    private static final String STRUCTURED_SYSTEM_PROMPT = """
            You design murder mystery content. Return valid JSON only, no markdown, no commentary.""";

    private static final double STRUCTURED_TEMPERATURE = 0.4;

    private final LlmProvider provider;
    private final double temperature;
    private final int maxContextMessages;
    private final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public LlmGenerationBackend(LlmProvider provider, double temperature, int maxContextMessages) {
        this.provider = provider;
        this.temperature = temperature;
        this.maxContextMessages = maxContextMessages;
    }

    @Override
    public String generateText(String prompt, List<ChatMessage> history) {
        String conversationContext = buildConversationContext(history);
        String fullPrompt = conversationContext.isEmpty() ? prompt : conversationContext + "\n" + prompt;

        String generated;
        try {
            generated = provider.generate(TEXT_SYSTEM_PROMPT, fullPrompt, LlmOptions.withTemperature(temperature));
        } catch (LlmProviderException e) {
            throw new GenerationFailureException("Text generation failed via " + provider.getProviderName(), e);
        }

        if (generated == null || generated.isBlank()) {
            throw new GenerationFailureException("Empty response from " + provider.getProviderName());
        }
        String cleaned = cleanResponse(generated);
        log.debug("Generated text: {}", truncateText(cleaned, 100));
        return cleaned;
    }

    @Override
    public <T> T generateStructured(String prompt, Class<T> type) {
        String generated;
        try {
            generated = provider.generate(STRUCTURED_SYSTEM_PROMPT, prompt, LlmOptions.json(STRUCTURED_TEMPERATURE));
        } catch (LlmProviderException e) {
            throw new GenerationFailureException(
                    "Structured generation of " + type.getSimpleName() + " failed via " + provider.getProviderName(), e);
        }

        String json = extractJsonObject(generated, type);
        try {
            T value = objectMapper.readValue(json, type);
            if (value == null) {
                throw new GenerationFailureException("Null " + type.getSimpleName() + " in provider response");
            }
            return value;
        } catch (JsonProcessingException e) {
            throw new GenerationFailureException("Invalid JSON " + type.getSimpleName() + " from LLM provider", e);
        }
    }

    @Override
    public boolean isAvailable() {
        return provider.isAvailable();
    }

    @Override
    public String getBackendName() {
        return provider.getProviderName();
    }

    private String buildConversationContext(List<ChatMessage> history) {
        if (history == null || history.isEmpty()) {
            return "";
        }

        List<ChatMessage> recentHistory = history.size() > maxContextMessages
                ? history.subList(history.size() - maxContextMessages, history.size())
                : history;

        StringBuilder context = new StringBuilder("PREVIOUS CONVERSATION:\n");
        for (ChatMessage msg : recentHistory) {
            context.append(msg.speaker()).append(": ").append(msg.content()).append("\n\n");
        }
        return context.toString();
    }

    private static String extractJsonObject(String text, Class<?> type) {
        if (text == null || text.isBlank()) {
            throw new GenerationFailureException("No " + type.getSimpleName() + " returned from provider");
        }
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start >= 0 && end > start) {
            return text.substring(start, end + 1);
        }
        throw new GenerationFailureException("No JSON object found in " + type.getSimpleName() + " response");
    }

    private static String cleanResponse(String response) {
        response = response.trim();
        if (response.length() > 1 && response.startsWith("\"") && response.endsWith("\"")) {
            response = response.substring(1, response.length() - 1).trim();
        }
        return response;
    }

    private static String truncateText(String text, int maxLength) {
        if (text.length() <= maxLength) return text;
        return text.substring(0, maxLength) + "...";
    }
}
