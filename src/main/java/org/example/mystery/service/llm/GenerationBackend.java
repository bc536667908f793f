package org.example.mystery.service.llm;

import org.example.mystery.model.ChatMessage;

import java.util.List;

/**
 * Synchronous text and structured-object generation used by the investigation machines.
 * Every failure surfaces as {@link GenerationFailureException}.
 */
public interface GenerationBackend {

    /**
     * Free text for narration, introductions, questions and answers.
     *
     * @param history prior messages of the current exchange, oldest first; may be empty
     */
    String generateText(String prompt, List<ChatMessage> history);

    /**
     * A JSON object generated for {@code prompt} and bound to {@code type}.
     */
    <T> T generateStructured(String prompt, Class<T> type);

    boolean isAvailable();

    String getBackendName();
}
