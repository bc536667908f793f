package org.example.mystery.service.llm;

/**
 * Abstraction for LLM providers (Ollama, xAI).
 */
public interface LlmProvider {

    /**
     * Generate a response from the LLM.
     *
     * @param systemPrompt instructions sent ahead of the prompt; may be {@code null}
     * @param prompt the user prompt
     * @param options generation options
     * @return the generated text
     * @throws LlmProviderException when the provider call fails or returns nothing usable
     */
    String generate(String systemPrompt, String prompt, LlmOptions options);

    /**
     * Check if this provider is available and properly configured.
     */
    boolean isAvailable();

    /**
     * Get the name of this provider for logging/debugging.
     *
     * @return provider name (e.g., "ollama", "xai")
     */
    String getProviderName();
}
