package org.example.mystery.service.llm;

/**
 * Thrown when an LLM provider cannot produce a response.
 */
public class LlmProviderException extends RuntimeException {

    public LlmProviderException(String message) {
        super(message);
    }

    public LlmProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
