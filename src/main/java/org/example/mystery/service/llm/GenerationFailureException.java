package org.example.mystery.service.llm;

/**
 * The generation backend was unavailable or produced output the game cannot use.
 */
public class GenerationFailureException extends RuntimeException {

    public GenerationFailureException(String message) {
        super(message);
    }

    public GenerationFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
