package org.example.mystery.service.llm;

/**
 * Options for LLM generation requests.
 */
public record LlmOptions(
    double temperature,
    Double topP,        // nullable
    Integer maxTokens,  // nullable
    boolean jsonOutput
) {
    /**
     * Free-text generation at the given temperature.
     */
    public static LlmOptions withTemperature(double temp) {
        return new LlmOptions(temp, null, null, false);
    }

    /**
     * Free-text generation with a token ceiling.
     */
    public static LlmOptions full(double temp, double topP, int maxTokens) {
        return new LlmOptions(temp, topP, maxTokens, false);
    }

    /**
     * Asks the provider to constrain output to a single JSON object.
     */
    public static LlmOptions json(double temp) {
        return new LlmOptions(temp, null, null, true);
    }
}
