package org.example.mystery.model;

/**
 * Bootstrap parameters for one session. {@code actionLimit} is nullable (unlimited).
 */
public record GameSettings(
    String environment,
    int rosterSize,
    int guesses,
    Integer actionLimit
) {
    public static final int MIN_ROSTER_SIZE = 3;

    public GameSettings {
        if (environment == null || environment.isBlank()) {
            throw new IllegalArgumentException("environment must not be blank");
        }
        if (rosterSize < MIN_ROSTER_SIZE) {
            throw new IllegalArgumentException(
                    "rosterSize must be at least " + MIN_ROSTER_SIZE + " (victim, killer and a suspect)");
        }
        if (guesses < 1) {
            throw new IllegalArgumentException("guesses must be at least 1");
        }
        if (actionLimit != null && actionLimit < 1) {
            throw new IllegalArgumentException("actionLimit must be at least 1 when set");
        }
        environment = environment.trim();
    }

    public static GameSettings unlimited(String environment, int rosterSize, int guesses) {
        return new GameSettings(environment, rosterSize, guesses, null);
    }
}
