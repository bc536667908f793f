package org.example.mystery.service.game;

public record AccusationOutcome(
    String accusedName,
    boolean correct,
    int guessesLeft,
    SessionPhase phase
) {
}
