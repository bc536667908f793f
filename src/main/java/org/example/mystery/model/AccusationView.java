package org.example.mystery.model;

public record AccusationView(
    String accusedName,
    boolean correct,
    int guessesLeft
) {
}
