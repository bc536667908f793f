package org.example.mystery.model;

public record InvestigationProgress(
    int guessesLeft,
    int interviewed,
    int interviewable,
    int actionsTaken,
    Integer actionLimit,
    Integer actionsRemaining,
    double progressPercentage
) {
}
