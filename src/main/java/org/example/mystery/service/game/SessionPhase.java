package org.example.mystery.service.game;

public enum SessionPhase {
    CREATING,
    NARRATING,
    SELECTING,
    CONVERSING,
    ACCUSING,
    WON,
    LOST;

    public boolean isTerminal() {
        return this == WON || this == LOST;
    }
}
