package org.example.mystery.service.game;

public enum ConversationPhase {
    INTRODUCING,
    ASKING,
    ANSWERING,
    ENDED
}
