package org.example.mystery.service.game;

import org.example.mystery.model.ChatMessage;
import org.example.mystery.model.GameCharacter;
import org.example.mystery.model.Scenario;

import java.util.List;

public record ConversationSnapshot(
    int characterIndex,
    GameCharacter character,
    Scenario scenario,
    String contextSourceId,
    int turnLimit,
    List<ChatMessage> messageLog,
    int turnCount,
    ConversationPhase phase
) {
    public ConversationSnapshot {
        messageLog = messageLog == null ? List.of() : List.copyOf(messageLog);
    }
}
