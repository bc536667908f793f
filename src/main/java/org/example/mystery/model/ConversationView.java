package org.example.mystery.model;

import java.util.List;

public record ConversationView(
    int characterIndex,
    String characterName,
    String phase,
    int turnCount,
    int turnLimit,
    List<ChatMessage> messages
) {
}
