package org.example.mystery.model;

import java.util.List;

/**
 * Web-facing view of a session. {@code conversation} is the open interview, or the last one
 * between visits; it is null before the first. {@code killerName}
 * stays null until the session is over.
 */
public record SessionView(
    String sessionId,
    String environment,
    String phase,
    Scenario scenario,
    List<CharacterView> characters,
    InvestigationProgress progress,
    List<ChatMessage> log,
    ConversationView conversation,
    AccusationView lastAccusation,
    String killerName
) {
}
