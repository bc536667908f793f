package org.example.mystery.service.game;

import org.example.mystery.model.ChatMessage;
import org.example.mystery.model.GameCharacter;
import org.example.mystery.model.Scenario;

import java.util.List;

/**
 * Serialisable copy of a {@link SessionState}. {@code visited} keeps visit order.
 */
public record SessionSnapshot(
    String sessionId,
    String environment,
    List<GameCharacter> roster,
    Scenario scenario,
    List<Integer> visited,
    int totalActions,
    Integer actionLimit,
    int guessesLeft,
    SessionPhase phase,
    Integer selectedIndex,
    List<ChatMessage> log
) {
    public SessionSnapshot {
        roster = roster == null ? List.of() : List.copyOf(roster);
        visited = visited == null ? List.of() : List.copyOf(visited);
        log = log == null ? List.of() : List.copyOf(log);
    }
}
