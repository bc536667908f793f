package org.example.mystery.service.game;

import org.example.mystery.model.ChatMessage;
import org.example.mystery.model.GameCharacter;
import org.example.mystery.model.Scenario;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One interview with one character. Only {@link ConversationMachine} mutates it.
 */
public class ConversationState {

    private final int characterIndex;
    private final GameCharacter character;
    private final Scenario scenario;
    private final String contextSourceId;
    private final int turnLimit;
    private final List<ChatMessage> messageLog = new ArrayList<>();
    private int turnCount;
    private ConversationPhase phase = ConversationPhase.INTRODUCING;

    ConversationState(int characterIndex, GameCharacter character, Scenario scenario,
                      String contextSourceId, int turnLimit) {
        this.characterIndex = characterIndex;
        this.character = character;
        this.scenario = scenario;
        this.contextSourceId = contextSourceId;
        this.turnLimit = turnLimit;
    }

    public int getCharacterIndex() {
        return characterIndex;
    }

    public GameCharacter getCharacter() {
        return character;
    }

    public Scenario getScenario() {
        return scenario;
    }

    public String getContextSourceId() {
        return contextSourceId;
    }

    public int getTurnLimit() {
        return turnLimit;
    }

    public List<ChatMessage> getMessageLog() {
        return Collections.unmodifiableList(messageLog);
    }

    public int getTurnCount() {
        return turnCount;
    }

    public ConversationPhase getPhase() {
        return phase;
    }

    public boolean isEnded() {
        return phase == ConversationPhase.ENDED;
    }

    /**
     * Latest message, or {@code null} before the introduction.
     */
    public ChatMessage latestMessage() {
        return messageLog.isEmpty() ? null : messageLog.get(messageLog.size() - 1);
    }

    void append(ChatMessage message) {
        messageLog.add(message);
    }

    void incrementTurn() {
        turnCount++;
    }

    void setPhase(ConversationPhase phase) {
        this.phase = phase;
    }

    public ConversationSnapshot snapshot() {
        return new ConversationSnapshot(characterIndex, character, scenario, contextSourceId,
                turnLimit, messageLog, turnCount, phase);
    }

    public static ConversationState restore(ConversationSnapshot snapshot) {
        ConversationState state = new ConversationState(snapshot.characterIndex(), snapshot.character(),
                snapshot.scenario(), snapshot.contextSourceId(), snapshot.turnLimit());
        state.messageLog.addAll(snapshot.messageLog());
        state.turnCount = snapshot.turnCount();
        state.phase = snapshot.phase();
        return state;
    }
}
