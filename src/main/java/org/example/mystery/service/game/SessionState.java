package org.example.mystery.service.game;

import org.example.mystery.model.ChatMessage;
import org.example.mystery.model.GameCharacter;
import org.example.mystery.model.GameSettings;
import org.example.mystery.model.Scenario;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Canonical state of one investigation. Only {@link SessionMachine} mutates it.
 */
public class SessionState {

    private final String sessionId;
    private final String environment;
    private final Integer actionLimit;
    private final List<GameCharacter> roster = new ArrayList<>();
    private final Set<Integer> visited = new LinkedHashSet<>();
    private final List<ChatMessage> log = new ArrayList<>();
    private Scenario scenario;
    private int totalActions;
    private int guessesLeft;
    private SessionPhase phase = SessionPhase.CREATING;
    private Integer selectedIndex;

    SessionState(String sessionId, GameSettings settings) {
        this(sessionId, settings.environment(), settings.actionLimit(), settings.guesses());
    }

    private SessionState(String sessionId, String environment, Integer actionLimit, int guessesLeft) {
        this.sessionId = sessionId;
        this.environment = environment;
        this.actionLimit = actionLimit;
        this.guessesLeft = guessesLeft;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getEnvironment() {
        return environment;
    }

    public List<GameCharacter> getRoster() {
        return Collections.unmodifiableList(roster);
    }

    public Scenario getScenario() {
        return scenario;
    }

    public Set<Integer> getVisited() {
        return Collections.unmodifiableSet(visited);
    }

    public int getTotalActions() {
        return totalActions;
    }

    public Integer getActionLimit() {
        return actionLimit;
    }

    public int getGuessesLeft() {
        return guessesLeft;
    }

    public SessionPhase getPhase() {
        return phase;
    }

    public Integer getSelectedIndex() {
        return selectedIndex;
    }

    public List<ChatMessage> getLog() {
        return Collections.unmodifiableList(log);
    }

    public boolean isActionLimitReached() {
        return actionLimit != null && totalActions >= actionLimit;
    }

    /**
     * Actions left before the session is forced into accusation, or {@code null} without a limit.
     */
    public Integer getActionsRemaining() {
        return actionLimit == null ? null : Math.max(0, actionLimit - totalActions);
    }

    public GameCharacter getKiller() {
        return roster.stream().filter(GameCharacter::isKiller).findFirst().orElse(null);
    }

    public GameCharacter getVictim() {
        return roster.stream().filter(GameCharacter::isVictim).findFirst().orElse(null);
    }

    void setRoster(List<GameCharacter> characters) {
        roster.clear();
        roster.addAll(characters);
    }

    void setScenario(Scenario scenario) {
        this.scenario = scenario;
    }

    void markVisited(int characterIndex) {
        visited.add(characterIndex);
    }

    void addActions(int actions) {
        if (actions < 0) {
            throw new IllegalArgumentException("actions must not be negative");
        }
        totalActions += actions;
    }

    void consumeGuess() {
        if (guessesLeft > 0) {
            guessesLeft--;
        }
    }

    void setPhase(SessionPhase phase) {
        this.phase = phase;
    }

    void setSelectedIndex(Integer selectedIndex) {
        this.selectedIndex = selectedIndex;
    }

    void appendLog(List<ChatMessage> messages) {
        log.addAll(messages);
    }

    public SessionSnapshot snapshot() {
        return new SessionSnapshot(sessionId, environment, roster, scenario, new ArrayList<>(visited),
                totalActions, actionLimit, guessesLeft, phase, selectedIndex, log);
    }

    public static SessionState restore(SessionSnapshot snapshot) {
        SessionState state = new SessionState(snapshot.sessionId(), snapshot.environment(),
                snapshot.actionLimit(), snapshot.guessesLeft());
        state.roster.addAll(snapshot.roster());
        state.scenario = snapshot.scenario();
        state.visited.addAll(snapshot.visited());
        state.totalActions = snapshot.totalActions();
        state.phase = snapshot.phase();
        state.selectedIndex = snapshot.selectedIndex();
        state.log.addAll(snapshot.log());
        return state;
    }
}
