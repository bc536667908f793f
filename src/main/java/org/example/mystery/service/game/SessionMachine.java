package org.example.mystery.service.game;

import org.example.mystery.model.CharacterRole;
import org.example.mystery.model.CharacterRoster;
import org.example.mystery.model.ChatMessage;
import org.example.mystery.model.GameCharacter;
import org.example.mystery.model.GameSettings;
import org.example.mystery.model.InvestigationProgress;
import org.example.mystery.model.Scenario;
import org.example.mystery.service.cache.GameContentCache;
import org.example.mystery.service.context.ContextIndex;
import org.example.mystery.service.llm.GenerationBackend;
import org.example.mystery.service.llm.GenerationFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.IntStream;

/**
 * Top-level investigation flow: create the cast and the crime, narrate it, then alternate
 * between selecting a character and interviewing them until the player accuses.
 *
 * <p>Session state is confined to one caller at a time. The cache and the context index are
 * shared across sessions and do their own locking.
 */
public class SessionMachine {

    private static final Logger log = LoggerFactory.getLogger(SessionMachine.class);

    private final GenerationBackend backend;
    private final ConversationMachine conversationMachine;
    private final ContextIndex contextIndex;
    private final GameContentCache contentCache;

    public SessionMachine(GenerationBackend backend,
                          ConversationMachine conversationMachine,
                          ContextIndex contextIndex,
                          GameContentCache contentCache) {
        this.backend = backend;
        this.conversationMachine = conversationMachine;
        this.contextIndex = contextIndex;
        this.contentCache = contentCache;
    }

    /**
     * CREATING: generates and validates the roster and the scenario, and indexes every
     * backstory. Leaves the session in NARRATING.
     *
     * @throws GenerationFailureException when generation fails or the cast breaks the role rules
     */
    public SessionState create(GameSettings settings) {
        SessionState state = new SessionState(UUID.randomUUID().toString(), settings);
        log.info("Creating session {} in '{}' with {} characters",
                state.getSessionId(), settings.environment(), settings.rosterSize());

        CharacterRoster roster = backend.generateStructured(
                MysteryPrompts.roster(settings.environment(), settings.rosterSize()), CharacterRoster.class);
        validateRoster(roster);
        state.setRoster(roster.characters());

        Scenario scenario = backend.generateStructured(
                MysteryPrompts.scenario(settings.environment(), state.getRoster()), Scenario.class);
        validateScenario(scenario, state.getVictim());
        state.setScenario(scenario);

        List<GameCharacter> characters = state.getRoster();
        for (int i = 0; i < characters.size(); i++) {
            GameCharacter character = characters.get(i);
            Map<String, String> extraFields = new LinkedHashMap<>();
            extraFields.put("Name", character.name());
            extraFields.put("Role", character.role().label());
            contextIndex.addSource(contextSourceId(state, i), character.backstory(), extraFields);
        }

        state.setPhase(SessionPhase.NARRATING);
        return state;
    }

    /**
     * NARRATING: one narration of the crime scene, appended to the session log.
     */
    public ChatMessage narrate(SessionState state) {
        requirePhase(state, SessionPhase.NARRATING);
        Scenario scenario = state.getScenario();
        String narration = contentCache.narration(state.getEnvironment(), scenario,
                () -> backend.generateText(MysteryPrompts.narration(scenario), List.of()));

        ChatMessage message = ChatMessage.narrator(narration);
        state.appendLog(List.of(message));
        state.setPhase(SessionPhase.SELECTING);
        return message;
    }

    /**
     * CREATING and NARRATING in one call. A failed narration discards the half-built session.
     */
    public SessionState start(GameSettings settings) {
        SessionState state = create(settings);
        try {
            narrate(state);
        } catch (RuntimeException e) {
            discard(state);
            throw e;
        }
        return state;
    }

    /**
     * SELECTING: moves to CONVERSING for a valid pick, or to ACCUSING on the accuse choice.
     * Once the action limit is reached the session moves to ACCUSING whatever the choice.
     *
     * @return the phase the session is now in
     * @throws InvalidSelectionException for an out-of-range index or the victim; state is unchanged
     */
    public SessionPhase select(SessionState state, CharacterChoice choice) {
        requirePhase(state, SessionPhase.SELECTING);

        if (state.isActionLimitReached()) {
            log.info("Session {} reached its action limit, moving to accusation", state.getSessionId());
            state.setPhase(SessionPhase.ACCUSING);
            return state.getPhase();
        }
        if (choice.isAccuse()) {
            state.setPhase(SessionPhase.ACCUSING);
            return state.getPhase();
        }

        int index = choice.characterIndex();
        List<GameCharacter> roster = state.getRoster();
        if (index < 0 || index >= roster.size()) {
            throw new InvalidSelectionException(
                    "Choose a character between 0 and " + (roster.size() - 1) + ", got " + index);
        }
        if (roster.get(index).isVictim()) {
            throw new InvalidSelectionException(roster.get(index).name() + " is the victim and cannot be questioned");
        }

        state.setSelectedIndex(index);
        state.setPhase(SessionPhase.CONVERSING);
        return state.getPhase();
    }

    /**
     * Opens the conversation with the selected character, capped by the actions left.
     */
    public ConversationState openConversation(SessionState state) {
        requirePhase(state, SessionPhase.CONVERSING);
        int index = state.getSelectedIndex();
        return conversationMachine.open(index, state.getRoster().get(index), state.getScenario(),
                contextSourceId(state, index), state.getActionsRemaining());
    }

    /**
     * Folds a finished or aborted conversation back into the session: the character counts as
     * visited, its turns count as actions, and its messages join the session log.
     */
    public SessionPhase finishConversation(SessionState state, ConversationState conversation) {
        requirePhase(state, SessionPhase.CONVERSING);
        conversationMachine.end(conversation);

        state.markVisited(conversation.getCharacterIndex());
        state.addActions(conversation.getTurnCount());
        state.appendLog(conversation.getMessageLog());
        state.setSelectedIndex(null);
        state.setPhase(state.isActionLimitReached() ? SessionPhase.ACCUSING : SessionPhase.SELECTING);

        log.debug("Session {}: visit to '{}' took {} turns, {} actions in total",
                state.getSessionId(), conversation.getCharacter().name(),
                conversation.getTurnCount(), state.getTotalActions());
        return state.getPhase();
    }

    /**
     * CONVERSING with blocking input. The conversation is folded back even when generation fails
     * mid-visit; the failure is then rethrown.
     */
    public SessionPhase converse(SessionState state, InvestigationConsole console) {
        ConversationState conversation = openConversation(state);
        try {
            conversationMachine.run(conversation, console);
        } finally {
            finishConversation(state, conversation);
        }
        return state.getPhase();
    }

    /**
     * ACCUSING: a correct accusation wins. A wrong one costs a guess and loses once none are left;
     * otherwise the player returns to selecting, or stays here when the action limit is reached.
     *
     * @throws InvalidAccusationException when the name is not a suspect; state is unchanged
     */
    public AccusationOutcome accuse(SessionState state, String accusedName) {
        requirePhase(state, SessionPhase.ACCUSING);

        String normalized = accusedName == null ? "" : accusedName.trim().toLowerCase(Locale.ROOT);
        GameCharacter accused = suspects(state).stream()
                .filter(c -> c.name().trim().toLowerCase(Locale.ROOT).equals(normalized))
                .findFirst()
                .orElseThrow(() -> new InvalidAccusationException(
                        "'" + accusedName + "' is not one of the suspects"));

        boolean correct = accused.isKiller();
        if (correct) {
            state.setPhase(SessionPhase.WON);
        } else {
            state.consumeGuess();
            if (state.getGuessesLeft() == 0) {
                state.setPhase(SessionPhase.LOST);
            } else if (!state.isActionLimitReached()) {
                state.setPhase(SessionPhase.SELECTING);
            }
        }

        if (state.getPhase().isTerminal()) {
            log.info("Session {} ended: {} (accused '{}', {} actions)",
                    state.getSessionId(), state.getPhase(), accused.name(), state.getTotalActions());
        } else {
            log.debug("Session {}: wrong accusation of '{}', {} guesses left",
                    state.getSessionId(), accused.name(), state.getGuessesLeft());
        }
        return new AccusationOutcome(accused.name(), correct, state.getGuessesLeft(), state.getPhase());
    }

    /**
     * Plays a whole session against a blocking console and returns it in WON or LOST.
     * A session that ends any other way is discarded before the failure propagates.
     */
    public SessionState play(GameSettings settings, InvestigationConsole console) {
        SessionState state = create(settings);
        try {
            playCreated(state, console);
        } catch (RuntimeException e) {
            discard(state);
            throw e;
        }
        return state;
    }

    private void playCreated(SessionState state, InvestigationConsole console) {
        console.showNarration(narrate(state));

        while (!state.getPhase().isTerminal()) {
            switch (state.getPhase()) {
                case SELECTING -> {
                    console.showProgress(progress(state));
                    try {
                        select(state, console.selectCharacter(state.getRoster(), state.getVisited()));
                    } catch (InvalidSelectionException e) {
                        console.showNotice(e.getMessage());
                    }
                }
                case CONVERSING -> {
                    try {
                        converse(state, console);
                    } catch (GenerationFailureException e) {
                        log.error("Conversation in session {} cut short", state.getSessionId(), e);
                        console.showNotice("The conversation was cut short: " + e.getMessage());
                    }
                }
                case ACCUSING -> {
                    try {
                        console.showAccusationResult(accuse(state, console.accuse(suspects(state))));
                    } catch (InvalidAccusationException e) {
                        console.showNotice(e.getMessage());
                    }
                }
                default -> throw new IllegalStateException("Unexpected phase " + state.getPhase());
            }
        }

        console.showGameOver(state.getPhase(), state.getKiller());
    }

    public InvestigationProgress progress(SessionState state) {
        int interviewable = (int) state.getRoster().stream().filter(c -> !c.isVictim()).count();
        int interviewed = state.getVisited().size();
        double percentage = interviewable > 0 ? interviewed * 100.0 / interviewable : 0.0;
        return new InvestigationProgress(
                state.getGuessesLeft(),
                interviewed,
                interviewable,
                state.getTotalActions(),
                state.getActionLimit(),
                state.getActionsRemaining(),
                percentage);
    }

    /**
     * Everyone who can be accused: the non-victims, sorted by name.
     */
    public List<GameCharacter> suspects(SessionState state) {
        return state.getRoster().stream()
                .filter(c -> !c.isVictim())
                .sorted(Comparator.comparing(GameCharacter::name, String.CASE_INSENSITIVE_ORDER))
                .toList();
    }

    /**
     * Roster indices of characters that can still be interviewed for the first time.
     */
    public List<Integer> unvisited(SessionState state) {
        List<GameCharacter> roster = state.getRoster();
        return IntStream.range(0, roster.size())
                .filter(i -> !roster.get(i).isVictim() && !state.getVisited().contains(i))
                .boxed()
                .toList();
    }

    /**
     * Drops the session's backstories from the context index.
     */
    public void discard(SessionState state) {
        int removed = contextIndex.removeSourcesWithPrefix(state.getSessionId() + ":");
        log.info("Discarded session {} ({} context sources)", state.getSessionId(), removed);
    }

    static String contextSourceId(SessionState state, int characterIndex) {
        return state.getSessionId() + ":" + characterIndex;
    }

    static void validateRoster(CharacterRoster roster) {
        if (roster == null || roster.characters().isEmpty()) {
            throw new GenerationFailureException("Generated roster is empty");
        }
        long killers = roster.countOf(CharacterRole.KILLER);
        long victims = roster.countOf(CharacterRole.VICTIM);
        if (killers != 1 || victims != 1) {
            throw new GenerationFailureException(
                    "Generated roster needs exactly one killer and one victim, got " + killers + " and " + victims);
        }
        if (roster.characters().size() < 3) {
            throw new GenerationFailureException("Generated roster has no one to question besides the killer");
        }
        Set<String> names = new HashSet<>();
        for (GameCharacter character : roster.characters()) {
            if (character.name() == null || character.name().isBlank()) {
                throw new GenerationFailureException("Generated roster contains a character without a name");
            }
            if (!names.add(character.name().trim().toLowerCase(Locale.ROOT))) {
                throw new GenerationFailureException("Generated roster repeats the name " + character.name());
            }
        }
    }

    static void validateScenario(Scenario scenario, GameCharacter victim) {
        if (scenario == null || scenario.victimName() == null || scenario.victimName().isBlank()) {
            throw new GenerationFailureException("Generated scenario names no victim");
        }
        String named = scenario.victimName().trim().toLowerCase(Locale.ROOT);
        String expected = victim.name().trim().toLowerCase(Locale.ROOT);
        // tolerate titles and partial names, e.g. "Captain Silas Rook" for "Silas Rook"
        if (!named.contains(expected) && !expected.contains(named)) {
            throw new GenerationFailureException("Generated scenario names '" + scenario.victimName()
                    + "' as the victim but the roster's victim is '" + victim.name() + "'");
        }
    }

    private static void requirePhase(SessionState state, SessionPhase expected) {
        if (state.getPhase().isTerminal()) {
            throw new IllegalStateException("Session " + state.getSessionId() + " is over (" + state.getPhase() + ")");
        }
        if (state.getPhase() != expected) {
            throw new IllegalStateException(
                    "Session is " + state.getPhase() + ", expected " + expected);
        }
    }
}
