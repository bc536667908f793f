package org.example.mystery.service.game;

import org.example.mystery.model.ChatMessage;
import org.example.mystery.model.GameCharacter;
import org.example.mystery.model.Scenario;
import org.example.mystery.service.cache.GameContentCache;
import org.example.mystery.service.context.ContextIndex;
import org.example.mystery.service.llm.GenerationBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;

/**
 * Drives one interview: INTRODUCING, then ASKING and ANSWERING in turns until the exit token
 * or the turn limit ends it.
 *
 * <p>The step methods ({@link #open}, {@link #introduce}, {@link #ask}, {@link #suggestQuestion},
 * {@link #answer}, {@link #end}) serve callers that receive input one request at a time;
 * {@link #run} composes them against a blocking {@link InvestigationConsole}.
 */
public class ConversationMachine {

    private static final Logger log = LoggerFactory.getLogger(ConversationMachine.class);

    private final GenerationBackend backend;
    private final GameContentCache contentCache;
    private final ContextIndex contextIndex;
    private final int maxTurns;
    private final String exitToken;
    private final int answerMaxTokens;

    public ConversationMachine(GenerationBackend backend,
                               GameContentCache contentCache,
                               ContextIndex contextIndex,
                               int maxTurns,
                               String exitToken,
                               int answerMaxTokens) {
        if (maxTurns < 1) {
            throw new IllegalArgumentException("maxTurns must be at least 1");
        }
        if (exitToken == null || exitToken.isBlank()) {
            throw new IllegalArgumentException("exitToken must not be blank");
        }
        this.backend = backend;
        this.contentCache = contentCache;
        this.contextIndex = contextIndex;
        this.maxTurns = maxTurns;
        this.exitToken = exitToken.trim().toUpperCase(Locale.ROOT);
        this.answerMaxTokens = answerMaxTokens;
    }

    /**
     * A new conversation in INTRODUCING. No generation happens yet.
     *
     * @param turnCap caller ceiling on turns, e.g. the actions left in the session; {@code null} for none
     */
    public ConversationState open(int characterIndex, GameCharacter character, Scenario scenario,
                                  String contextSourceId, Integer turnCap) {
        int turnLimit = turnCap == null ? maxTurns : Math.min(maxTurns, turnCap);
        return new ConversationState(characterIndex, character, scenario, contextSourceId, turnLimit);
    }

    /**
     * Emits the character's introduction, reusing a cached one for the same character and victim.
     */
    public ChatMessage introduce(ConversationState state) {
        requirePhase(state, ConversationPhase.INTRODUCING);
        GameCharacter character = state.getCharacter();

        String introduction = contentCache.findIntroduction(character, state.getScenario())
                .orElseGet(() -> {
                    String generated = backend.generateText(
                            MysteryPrompts.introduction(character, state.getScenario()), List.of());
                    contentCache.putIntroduction(character, state.getScenario(), generated);
                    return generated;
                });

        ChatMessage message = ChatMessage.character(character.name(), introduction);
        state.append(message);
        enterAsking(state);
        return message;
    }

    /**
     * Records a question typed by the player.
     *
     * @throws IllegalArgumentException for a blank question; the conversation does not advance
     */
    public ChatMessage ask(ConversationState state, String question) {
        requirePhase(state, ConversationPhase.ASKING);
        if (question == null || question.isBlank()) {
            throw new IllegalArgumentException("Question must not be blank");
        }
        return recordQuestion(state, question.trim());
    }

    /**
     * Lets the detective formulate the next question from the conversation so far.
     */
    public ChatMessage suggestQuestion(ConversationState state) {
        requirePhase(state, ConversationPhase.ASKING);
        String question = backend.generateText(
                MysteryPrompts.detectiveQuestion(state.getCharacter(), state.getScenario()),
                state.getMessageLog());
        return recordQuestion(state, question);
    }

    /**
     * Answers the latest question in character, grounded on the slice of the backstory most
     * relevant to it.
     */
    public ChatMessage answer(ConversationState state) {
        requirePhase(state, ConversationPhase.ANSWERING);
        GameCharacter character = state.getCharacter();
        String question = state.latestMessage().content();

        String background = contextIndex.query(state.getContextSourceId(), question, answerMaxTokens);
        if (background.isEmpty()) {
            background = character.backstory();
        }

        String answer = backend.generateText(
                MysteryPrompts.answer(character, state.getScenario(), background, question),
                state.getMessageLog());
        ChatMessage message = ChatMessage.character(character.name(), answer);
        state.append(message);
        enterAsking(state);
        return message;
    }

    /**
     * Closes the conversation. Safe to call in any phase.
     */
    public void end(ConversationState state) {
        if (!state.isEnded()) {
            state.setPhase(ConversationPhase.ENDED);
            log.debug("Conversation with '{}' closed after {} turns",
                    state.getCharacter().name(), state.getTurnCount());
        }
    }

    /**
     * Drives the conversation to ENDED with blocking player input. A blank question is
     * re-prompted. Generation failures propagate with the state left as it was.
     */
    public ConversationState run(ConversationState state, InvestigationConsole console) {
        GameCharacter character = state.getCharacter();
        if (state.getPhase() == ConversationPhase.INTRODUCING) {
            console.showIntroduction(character, introduce(state));
        }

        while (!state.isEnded()) {
            if (state.getPhase() == ConversationPhase.ANSWERING) {
                console.showAnswer(character, answer(state));
                continue;
            }

            PlayerQuestion input = console.askOrType(character);
            if (input.isBlank()) {
                console.showNotice("Please ask a question, or type " + exitToken + " to leave.");
                continue;
            }
            ChatMessage question = input.detectiveAsks()
                    ? suggestQuestion(state)
                    : ask(state, input.text());
            if (!state.isEnded()) {
                console.showQuestion(question);
            }
        }
        return state;
    }

    public int getMaxTurns() {
        return maxTurns;
    }

    public String getExitToken() {
        return exitToken;
    }

    private ChatMessage recordQuestion(ConversationState state, String question) {
        ChatMessage message = ChatMessage.detective(question);
        state.append(message);
        state.incrementTurn();

        if (containsExitToken(question)) {
            log.debug("Exit requested in conversation with '{}'", state.getCharacter().name());
            state.setPhase(ConversationPhase.ENDED);
        } else {
            state.setPhase(ConversationPhase.ANSWERING);
        }
        return message;
    }

    private void enterAsking(ConversationState state) {
        if (state.getTurnCount() >= state.getTurnLimit()) {
            log.info("Turn limit {} reached with '{}'", state.getTurnLimit(), state.getCharacter().name());
            state.setPhase(ConversationPhase.ENDED);
        } else {
            state.setPhase(ConversationPhase.ASKING);
        }
    }

    private boolean containsExitToken(String text) {
        return text != null && text.toUpperCase(Locale.ROOT).contains(exitToken);
    }

    private static void requirePhase(ConversationState state, ConversationPhase expected) {
        if (state.getPhase() != expected) {
            throw new IllegalStateException(
                    "Conversation is " + state.getPhase() + ", expected " + expected);
        }
    }
}
