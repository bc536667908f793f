package org.example.mystery.service.game;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.mystery.model.GameSettings;
import org.example.mystery.service.cache.CacheStore;
import org.example.mystery.service.cache.GameContentCache;
import org.example.mystery.service.context.ContextIndex;
import org.example.mystery.service.context.TextChunker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SessionSnapshotTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private ConversationMachine conversationMachine;
    private SessionMachine machine;

    @BeforeEach
    void setUp() {
        FakeGenerationBackend backend = new FakeGenerationBackend();
        ContextIndex contextIndex = new ContextIndex(new TextChunker(200, 40), 3, null);
        GameContentCache cache = new GameContentCache(new CacheStore<>(50, Duration.ofHours(1)));
        conversationMachine = new ConversationMachine(backend, cache, contextIndex, 5, "EXIT", 300);
        machine = new SessionMachine(backend, conversationMachine, contextIndex, cache);
    }

    @Test
    void sessionSnapshot_throughJson_restoresEquivalentState() throws Exception {
        SessionState state = machine.start(new GameSettings("small harbor town", 4, 3, 12));
        interview(state, 3, "Did you owe Silas money?", "EXIT");
        interview(state, 0, "Where was your lantern?", "EXIT");
        interview(state, 3, "EXIT");

        String json = objectMapper.writeValueAsString(state.snapshot());
        SessionState restored = SessionState.restore(objectMapper.readValue(json, SessionSnapshot.class));

        assertEquals(state.snapshot(), restored.snapshot());
        assertEquals(List.of(3, 0), List.copyOf(restored.getVisited()));
        assertEquals(5, restored.getTotalActions());
        assertEquals(7, restored.getActionsRemaining());
        assertEquals("Tom Pike", restored.getKiller().name());
        assertEquals(SessionPhase.SELECTING, restored.getPhase());
    }

    @Test
    void sessionSnapshot_roleSerialisedByLabel() throws Exception {
        SessionState state = machine.start(new GameSettings("small harbor town", 4, 3, null));

        String json = objectMapper.writeValueAsString(state.snapshot());

        assertTrue(json.contains("\"role\":\"Killer\""));
        assertTrue(json.contains("\"actionLimit\":null"));
    }

    @Test
    void conversationSnapshot_midInterview_resumesWhereItStopped() throws Exception {
        SessionState session = machine.start(new GameSettings("small harbor town", 4, 3, null));
        machine.select(session, CharacterChoice.of(2));
        ConversationState conversation = machine.openConversation(session);
        conversationMachine.introduce(conversation);
        conversationMachine.ask(conversation, "Whose lantern was it?");

        String json = objectMapper.writeValueAsString(conversation.snapshot());
        ConversationState restored = ConversationState.restore(
                objectMapper.readValue(json, ConversationSnapshot.class));

        assertEquals(ConversationPhase.ANSWERING, restored.getPhase());
        assertEquals(1, restored.getTurnCount());
        assertEquals("Whose lantern was it?", restored.latestMessage().content());

        conversationMachine.answer(restored);
        assertEquals(ConversationPhase.ASKING, restored.getPhase());
    }

    private void interview(SessionState state, int index, String... questions) {
        machine.select(state, CharacterChoice.of(index));
        ScriptedConsole console = new ScriptedConsole();
        for (String question : questions) {
            console.ask(PlayerQuestion.typed(question));
        }
        machine.converse(state, console);
    }
}
