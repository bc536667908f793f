package org.example.mystery.controller;

import org.example.mystery.model.AccusationView;
import org.example.mystery.model.CharacterView;
import org.example.mystery.model.GameSettings;
import org.example.mystery.model.InvestigationProgress;
import org.example.mystery.model.SessionView;
import org.example.mystery.service.InvestigationSessionService;
import org.example.mystery.service.SessionNotFoundException;
import org.example.mystery.service.game.CharacterChoice;
import org.example.mystery.service.game.InvalidAccusationException;
import org.example.mystery.service.game.InvalidSelectionException;
import org.example.mystery.service.game.PlayerQuestion;
import org.example.mystery.service.llm.GenerationFailureException;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(InvestigationController.class)
@TestPropertySource(properties = {
        "mystery.game.environment=small harbor town",
        "mystery.game.roster-size=4",
        "mystery.game.guesses=3"
})
class InvestigationControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private InvestigationSessionService sessionService;

    @Test
    void createSession_emptyBody_usesConfiguredDefaults() throws Exception {
        when(sessionService.start(any(GameSettings.class))).thenReturn(view("SELECTING", null, null));

        mockMvc.perform(post("/api/sessions"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.sessionId", is("s-1")))
                .andExpect(jsonPath("$.phase", is("SELECTING")))
                .andExpect(jsonPath("$.characters[1].victim", is(true)))
                .andExpect(jsonPath("$.killerName", nullValue()));

        ArgumentCaptor<GameSettings> settings = ArgumentCaptor.forClass(GameSettings.class);
        verify(sessionService).start(settings.capture());
        assertEquals("small harbor town", settings.getValue().environment());
        assertEquals(4, settings.getValue().rosterSize());
        assertEquals(3, settings.getValue().guesses());
        assertNull(settings.getValue().actionLimit());
    }

    @Test
    void createSession_explicitSettings_passedThrough() throws Exception {
        when(sessionService.start(any(GameSettings.class))).thenReturn(view("SELECTING", null, null));

        mockMvc.perform(post("/api/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"environment\":\"a snowed-in ski lodge\",\"rosterSize\":6,\"guesses\":2,\"actionLimit\":15}"))
                .andExpect(status().isCreated());

        verify(sessionService).start(new GameSettings("a snowed-in ski lodge", 6, 2, 15));
    }

    @Test
    void createSession_rosterTooSmall_returnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rosterSize\":2}"))
                .andExpect(status().isBadRequest());

        verify(sessionService, never()).start(any());
    }

    @Test
    void createSession_generationFails_returnsBadGateway() throws Exception {
        when(sessionService.start(any(GameSettings.class)))
                .thenThrow(new GenerationFailureException("Generated roster is empty"));

        mockMvc.perform(post("/api/sessions"))
                .andExpect(status().isBadGateway());
    }

    @Test
    void getSession_unknown_returnsNotFound() throws Exception {
        when(sessionService.view("missing")).thenThrow(new SessionNotFoundException("missing"));

        mockMvc.perform(get("/api/sessions/missing"))
                .andExpect(status().isNotFound());
    }

    @Test
    void getProgress_returnsCounts() throws Exception {
        when(sessionService.progress("s-1")).thenReturn(new InvestigationProgress(3, 1, 3, 2, null, null, 33.3));

        mockMvc.perform(get("/api/sessions/s-1/progress"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.interviewed", is(1)))
                .andExpect(jsonPath("$.interviewable", is(3)))
                .andExpect(jsonPath("$.actionLimit", nullValue()));
    }

    @Test
    void select_characterIndex_opensConversation() throws Exception {
        when(sessionService.select("s-1", CharacterChoice.of(2))).thenReturn(view("CONVERSING", null, null));

        mockMvc.perform(post("/api/sessions/s-1/select")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"characterIndex\":2}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.phase", is("CONVERSING")));
    }

    @Test
    void select_accuse_movesToAccusation() throws Exception {
        when(sessionService.select("s-1", CharacterChoice.accuse())).thenReturn(view("ACCUSING", null, null));

        mockMvc.perform(post("/api/sessions/s-1/select")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"accuse\":true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.phase", is("ACCUSING")));
    }

    @Test
    void select_emptyRequest_returnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/sessions/s-1/select")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());

        verify(sessionService, never()).select(anyString(), any());
    }

    @Test
    void select_victim_returnsBadRequest() throws Exception {
        when(sessionService.select("s-1", CharacterChoice.of(1)))
                .thenThrow(new InvalidSelectionException("Silas Rook is the victim and cannot be questioned"));

        mockMvc.perform(post("/api/sessions/s-1/select")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"characterIndex\":1}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void select_wrongPhase_returnsConflict() throws Exception {
        when(sessionService.select("s-1", CharacterChoice.of(0)))
                .thenThrow(new IllegalStateException("Session is CONVERSING, expected SELECTING"));

        mockMvc.perform(post("/api/sessions/s-1/select")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"characterIndex\":0}"))
                .andExpect(status().isConflict());
    }

    @Test
    void ask_typedQuestion_forwarded() throws Exception {
        when(sessionService.ask("s-1", PlayerQuestion.typed("Where were you?"))).thenReturn(view("CONVERSING", null, null));

        mockMvc.perform(post("/api/sessions/s-1/conversation/questions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\":\"Where were you?\"}"))
                .andExpect(status().isOk());

        verify(sessionService).ask("s-1", PlayerQuestion.typed("Where were you?"));
    }

    @Test
    void ask_assisted_letsDetectiveAsk() throws Exception {
        when(sessionService.ask("s-1", PlayerQuestion.assisted())).thenReturn(view("CONVERSING", null, null));

        mockMvc.perform(post("/api/sessions/s-1/conversation/questions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"assisted\":true}"))
                .andExpect(status().isOk());

        verify(sessionService).ask("s-1", PlayerQuestion.assisted());
    }

    @Test
    void ask_blankQuestion_returnsBadRequest() throws Exception {
        when(sessionService.ask(eq("s-1"), any(PlayerQuestion.class)))
                .thenThrow(new IllegalArgumentException("Question must not be blank"));

        mockMvc.perform(post("/api/sessions/s-1/conversation/questions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\":\"  \"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void endConversation_noneOpen_returnsConflict() throws Exception {
        when(sessionService.endConversation("s-1"))
                .thenThrow(new IllegalStateException("No conversation is open in session s-1"));

        mockMvc.perform(post("/api/sessions/s-1/conversation/end"))
                .andExpect(status().isConflict());
    }

    @Test
    void accuse_killer_revealsOutcome() throws Exception {
        when(sessionService.accuse("s-1", "Tom Pike"))
                .thenReturn(view("WON", new AccusationView("Tom Pike", true, 3), "Tom Pike"));

        mockMvc.perform(post("/api/sessions/s-1/accusations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"suspectName\":\"Tom Pike\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.phase", is("WON")))
                .andExpect(jsonPath("$.lastAccusation.correct", is(true)))
                .andExpect(jsonPath("$.killerName", is("Tom Pike")));
    }

    @Test
    void accuse_missingName_returnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/sessions/s-1/accusations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"suspectName\":\" \"}"))
                .andExpect(status().isBadRequest());

        verify(sessionService, never()).accuse(anyString(), anyString());
    }

    @Test
    void accuse_notASuspect_returnsBadRequest() throws Exception {
        when(sessionService.accuse("s-1", "The butler"))
                .thenThrow(new InvalidAccusationException("'The butler' is not one of the suspects"));

        mockMvc.perform(post("/api/sessions/s-1/accusations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"suspectName\":\"The butler\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void exportLog_returnsPlainText() throws Exception {
        when(sessionService.exportLog("s-1")).thenReturn("Investigation: small harbor town\n");

        mockMvc.perform(get("/api/sessions/s-1/log"))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Type", startsWith("text/plain")))
                .andExpect(content().string("Investigation: small harbor town\n"));
    }

    @Test
    void discard_existing_returnsNoContent() throws Exception {
        mockMvc.perform(delete("/api/sessions/s-1"))
                .andExpect(status().isNoContent());

        verify(sessionService).discard("s-1");
    }

    @Test
    void discard_unknown_returnsNotFound() throws Exception {
        doThrow(new SessionNotFoundException("missing")).when(sessionService).discard("missing");

        mockMvc.perform(delete("/api/sessions/missing"))
                .andExpect(status().isNotFound());
    }

    @Test
    void response_carriesRequestIdHeader() throws Exception {
        when(sessionService.view("s-1")).thenReturn(view("SELECTING", null, null));

        mockMvc.perform(get("/api/sessions/s-1").header("X-Request-Id", "req-42"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Request-Id", "req-42"));
    }

    private static SessionView view(String phase, AccusationView accusation, String killerName) {
        return new SessionView(
                "s-1",
                "small harbor town",
                phase,
                null,
                List.of(
                        new CharacterView(0, "Agnes Pike", false, false),
                        new CharacterView(1, "Silas Rook", true, false),
                        new CharacterView(2, "Tom Pike", false, false)),
                new InvestigationProgress(3, 0, 2, 0, null, null, 0.0),
                List.of(),
                null,
                accusation,
                killerName);
    }
}
