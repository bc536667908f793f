package org.example.mystery.controller;

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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.function.Supplier;

@RestController
@RequestMapping("/api/sessions")
public class InvestigationController {

    private static final Logger log = LoggerFactory.getLogger(InvestigationController.class);

    @Value("${mystery.game.environment:a fog-bound Victorian manor}")
    private String defaultEnvironment;

    @Value("${mystery.game.roster-size:5}")
    private int defaultRosterSize;

    @Value("${mystery.game.guesses:3}")
    private int defaultGuesses;

    private final InvestigationSessionService sessionService;

    public InvestigationController(InvestigationSessionService sessionService) {
        this.sessionService = sessionService;
    }

    @PostMapping
    public ResponseEntity<SessionView> createSession(@RequestBody(required = false) CreateSessionRequest request) {
        CreateSessionRequest body = request != null ? request : new CreateSessionRequest(null, null, null, null);
        SessionView view = execute(() -> {
            GameSettings settings = new GameSettings(
                    body.environment() != null ? body.environment() : defaultEnvironment,
                    body.rosterSize() != null ? body.rosterSize() : defaultRosterSize,
                    body.guesses() != null ? body.guesses() : defaultGuesses,
                    body.actionLimit());
            return sessionService.start(settings);
        });
        return ResponseEntity.status(HttpStatus.CREATED).body(view);
    }

    @GetMapping("/{sessionId}")
    public SessionView getSession(@PathVariable String sessionId) {
        return execute(() -> sessionService.view(sessionId));
    }

    @GetMapping("/{sessionId}/progress")
    public InvestigationProgress getProgress(@PathVariable String sessionId) {
        return execute(() -> sessionService.progress(sessionId));
    }

    @PostMapping("/{sessionId}/select")
    public SessionView select(@PathVariable String sessionId, @RequestBody SelectRequest request) {
        if (request == null || (!Boolean.TRUE.equals(request.accuse()) && request.characterIndex() == null)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "characterIndex or accuse is required");
        }
        CharacterChoice choice = Boolean.TRUE.equals(request.accuse())
                ? CharacterChoice.accuse()
                : CharacterChoice.of(request.characterIndex());
        return execute(() -> sessionService.select(sessionId, choice));
    }

    @PostMapping("/{sessionId}/conversation/questions")
    public SessionView ask(@PathVariable String sessionId, @RequestBody QuestionRequest request) {
        if (request == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "question or assisted is required");
        }
        PlayerQuestion question = Boolean.TRUE.equals(request.assisted())
                ? PlayerQuestion.assisted()
                : PlayerQuestion.typed(request.question());
        return execute(() -> sessionService.ask(sessionId, question));
    }

    @PostMapping("/{sessionId}/conversation/end")
    public SessionView endConversation(@PathVariable String sessionId) {
        return execute(() -> sessionService.endConversation(sessionId));
    }

    @PostMapping("/{sessionId}/accusations")
    public SessionView accuse(@PathVariable String sessionId, @RequestBody AccusationRequest request) {
        if (request == null || request.suspectName() == null || request.suspectName().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "suspectName is required");
        }
        return execute(() -> sessionService.accuse(sessionId, request.suspectName()));
    }

    @GetMapping(value = "/{sessionId}/log", produces = MediaType.TEXT_PLAIN_VALUE)
    public String exportLog(@PathVariable String sessionId) {
        return execute(() -> sessionService.exportLog(sessionId));
    }

    @DeleteMapping("/{sessionId}")
    public ResponseEntity<Void> discard(@PathVariable String sessionId) {
        execute(() -> {
            sessionService.discard(sessionId);
            return null;
        });
        return ResponseEntity.noContent().build();
    }

    public record CreateSessionRequest(
            String environment,
            Integer rosterSize,
            Integer guesses,
            Integer actionLimit
    ) {}

    public record SelectRequest(
            Integer characterIndex,
            Boolean accuse
    ) {}

    public record QuestionRequest(
            String question,
            Boolean assisted
    ) {}

    public record AccusationRequest(
            String suspectName
    ) {}

    private <T> T execute(Supplier<T> action) {
        try {
            return action.get();
        } catch (SessionNotFoundException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage());
        } catch (InvalidSelectionException | InvalidAccusationException | IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        } catch (IllegalStateException e) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, e.getMessage());
        } catch (GenerationFailureException e) {
            log.error("Generation failed: {}", e.getMessage(), e);
            throw new ResponseStatusException(HttpStatus.BAD_GATEWAY, "Story generation failed, please try again");
        }
    }
}
