package org.example.mystery.service;

import org.example.mystery.model.AccusationView;
import org.example.mystery.model.CharacterView;
import org.example.mystery.model.ConversationView;
import org.example.mystery.model.GameCharacter;
import org.example.mystery.model.GameSettings;
import org.example.mystery.model.InvestigationProgress;
import org.example.mystery.model.SessionView;
import org.example.mystery.service.game.AccusationOutcome;
import org.example.mystery.service.game.CharacterChoice;
import org.example.mystery.service.game.ConversationMachine;
import org.example.mystery.service.game.ConversationState;
import org.example.mystery.service.game.InvestigationLogFormatter;
import org.example.mystery.service.game.PlayerQuestion;
import org.example.mystery.service.game.SessionMachine;
import org.example.mystery.service.game.SessionPhase;
import org.example.mystery.service.game.SessionState;
import org.example.mystery.service.llm.GenerationFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Holds web sessions in memory and advances them one request at a time. Requests for the same
 * session are serialised on the session's entry; different sessions proceed in parallel.
 *
 * <p>Sessions nobody has touched for the idle timeout are dropped, and finished ones sooner.
 * Dropping a session also removes its character context. The sweep runs on every start and
 * every 64th request.
 */
@Service
public class InvestigationSessionService {

    private static final Logger log = LoggerFactory.getLogger(InvestigationSessionService.class);

    private final SessionMachine sessionMachine;
    private final ConversationMachine conversationMachine;
    private final InvestigationLogFormatter logFormatter;
    private final Duration idleTimeout;
    private final Duration finishedRetention;
    private final Clock clock;
    private final AtomicInteger cleanupTicker = new AtomicInteger();
    private final Map<String, ActiveSession> sessions = new ConcurrentHashMap<>();

    @Autowired
    public InvestigationSessionService(SessionMachine sessionMachine,
                                       ConversationMachine conversationMachine,
                                       InvestigationLogFormatter logFormatter,
                                       @Value("${mystery.session.idle-timeout-minutes:60}") long idleTimeoutMinutes,
                                       @Value("${mystery.session.finished-retention-minutes:10}") long finishedRetentionMinutes) {
        this(sessionMachine, conversationMachine, logFormatter,
                Duration.ofMinutes(Math.max(1, idleTimeoutMinutes)),
                Duration.ofMinutes(Math.max(0, finishedRetentionMinutes)),
                Clock.systemUTC());
    }

    InvestigationSessionService(SessionMachine sessionMachine,
                                ConversationMachine conversationMachine,
                                InvestigationLogFormatter logFormatter,
                                Duration idleTimeout,
                                Duration finishedRetention,
                                Clock clock) {
        this.sessionMachine = sessionMachine;
        this.conversationMachine = conversationMachine;
        this.logFormatter = logFormatter;
        this.idleTimeout = idleTimeout;
        this.finishedRetention = finishedRetention;
        this.clock = clock;
    }

    public SessionView start(GameSettings settings) {
        pruneStaleSessions();
        SessionState state = sessionMachine.start(settings);
        ActiveSession session = new ActiveSession(state, clock.millis());
        sessions.put(state.getSessionId(), session);
        log.info("Session {} started ({} active)", state.getSessionId(), sessions.size());
        synchronized (session) {
            return toView(session);
        }
    }

    public SessionView view(String sessionId) {
        ActiveSession session = require(sessionId);
        synchronized (session) {
            return toView(session);
        }
    }

    public InvestigationProgress progress(String sessionId) {
        ActiveSession session = require(sessionId);
        synchronized (session) {
            return sessionMachine.progress(session.state);
        }
    }

    /**
     * Picks a character, which also opens the conversation and produces the introduction,
     * or moves to accusation.
     */
    public SessionView select(String sessionId, CharacterChoice choice) {
        ActiveSession session = require(sessionId);
        synchronized (session) {
            SessionPhase phase = sessionMachine.select(session.state, choice);
            if (phase == SessionPhase.CONVERSING) {
                ConversationState conversation = sessionMachine.openConversation(session.state);
                session.conversation = conversation;
                try {
                    conversationMachine.introduce(conversation);
                } catch (GenerationFailureException e) {
                    abortConversation(session);
                    throw e;
                }
            }
            return toView(session);
        }
    }

    /**
     * One turn of the open conversation: the question, then the character's answer unless the
     * question ended the conversation. A conversation that ends is folded into the session.
     *
     * @throws IllegalArgumentException for a blank typed question
     */
    public SessionView ask(String sessionId, PlayerQuestion question) {
        ActiveSession session = require(sessionId);
        synchronized (session) {
            ConversationState conversation = requireConversation(session);
            if (question.isBlank()) {
                throw new IllegalArgumentException("Question must not be blank");
            }

            try {
                if (question.detectiveAsks()) {
                    conversationMachine.suggestQuestion(conversation);
                } else {
                    conversationMachine.ask(conversation, question.text());
                }
                if (!conversation.isEnded()) {
                    conversationMachine.answer(conversation);
                }
            } catch (GenerationFailureException e) {
                abortConversation(session);
                throw e;
            }

            if (conversation.isEnded()) {
                sessionMachine.finishConversation(session.state, conversation);
                session.lastConversation = conversation;
                session.conversation = null;
            }
            return toView(session);
        }
    }

    public SessionView endConversation(String sessionId) {
        ActiveSession session = require(sessionId);
        synchronized (session) {
            ConversationState conversation = requireConversation(session);
            sessionMachine.finishConversation(session.state, conversation);
            session.lastConversation = conversation;
            session.conversation = null;
            return toView(session);
        }
    }

    public SessionView accuse(String sessionId, String suspectName) {
        ActiveSession session = require(sessionId);
        synchronized (session) {
            session.lastAccusation = sessionMachine.accuse(session.state, suspectName);
            session.finished = session.state.getPhase().isTerminal();
            return toView(session);
        }
    }

    public String exportLog(String sessionId) {
        ActiveSession session = require(sessionId);
        synchronized (session) {
            return logFormatter.format(session.state);
        }
    }

    public void discard(String sessionId) {
        ActiveSession session = sessions.remove(sessionId);
        if (session == null) {
            throw new SessionNotFoundException(sessionId);
        }
        synchronized (session) {
            sessionMachine.discard(session.state);
        }
    }

    public int activeSessionCount() {
        return sessions.size();
    }

    /**
     * Drops sessions idle past the timeout, and finished sessions idle past the retention.
     *
     * @return how many sessions were dropped
     */
    public int pruneStaleSessions() {
        long now = clock.millis();
        int removed = 0;
        for (Map.Entry<String, ActiveSession> entry : sessions.entrySet()) {
            ActiveSession session = entry.getValue();
            if (!isStale(session, now)) {
                continue;
            }
            synchronized (session) {
                // a request may have touched it since the first check
                if (isStale(session, now) && sessions.remove(entry.getKey(), session)) {
                    sessionMachine.discard(session.state);
                    removed++;
                }
            }
        }
        if (removed > 0) {
            log.info("Pruned {} stale sessions ({} active)", removed, sessions.size());
        }
        return removed;
    }

    private boolean isStale(ActiveSession session, long now) {
        long idle = now - session.lastSeenMillis;
        return idle > idleTimeout.toMillis() || (session.finished && idle > finishedRetention.toMillis());
    }

    private ActiveSession require(String sessionId) {
        if ((cleanupTicker.incrementAndGet() & 0x3F) == 0) {
            pruneStaleSessions();
        }
        ActiveSession session = sessions.get(sessionId);
        if (session == null) {
            throw new SessionNotFoundException(sessionId);
        }
        session.lastSeenMillis = clock.millis();
        return session;
    }

    private ConversationState requireConversation(ActiveSession session) {
        if (session.conversation == null) {
            throw new IllegalStateException("No conversation is open in session " + session.state.getSessionId());
        }
        return session.conversation;
    }

    private void abortConversation(ActiveSession session) {
        log.warn("Conversation with '{}' in session {} aborted by a generation failure",
                session.conversation.getCharacter().name(), session.state.getSessionId());
        sessionMachine.finishConversation(session.state, session.conversation);
        session.lastConversation = session.conversation;
        session.conversation = null;
    }

    private SessionView toView(ActiveSession session) {
        SessionState state = session.state;
        List<GameCharacter> roster = state.getRoster();
        List<CharacterView> characters = new ArrayList<>();
        for (int i = 0; i < roster.size(); i++) {
            GameCharacter character = roster.get(i);
            characters.add(new CharacterView(i, character.name(), character.isVictim(), state.getVisited().contains(i)));
        }

        ConversationState conversation = session.conversation != null ? session.conversation : session.lastConversation;
        ConversationView conversationView = conversation == null ? null : new ConversationView(
                conversation.getCharacterIndex(),
                conversation.getCharacter().name(),
                conversation.getPhase().name(),
                conversation.getTurnCount(),
                conversation.getTurnLimit(),
                List.copyOf(conversation.getMessageLog()));

        AccusationOutcome outcome = session.lastAccusation;
        AccusationView accusationView = outcome == null ? null
                : new AccusationView(outcome.accusedName(), outcome.correct(), outcome.guessesLeft());

        boolean over = state.getPhase().isTerminal();
        return new SessionView(
                state.getSessionId(),
                state.getEnvironment(),
                state.getPhase().name(),
                state.getScenario(),
                characters,
                sessionMachine.progress(state),
                List.copyOf(state.getLog()),
                conversationView,
                accusationView,
                over && state.getKiller() != null ? state.getKiller().name() : null);
    }

    private static final class ActiveSession {
        private final SessionState state;
        private ConversationState conversation;
        private ConversationState lastConversation;
        private AccusationOutcome lastAccusation;
        private volatile long lastSeenMillis;
        private volatile boolean finished;

        private ActiveSession(SessionState state, long now) {
            this.state = state;
            this.lastSeenMillis = now;
        }
    }
}
