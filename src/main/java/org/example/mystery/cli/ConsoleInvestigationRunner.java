package org.example.mystery.cli;

import org.example.mystery.model.GameSettings;
import org.example.mystery.service.game.ConversationMachine;
import org.example.mystery.service.game.SessionMachine;
import org.example.mystery.service.game.SessionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Plays one investigation in the terminal.
 *
 * Run with: mvn spring-boot:run -Dspring-boot.run.profiles=console
 * Or: java -jar target/mystery.jar --spring.profiles.active=console
 */
@Component
@Profile("console")
public class ConsoleInvestigationRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(ConsoleInvestigationRunner.class);

    private final SessionMachine sessionMachine;
    private final ConversationMachine conversationMachine;

    @Value("${mystery.game.environment:a fog-bound Victorian manor}")
    private String environment;

    @Value("${mystery.game.roster-size:5}")
    private int rosterSize;

    @Value("${mystery.game.guesses:3}")
    private int guesses;

    @Value("${mystery.game.action-limit:#{null}}")
    private Integer actionLimit;

    public ConsoleInvestigationRunner(SessionMachine sessionMachine, ConversationMachine conversationMachine) {
        this.sessionMachine = sessionMachine;
        this.conversationMachine = conversationMachine;
    }

    @Override
    public void run(String... args) {
        GameSettings settings = new GameSettings(environment, rosterSize, guesses, actionLimit);
        log.info("Starting console investigation: environment='{}', characters={}, guesses={}, actionLimit={}",
                settings.environment(), settings.rosterSize(), settings.guesses(),
                settings.actionLimit() != null ? settings.actionLimit() : "none");

        TerminalConsole console = new TerminalConsole(System.in, System.out, conversationMachine.getExitToken());
        SessionState state = sessionMachine.play(settings, console);
        try {
            log.info("Investigation finished: {} after {} actions", state.getPhase(), state.getTotalActions());
        } finally {
            sessionMachine.discard(state);
        }
    }
}
