package org.example.mystery.service.game;

import org.example.mystery.model.ChatMessage;
import org.example.mystery.model.GameCharacter;
import org.example.mystery.model.Scenario;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Plain-text export of a session: a header with the case and its standing, then the narration
 * and every interview in the order they happened.
 */
@Component
public class InvestigationLogFormatter {

    private static final String RULE = "----------------------------------------";

    public String format(SessionState state) {
        Objects.requireNonNull(state, "state must not be null");

        List<String> lines = new ArrayList<>();
        lines.add("Investigation: " + orUnknown(state.getEnvironment()));

        Scenario scenario = state.getScenario();
        if (scenario != null) {
            lines.add(withTerminalPeriod("Victim: " + orUnknown(scenario.victimName())
                    + ", found at " + orUnknown(scenario.locationFound())
                    + " (" + orUnknown(scenario.timeOfDeath()) + ")"));
        }
        lines.add("Status: " + formatStatus(state));
        lines.add("Guesses left: " + state.getGuessesLeft());
        lines.add("Actions: " + formatActions(state));
        lines.add(RULE);

        String currentSpeaker = null;
        for (ChatMessage message : state.getLog()) {
            if (ChatMessage.NARRATOR.equals(message.role())) {
                lines.add("");
                lines.add("Crime scene");
                currentSpeaker = null;
            } else if (ChatMessage.CHARACTER.equals(message.role())
                    && !message.speaker().equals(currentSpeaker)) {
                lines.add("");
                lines.add("Interview with " + message.speaker());
                currentSpeaker = message.speaker();
            }
            lines.add(message.speaker() + ": " + clean(message.content()));
        }

        return String.join("\n", lines).trim() + "\n";
    }

    private String formatStatus(SessionState state) {
        return switch (state.getPhase()) {
            case WON -> "Solved. " + killerName(state) + " was the killer.";
            case LOST -> "Unsolved. " + killerName(state) + " was the killer.";
            case ACCUSING -> "Awaiting accusation";
            default -> "In progress";
        };
    }

    private String formatActions(SessionState state) {
        if (state.getActionLimit() == null) {
            return String.valueOf(state.getTotalActions());
        }
        return state.getTotalActions() + " of " + state.getActionLimit();
    }

    private String killerName(SessionState state) {
        GameCharacter killer = state.getKiller();
        return killer == null ? "Unknown" : killer.name();
    }

    private String orUnknown(String value) {
        String cleaned = clean(value);
        return cleaned.isBlank() ? "unknown" : cleaned;
    }

    private String clean(String value) {
        if (value == null) {
            return "";
        }
        return value.trim().replaceAll("\\s+", " ");
    }

    private String withTerminalPeriod(String value) {
        if (value.endsWith(".") || value.endsWith("!") || value.endsWith("?")) {
            return value;
        }
        return value + ".";
    }
}
