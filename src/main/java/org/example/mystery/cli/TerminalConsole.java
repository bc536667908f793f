package org.example.mystery.cli;

import org.example.mystery.model.ChatMessage;
import org.example.mystery.model.GameCharacter;
import org.example.mystery.model.InvestigationProgress;
import org.example.mystery.service.game.AccusationOutcome;
import org.example.mystery.service.game.CharacterChoice;
import org.example.mystery.service.game.InvestigationConsole;
import org.example.mystery.service.game.PlayerQuestion;
import org.example.mystery.service.game.SessionPhase;

import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Scanner;
import java.util.Set;

/**
 * Line-based terminal presentation. Roster entries are shown numbered from 1.
 */
public class TerminalConsole implements InvestigationConsole {

    static final String ASSIST = "?";
    static final int ACCUSE = -1;

    private final Scanner in;
    private final PrintStream out;
    private final String exitToken;

    public TerminalConsole(InputStream in, PrintStream out, String exitToken) {
        this.in = new Scanner(in, StandardCharsets.UTF_8);
        this.out = out;
        this.exitToken = exitToken;
    }

    @Override
    public void showNarration(ChatMessage narration) {
        out.println();
        out.println("=== The crime scene ===");
        out.println(narration.speaker() + ": " + narration.content());
    }

    @Override
    public void showIntroduction(GameCharacter character, ChatMessage introduction) {
        out.println();
        out.println("=== Interview with " + character.name() + " ===");
        out.println(character.name() + ": " + introduction.content());
    }

    @Override
    public void showQuestion(ChatMessage question) {
        out.println(question.speaker() + ": " + question.content());
    }

    @Override
    public void showAnswer(GameCharacter character, ChatMessage answer) {
        out.println(character.name() + ": " + answer.content());
    }

    @Override
    public void showProgress(InvestigationProgress progress) {
        StringBuilder line = new StringBuilder()
                .append("Interviewed ").append(progress.interviewed())
                .append(" of ").append(progress.interviewable())
                .append(" | Guesses left: ").append(progress.guessesLeft());
        if (progress.actionsRemaining() != null) {
            line.append(" | Questions left: ").append(progress.actionsRemaining());
        }
        out.println();
        out.println(line);
    }

    @Override
    public void showNotice(String notice) {
        out.println("! " + notice);
    }

    @Override
    public void showAccusationResult(AccusationOutcome outcome) {
        if (outcome.correct()) {
            out.println("You accuse " + outcome.accusedName() + ". The case is solved!");
        } else {
            out.println("You accuse " + outcome.accusedName() + ", but they are innocent. "
                    + outcome.guessesLeft() + " guesses left.");
        }
    }

    @Override
    public void showGameOver(SessionPhase outcome, GameCharacter killer) {
        out.println();
        out.println(outcome == SessionPhase.WON ? "=== Case closed ===" : "=== The killer walks free ===");
        if (killer != null) {
            out.println("The killer was " + killer.name() + ".");
        }
    }

    @Override
    public CharacterChoice selectCharacter(List<GameCharacter> roster, Set<Integer> visited) {
        out.println();
        for (int i = 0; i < roster.size(); i++) {
            GameCharacter character = roster.get(i);
            String marker = character.isVictim() ? " (victim)" : visited.contains(i) ? " (interviewed)" : "";
            out.println("  " + (i + 1) + ". " + character.name() + marker);
        }
        while (true) {
            String input = prompt("Enter a character number to question, or " + ACCUSE + " to name the killer");
            try {
                int choice = Integer.parseInt(input.trim());
                return choice == ACCUSE ? CharacterChoice.accuse() : CharacterChoice.of(choice - 1);
            } catch (NumberFormatException e) {
                showNotice("Please enter a number.");
            }
        }
    }

    @Override
    public PlayerQuestion askOrType(GameCharacter character) {
        String input = prompt("Ask " + character.name() + " a question ('" + ASSIST
                + "' lets Holmes ask, " + exitToken + " ends the interview)");
        return ASSIST.equals(input.trim()) ? PlayerQuestion.assisted() : PlayerQuestion.typed(input);
    }

    @Override
    public String accuse(List<GameCharacter> suspects) {
        out.println();
        out.println("Who is the killer?");
        for (int i = 0; i < suspects.size(); i++) {
            out.println("  " + (i + 1) + ". " + suspects.get(i).name());
        }
        String input = prompt("Enter a number or a name").trim();
        if (input.matches("\\d{1,3}")) {
            int choice = Integer.parseInt(input);
            if (choice >= 1 && choice <= suspects.size()) {
                return suspects.get(choice - 1).name();
            }
        }
        return input;
    }

    private String prompt(String message) {
        out.print(message + "\n> ");
        out.flush();
        if (!in.hasNextLine()) {
            throw new IllegalStateException("Input closed");
        }
        return in.nextLine();
    }
}
