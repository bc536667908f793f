package org.example.mystery.cli;

import org.example.mystery.model.CharacterRole;
import org.example.mystery.model.GameCharacter;
import org.example.mystery.model.InvestigationProgress;
import org.example.mystery.service.game.AccusationOutcome;
import org.example.mystery.service.game.CharacterChoice;
import org.example.mystery.service.game.PlayerQuestion;
import org.example.mystery.service.game.SessionPhase;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TerminalConsoleTest {

    private static final List<GameCharacter> ROSTER = List.of(
            new GameCharacter(CharacterRole.SUSPECT, "Agnes Pike", "Harbour master."),
            new GameCharacter(CharacterRole.VICTIM, "Silas Rook", "Moneylender."),
            new GameCharacter(CharacterRole.KILLER, "Tom Pike", "Nephew."));

    private final ByteArrayOutputStream output = new ByteArrayOutputStream();

    @Test
    void selectCharacter_numberedFromOne_mapsToRosterIndex() {
        TerminalConsole console = console("3\n");

        CharacterChoice choice = console.selectCharacter(ROSTER, Set.of(0));

        assertEquals(CharacterChoice.of(2), choice);
        String printed = printed();
        assertTrue(printed.contains("1. Agnes Pike (interviewed)"));
        assertTrue(printed.contains("2. Silas Rook (victim)"));
        assertTrue(printed.contains("3. Tom Pike\n"));
    }

    @Test
    void selectCharacter_nonNumber_repromptsThenAcceptsAccuse() {
        TerminalConsole console = console("Tom\n-1\n");

        CharacterChoice choice = console.selectCharacter(ROSTER, Set.of());

        assertTrue(choice.isAccuse());
        assertTrue(printed().contains("! Please enter a number."));
    }

    @Test
    void askOrType_questionMark_asksForAssistance() {
        TerminalConsole console = console(" ? \nWhere were you?\n");

        assertEquals(PlayerQuestion.assisted(), console.askOrType(ROSTER.get(0)));
        assertEquals(PlayerQuestion.typed("Where were you?"), console.askOrType(ROSTER.get(0)));
        assertTrue(printed().contains("EXIT ends the interview"));
    }

    @Test
    void accuse_numberOrName_resolvesToName() {
        List<GameCharacter> suspects = List.of(ROSTER.get(0), ROSTER.get(2));
        TerminalConsole console = console("2\n agnes pike \n9\n");

        assertEquals("Tom Pike", console.accuse(suspects));
        assertEquals("agnes pike", console.accuse(suspects));
        assertEquals("9", console.accuse(suspects));
    }

    @Test
    void prompt_closedInput_throwsIllegalState() {
        TerminalConsole console = console("");

        assertThrows(IllegalStateException.class, () -> console.askOrType(ROSTER.get(0)));
    }

    @Test
    void showProgress_actionLimitShownOnlyWhenSet() {
        TerminalConsole console = console("");

        console.showProgress(new InvestigationProgress(3, 1, 2, 4, null, null, 50.0));
        assertFalse(printed().contains("Questions left"));

        console.showProgress(new InvestigationProgress(3, 1, 2, 4, 10, 6, 50.0));
        assertTrue(printed().contains("Interviewed 1 of 2 | Guesses left: 3 | Questions left: 6"));
    }

    @Test
    void showAccusationResultAndGameOver_describeOutcome() {
        TerminalConsole console = console("");

        console.showAccusationResult(new AccusationOutcome("Agnes Pike", false, 2, SessionPhase.SELECTING));
        console.showGameOver(SessionPhase.LOST, ROSTER.get(2));

        String printed = printed();
        assertTrue(printed.contains("You accuse Agnes Pike, but they are innocent. 2 guesses left."));
        assertTrue(printed.contains("=== The killer walks free ==="));
        assertTrue(printed.contains("The killer was Tom Pike."));
    }

    private TerminalConsole console(String input) {
        return new TerminalConsole(
                new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)),
                new PrintStream(output, true, StandardCharsets.UTF_8),
                "EXIT");
    }

    private String printed() {
        return output.toString(StandardCharsets.UTF_8);
    }
}
