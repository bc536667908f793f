package org.example.mystery.service.game;

import org.example.mystery.model.ChatMessage;
import org.example.mystery.model.GameCharacter;
import org.example.mystery.model.InvestigationProgress;

import java.util.List;
import java.util.Set;

/**
 * Presentation side of a blocking investigation. Input methods block until the player answers.
 */
public interface InvestigationConsole {

    void showNarration(ChatMessage narration);

    void showIntroduction(GameCharacter character, ChatMessage introduction);

    void showQuestion(ChatMessage question);

    void showAnswer(GameCharacter character, ChatMessage answer);

    void showProgress(InvestigationProgress progress);

    void showNotice(String notice);

    void showAccusationResult(AccusationOutcome outcome);

    /**
     * Final screen. {@code killer} is revealed whether the player won or lost.
     */
    void showGameOver(SessionPhase outcome, GameCharacter killer);

    CharacterChoice selectCharacter(List<GameCharacter> roster, Set<Integer> visited);

    PlayerQuestion askOrType(GameCharacter character);

    String accuse(List<GameCharacter> suspects);
}
