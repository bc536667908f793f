package org.example.mystery.service.game;

/**
 * Player input in the selecting phase: a roster index, or the decision to accuse.
 */
public record CharacterChoice(Integer characterIndex) {

    public static CharacterChoice of(int characterIndex) {
        return new CharacterChoice(characterIndex);
    }

    public static CharacterChoice accuse() {
        return new CharacterChoice(null);
    }

    public boolean isAccuse() {
        return characterIndex == null;
    }
}
