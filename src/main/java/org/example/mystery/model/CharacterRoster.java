package org.example.mystery.model;

import java.util.List;

/**
 * Structured roster returned by the generation backend.
 */
public record CharacterRoster(
    List<GameCharacter> characters
) {
    public CharacterRoster {
        characters = characters == null ? List.of() : List.copyOf(characters);
    }

    public long countOf(CharacterRole role) {
        return characters.stream().filter(c -> c.role() == role).count();
    }
}
