package org.example.mystery.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

public record GameCharacter(
    CharacterRole role,
    String name,
    String backstory
) {
    public GameCharacter {
        if (role == null) {
            role = CharacterRole.SUSPECT;
        }
    }

    @JsonIgnore
    public boolean isKiller() {
        return role == CharacterRole.KILLER;
    }

    @JsonIgnore
    public boolean isVictim() {
        return role == CharacterRole.VICTIM;
    }

    /**
     * Formatted persona handed to prompts. Computed on every call.
     */
    public String persona() {
        return "Name: " + name + "\nRole: " + role.label() + "\nBackstory: " + backstory + "\n";
    }
}
