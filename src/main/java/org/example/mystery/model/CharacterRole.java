package org.example.mystery.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum CharacterRole {
    KILLER("Killer"),
    VICTIM("Victim"),
    SUSPECT("Suspect");

    private final String label;

    CharacterRole(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Lenient parse of a generated role label. Anything that is neither the killer
     * nor the victim is a suspect ("Butler", "Witness", ...).
     */
    @JsonCreator
    public static CharacterRole fromValue(String value) {
        if (value == null) {
            return SUSPECT;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (normalized.equals("killer") || normalized.equals("murderer")) {
            return KILLER;
        }
        if (normalized.equals("victim")) {
            return VICTIM;
        }
        return SUSPECT;
    }
}
