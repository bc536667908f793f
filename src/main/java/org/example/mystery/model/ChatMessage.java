package org.example.mystery.model;

public record ChatMessage(
    String role,
    String speaker,
    String content,
    long timestamp
) {
    public static final String NARRATOR = "narrator";
    public static final String DETECTIVE = "detective";
    public static final String CHARACTER = "character";

    public static ChatMessage narrator(String content) {
        return new ChatMessage(NARRATOR, "Dr. Watson", content, System.currentTimeMillis());
    }

    public static ChatMessage detective(String content) {
        return new ChatMessage(DETECTIVE, "Sherlock Holmes", content, System.currentTimeMillis());
    }

    public static ChatMessage character(String name, String content) {
        return new ChatMessage(CHARACTER, name, content, System.currentTimeMillis());
    }

    public boolean fromDetective() {
        return DETECTIVE.equals(role);
    }
}
