package org.example.mystery.service.game;

/**
 * A question the player typed, or a request for the detective to ask one.
 */
public record PlayerQuestion(boolean detectiveAsks, String text) {

    public static PlayerQuestion assisted() {
        return new PlayerQuestion(true, null);
    }

    public static PlayerQuestion typed(String text) {
        return new PlayerQuestion(false, text);
    }

    public boolean isBlank() {
        return !detectiveAsks && (text == null || text.isBlank());
    }
}
