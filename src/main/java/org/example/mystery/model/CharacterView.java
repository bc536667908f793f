package org.example.mystery.model;

/**
 * A roster entry as the player sees it: roles stay hidden except for the victim.
 */
public record CharacterView(
    int index,
    String name,
    boolean victim,
    boolean interviewed
) {
}
