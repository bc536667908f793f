package org.example.mystery.service.game;

/**
 * The chosen roster index is out of range or names the victim. Session state is unchanged.
 */
public class InvalidSelectionException extends RuntimeException {

    public InvalidSelectionException(String message) {
        super(message);
    }
}
