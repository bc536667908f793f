package org.example.mystery.service.game;

/**
 * The accused name is not one of the session's suspects. Session state is unchanged.
 */
public class InvalidAccusationException extends RuntimeException {

    public InvalidAccusationException(String message) {
        super(message);
    }
}
