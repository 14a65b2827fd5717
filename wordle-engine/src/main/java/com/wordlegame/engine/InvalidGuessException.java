package com.wordlegame.engine;

/**
 * A submitted guess is not a well-formed word. No round is consumed.
 */
public class InvalidGuessException extends GameException {

    public InvalidGuessException(String message, Throwable cause) {
        super("InvalidGuess", message, cause);
    }
}
