package com.wordlegame.engine;

/**
 * A word violates the fixed length or the a-z alphabet.
 */
public class InvalidWordFormatException extends GameException {

    public InvalidWordFormatException(String message) {
        super("InvalidWordFormat", message);
    }
}
