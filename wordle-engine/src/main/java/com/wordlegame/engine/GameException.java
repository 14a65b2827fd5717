package com.wordlegame.engine;

/**
 * Base class for the errors a game reports back to its caller.
 * The {@link #getCode() code} is the stable error kind shown to clients.
 */
public abstract class GameException extends RuntimeException {

    private final String code;

    protected GameException(String code, String message) {
        super(message);
        this.code = code;
    }

    protected GameException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
