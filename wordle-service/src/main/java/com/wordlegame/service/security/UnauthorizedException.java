package com.wordlegame.service.security;

import com.wordlegame.engine.GameException;

public class UnauthorizedException extends GameException {

    public UnauthorizedException(String message) {
        super("Unauthorized", message);
    }

    public UnauthorizedException(String message, Throwable cause) {
        super("Unauthorized", message, cause);
    }
}
