package com.wordlegame.engine;

/**
 * No session is known under the given id.
 */
public class SessionNotFoundException extends GameException {

    public SessionNotFoundException(String sessionId) {
        super("SessionNotFound", "Game not found: " + sessionId);
    }
}
