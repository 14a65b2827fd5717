package com.wordlegame.engine;

/**
 * A guess was submitted after the session was won or lost.
 */
public class SessionFinishedException extends GameException {

    public SessionFinishedException(String sessionId) {
        super("SessionFinished", "Game finished: " + sessionId);
    }
}
