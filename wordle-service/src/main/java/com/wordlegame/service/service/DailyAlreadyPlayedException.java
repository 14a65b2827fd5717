package com.wordlegame.service.service;

import com.wordlegame.engine.GameException;

/**
 * The player already has a recorded result for today's puzzle.
 */
public class DailyAlreadyPlayedException extends GameException {

    public DailyAlreadyPlayedException(String date) {
        super("DailyAlreadyPlayed", "Daily puzzle for " + date + " already played");
    }
}
