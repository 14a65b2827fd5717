package com.wordlegame.service.model;

import com.wordlegame.engine.DailyPuzzle;
import com.wordlegame.engine.GameSession;
import lombok.Getter;

import java.time.Instant;
import java.util.Optional;

/**
 * A session held by the server, with who plays it and when it started.
 */
@Getter
public class ActiveGame {

    private final GameSession session;
    private final String userId; // null for guests
    private final DailyPuzzle dailyPuzzle; // null unless daily
    private final Instant startedAt;
    private volatile Instant lastAccessedAt;

    public ActiveGame(GameSession session, String userId, DailyPuzzle dailyPuzzle, Instant startedAt) {
        this.session = session;
        this.userId = userId;
        this.dailyPuzzle = dailyPuzzle;
        this.startedAt = startedAt;
        this.lastAccessedAt = startedAt;
    }

    public String getId() {
        return session.getId();
    }

    public Optional<String> owner() {
        return Optional.ofNullable(userId);
    }

    /**
     * Key under which a player's daily session for one day is registered.
     */
    public static String dailyKey(String userId, String dateKey) {
        return "daily:" + userId + ":" + dateKey;
    }

    public void touch(Instant now) {
        this.lastAccessedAt = now;
    }
}
