package com.wordlegame.service.session;

import com.wordlegame.service.model.ActiveGame;

import java.time.Instant;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Holds live sessions and serialises access to each one.
 */
public interface SessionStore {

    void put(ActiveGame game);

    Optional<ActiveGame> get(String id);

    /**
     * Return the live session registered under {@code key}, or create, store and register one.
     * Concurrent callers with the same key all get the same session.
     */
    ActiveGame putIfAbsent(String key, Supplier<ActiveGame> creator);

    /**
     * Run {@code action} while holding the session's exclusive lock, so guesses for one id
     * apply one at a time in arrival order.
     *
     * @throws com.wordlegame.engine.SessionNotFoundException if no session has this id
     */
    <T> T withLock(String id, Function<ActiveGame, T> action);

    void remove(String id);

    /**
     * Drop sessions not touched since {@code cutoff}. Sessions in use are kept.
     *
     * @return how many were dropped
     */
    int evictIdleSince(Instant cutoff);

    int size();
}
