package com.wordlegame.service.session;

import com.wordlegame.engine.SessionNotFoundException;
import com.wordlegame.service.model.ActiveGame;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Process-local session store; sessions are lost on restart.
 */
@Component
public class InMemorySessionStore implements SessionStore {

    private final Map<String, Entry> sessions = new ConcurrentHashMap<>();
    private final Map<String, String> keyedIds = new ConcurrentHashMap<>();

    @Override
    public void put(ActiveGame game) {
        // Re-putting the same game keeps its lock
        sessions.compute(game.getId(), (id, existing) ->
                existing != null && existing.game == game ? existing : new Entry(game));
    }

    @Override
    public Optional<ActiveGame> get(String id) {
        Entry entry = id == null ? null : sessions.get(id);
        return entry == null ? Optional.empty() : Optional.of(entry.game);
    }

    @Override
    public ActiveGame putIfAbsent(String key, Supplier<ActiveGame> creator) {
        AtomicReference<ActiveGame> result = new AtomicReference<>();
        keyedIds.compute(key, (k, existingId) -> {
            Entry existing = existingId == null ? null : sessions.get(existingId);
            if (existing != null) {
                result.set(existing.game);
                return existingId;
            }
            ActiveGame game = creator.get();
            sessions.put(game.getId(), new Entry(game));
            result.set(game);
            return game.getId();
        });
        return result.get();
    }

    @Override
    public <T> T withLock(String id, Function<ActiveGame, T> action) {
        Entry entry = id == null ? null : sessions.get(id);
        if (entry == null) {
            throw new SessionNotFoundException(id);
        }
        entry.lock.lock();
        try {
            // evicted while we waited
            if (sessions.get(id) != entry) {
                throw new SessionNotFoundException(id);
            }
            return action.apply(entry.game);
        } finally {
            entry.lock.unlock();
        }
    }

    @Override
    public void remove(String id) {
        sessions.remove(id);
        keyedIds.values().remove(id);
    }

    @Override
    public int evictIdleSince(Instant cutoff) {
        int evicted = 0;
        for (Map.Entry<String, Entry> e : sessions.entrySet()) {
            Entry entry = e.getValue();
            if (!entry.lock.tryLock()) {
                continue;
            }
            try {
                if (entry.game.getLastAccessedAt().isBefore(cutoff) && sessions.remove(e.getKey(), entry)) {
                    keyedIds.values().remove(e.getKey());
                    evicted++;
                }
            } finally {
                entry.lock.unlock();
            }
        }
        return evicted;
    }

    @Override
    public int size() {
        return sessions.size();
    }

    private static final class Entry {
        private final ActiveGame game;
        private final ReentrantLock lock = new ReentrantLock(true);

        private Entry(ActiveGame game) {
            this.game = game;
        }
    }
}
