package com.wordlegame.service.session;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

@Slf4j
@Component
public class SessionCleanupScheduler {

    private final SessionStore sessionStore;
    private final Clock clock;
    private final Duration ttl;

    public SessionCleanupScheduler(SessionStore sessionStore, Clock clock,
                                   @Value("${wordle.sessions.ttl-minutes:1440}") long ttlMinutes) {
        this.sessionStore = sessionStore;
        this.clock = clock;
        this.ttl = Duration.ofMinutes(ttlMinutes);
    }

    @Scheduled(fixedDelayString = "${wordle.sessions.cleanup-interval-ms:60000}")
    public void evictIdleSessions() {
        int evicted = sessionStore.evictIdleSince(clock.instant().minus(ttl));
        if (evicted > 0) {
            log.info("Evicted {} idle sessions, {} remain", evicted, sessionStore.size());
        }
    }
}
