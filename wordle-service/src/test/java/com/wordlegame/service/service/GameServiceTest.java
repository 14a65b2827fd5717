package com.wordlegame.service.service;

import com.wordlegame.engine.AnswerPicker;
import com.wordlegame.engine.FewestHitsPolicy;
import com.wordlegame.engine.GameFactory;
import com.wordlegame.engine.SessionFinishedException;
import com.wordlegame.engine.SessionNotFoundException;
import com.wordlegame.engine.WordDictionary;
import com.wordlegame.engine.WordNotAllowedException;
import com.wordlegame.service.dto.GuessRequest;
import com.wordlegame.service.dto.GuessResponse;
import com.wordlegame.service.dto.StartGameRequest;
import com.wordlegame.service.dto.StartGameResponse;
import com.wordlegame.service.session.InMemorySessionStore;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class GameServiceTest {

    // One answer keeps every mode deterministic
    private final WordDictionary dictionary = WordDictionary.of(List.of("crane"), List.of("slate", "bolts", "audio"));
    private final GameFactory factory = new GameFactory(dictionary, new FewestHitsPolicy(),
            new AnswerPicker(new Random(7)), "test_salt", false);
    private final InMemorySessionStore store = new InMemorySessionStore();
    private final LeaderboardService leaderboardService = mock(LeaderboardService.class);
    private final Clock clock = Clock.fixed(Instant.parse("2025-08-24T10:15:30Z"), ZoneOffset.UTC);
    private final GameService gameService = new GameService(factory, store, leaderboardService, clock, 6);

    private static StartGameRequest request(String mode, Integer maxRounds) {
        StartGameRequest request = new StartGameRequest();
        request.setMode(mode);
        request.setMaxRounds(maxRounds);
        return request;
    }

    private static GuessRequest guess(String gameId, String word) {
        GuessRequest request = new GuessRequest();
        request.setGameId(gameId);
        request.setGuess(word);
        return request;
    }

    @Test
    void testStartNormalGameUsesDefaultRounds() {
        StartGameResponse response = gameService.startGame(new StartGameRequest(), null);

        assertEquals("normal", response.getMode());
        assertEquals(6, response.getMaxRounds());
        assertNull(response.getDate(), "Only daily games carry a date");
        assertTrue(store.get(response.getGameId()).isPresent());
    }

    @Test
    void testStartRejectsBadModeAndRounds() {
        assertThrows(IllegalArgumentException.class, () -> gameService.startGame(request("blitz", 6), null));
        assertThrows(IllegalArgumentException.class, () -> gameService.startGame(request("normal", 11), null));
        assertThrows(IllegalArgumentException.class, () -> gameService.startGame(request("cheat", 0), null));
        assertEquals(0, store.size());
    }

    @Test
    void testGuessFlowAndKeyboard() {
        String gameId = gameService.startGame(request("normal", 3), null).getGameId();

        GuessResponse first = gameService.submitGuess(guess(gameId, "slate"));
        assertEquals(List.of("miss", "miss", "hit", "miss", "hit"), first.getMarks());
        assertEquals(1, first.getRound());
        assertEquals("playing", first.getState());
        assertEquals("hit", first.getKeyboard().get("a"));
        assertEquals("miss", first.getKeyboard().get("s"));

        GuessResponse second = gameService.submitGuess(guess(gameId, "CRANE"));
        assertEquals("won", second.getState());
        assertEquals(2, second.getRound());

        assertThrows(SessionFinishedException.class, () -> gameService.submitGuess(guess(gameId, "crane")));
    }

    @Test
    void testRejectedGuessKeepsRound() {
        String gameId = gameService.startGame(request("normal", 6), null).getGameId();
        assertThrows(WordNotAllowedException.class, () -> gameService.submitGuess(guess(gameId, "zzzzz")));
        assertEquals(1, gameService.submitGuess(guess(gameId, "audio")).getRound());
    }

    @Test
    void testUnknownGame() {
        assertThrows(SessionNotFoundException.class, () -> gameService.submitGuess(guess("nope", "crane")));
        assertThrows(SessionNotFoundException.class, () -> gameService.submitGuess(guess(null, "crane")));
    }

    @Test
    void testGuestGamesAreNotRecorded() {
        String gameId = gameService.startGame(request("daily", 6), null).getGameId();
        assertEquals("won", gameService.submitGuess(guess(gameId, "crane")).getState());
        verifyNoInteractions(leaderboardService);
    }

    @Test
    void testLossUpdatesStatsForSignedInPlayer() {
        String gameId = gameService.startGame(request("normal", 1), "u1").getGameId();
        assertEquals("lost", gameService.submitGuess(guess(gameId, "slate")).getState());

        verify(leaderboardService).recordFinishedGame("u1", false);
        verify(leaderboardService, never()).recordDailyWin(any(), any(), anyInt(), anyInt(), anyLong());
    }

    @Test
    void testDailyWinIsRecorded() {
        when(leaderboardService.hasPlayedDaily("u1", "2025-08-24")).thenReturn(false);

        StartGameResponse started = gameService.startGame(request("daily", null), "u1");
        assertEquals("daily", started.getMode());
        assertEquals("2025-08-24", started.getDate());

        gameService.submitGuess(guess(started.getGameId(), "bolts"));
        assertEquals("won", gameService.submitGuess(guess(started.getGameId(), "crane")).getState());

        verify(leaderboardService).recordFinishedGame("u1", true);
        verify(leaderboardService).recordDailyWin("u1", "2025-08-24", 0, 2, 0L);
    }

    @Test
    void testDailyAlreadyPlayed() {
        when(leaderboardService.hasPlayedDaily("u1", "2025-08-24")).thenReturn(true);

        DailyAlreadyPlayedException e = assertThrows(DailyAlreadyPlayedException.class,
                () -> gameService.startGame(request("daily", 6), "u1"));
        assertEquals("DailyAlreadyPlayed", e.getCode());
    }

    @Test
    void testDailyGameIsReusedForSamePlayer() {
        String first = gameService.startGame(request("daily", 6), "u1").getGameId();
        gameService.submitGuess(guess(first, "slate"));

        assertEquals(first, gameService.startGame(request("daily", 6), "u1").getGameId());
        assertNotEquals(first, gameService.startGame(request("daily", 6), "u2").getGameId());
        assertEquals(2, store.size());
    }

    @Test
    void testConcurrentDailyStartsShareOneSession() throws Exception {
        for (int run = 0; run < 100; run++) {
            InMemorySessionStore sessions = new InMemorySessionStore();
            GameService service = new GameService(factory, sessions, leaderboardService, clock, 6);
            CountDownLatch start = new CountDownLatch(1);
            ExecutorService pool = Executors.newFixedThreadPool(8);
            try {
                List<Future<String>> futures = new ArrayList<>();
                for (int i = 0; i < 8; i++) {
                    futures.add(pool.submit(() -> {
                        start.await();
                        return service.startGame(request("daily", 6), "u1").getGameId();
                    }));
                }
                start.countDown();
                Set<String> ids = new HashSet<>();
                for (Future<String> future : futures) {
                    ids.add(future.get());
                }
                assertEquals(1, ids.size(), "Concurrent starts must get the same daily game");
            } finally {
                pool.shutdownNow();
            }
            assertEquals(1, sessions.size());
        }
    }

    @Test
    void testStorageFailureDoesNotFailGuess() {
        doThrow(new DataAccessResourceFailureException("db down"))
                .when(leaderboardService).recordFinishedGame(anyString(), anyBoolean());

        String gameId = gameService.startGame(request("cheat", 6), "u1").getGameId();
        assertEquals("won", gameService.submitGuess(guess(gameId, "crane")).getState());
    }
}
