package com.wordlegame.service.controller;

import com.wordlegame.engine.InvalidGuessException;
import com.wordlegame.engine.InvalidWordFormatException;
import com.wordlegame.engine.SessionFinishedException;
import com.wordlegame.engine.SessionNotFoundException;
import com.wordlegame.engine.WordNotAllowedException;
import com.wordlegame.service.dto.GuessRequest;
import com.wordlegame.service.dto.GuessResponse;
import com.wordlegame.service.dto.LeaderboardEntry;
import com.wordlegame.service.dto.LeaderboardResponse;
import com.wordlegame.service.dto.StartGameRequest;
import com.wordlegame.service.dto.StartGameResponse;
import com.wordlegame.service.entity.PlayerStats;
import com.wordlegame.service.handler.GlobalExceptionHandler;
import com.wordlegame.service.security.JwtUtil;
import com.wordlegame.service.service.DailyAlreadyPlayedException;
import com.wordlegame.service.service.GameService;
import com.wordlegame.service.service.LeaderboardService;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class GameControllerTest {

    private static final String SECRET = "controller_test_secret_controller_test";

    private final GameService gameService = mock(GameService.class);
    private final LeaderboardService leaderboardService = mock(LeaderboardService.class);
    private final JwtUtil jwtUtil = new JwtUtil(SECRET);
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        mvc = MockMvcBuilders.standaloneSetup(
                        new GameController(gameService, jwtUtil),
                        new DailyController(leaderboardService),
                        new StatsController(leaderboardService, jwtUtil))
                .setControllerAdvice(new GlobalExceptionHandler())
                .addPlaceholderValue("cors.allowed.origins", "*")
                .build();
    }

    private static String bearer(String userId) {
        return "Bearer " + Jwts.builder()
                .claim("id", userId)
                .signWith(Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8)))
                .compact();
    }

    @Test
    void testStartGameAsGuest() throws Exception {
        when(gameService.startGame(any(StartGameRequest.class), isNull())).thenReturn(StartGameResponse.builder()
                .gameId("abc123").mode("cheat").maxRounds(6).build());

        mvc.perform(post("/api/games")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"mode\":\"cheat\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.gameId").value("abc123"))
                .andExpect(jsonPath("$.mode").value("cheat"))
                .andExpect(jsonPath("$.maxRounds").value(6))
                .andExpect(jsonPath("$.date").doesNotExist());
    }

    @Test
    void testStartDailyAsSignedInPlayer() throws Exception {
        when(gameService.startGame(any(StartGameRequest.class), eq("u1"))).thenReturn(StartGameResponse.builder()
                .gameId("d1").mode("daily").maxRounds(6).date("2025-08-24").build());

        mvc.perform(post("/api/games")
                        .header("Authorization", bearer("u1"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"mode\":\"daily\",\"maxRounds\":6}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.date").value("2025-08-24"));
    }

    @Test
    void testStartGameWithoutBody() throws Exception {
        when(gameService.startGame(any(StartGameRequest.class), isNull())).thenReturn(StartGameResponse.builder()
                .gameId("n1").mode("normal").maxRounds(6).build());

        mvc.perform(post("/api/games"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.mode").value("normal"));
    }

    @Test
    void testDailyAlreadyPlayedIsConflict() throws Exception {
        when(gameService.startGame(any(StartGameRequest.class), eq("u1")))
                .thenThrow(new DailyAlreadyPlayedException("2025-08-24"));

        mvc.perform(post("/api/games")
                        .header("Authorization", bearer("u1"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"mode\":\"daily\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("DailyAlreadyPlayed"));
    }

    @Test
    void testBadModeIsBadRequest() throws Exception {
        when(gameService.startGame(any(StartGameRequest.class), isNull()))
                .thenThrow(new IllegalArgumentException("Unknown game mode: blitz"));

        mvc.perform(post("/api/games")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"mode\":\"blitz\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("BadRequest"))
                .andExpect(jsonPath("$.message").value("Unknown game mode: blitz"));
    }

    @Test
    void testMalformedJsonIsBadRequest() throws Exception {
        mvc.perform(post("/api/games/guess")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("BadRequest"));
    }

    @Test
    void testGuess() throws Exception {
        when(gameService.submitGuess(any(GuessRequest.class))).thenReturn(GuessResponse.builder()
                .marks(List.of("miss", "miss", "hit", "miss", "hit"))
                .round(1)
                .state("playing")
                .keyboard(Map.of("a", "hit"))
                .build());

        mvc.perform(post("/api/games/guess")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"gameId\":\"abc123\",\"guess\":\"slate\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.marks.length()").value(5))
                .andExpect(jsonPath("$.marks[2]").value("hit"))
                .andExpect(jsonPath("$.round").value(1))
                .andExpect(jsonPath("$.state").value("playing"))
                .andExpect(jsonPath("$.keyboard.a").value("hit"));
    }

    @Test
    void testGuessErrorsMapToStatusCodes() throws Exception {
        String body = "{\"gameId\":\"abc123\",\"guess\":\"slate\"}";

        when(gameService.submitGuess(any(GuessRequest.class)))
                .thenThrow(new InvalidGuessException("Guess must be 5 letters a-z",
                        new InvalidWordFormatException("bad")))
                .thenThrow(new WordNotAllowedException("zzzzz"))
                .thenThrow(new SessionFinishedException("abc123"))
                .thenThrow(new SessionNotFoundException("abc123"));

        mvc.perform(post("/api/games/guess").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("InvalidGuess"));
        mvc.perform(post("/api/games/guess").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("WordNotAllowed"));
        mvc.perform(post("/api/games/guess").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("SessionFinished"));
        mvc.perform(post("/api/games/guess").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("SessionNotFound"));
    }

    @Test
    void testLeaderboard() throws Exception {
        when(leaderboardService.getLeaderboard(LocalDate.of(2025, 8, 24))).thenReturn(LeaderboardResponse.builder()
                .date("2025-08-24")
                .top(List.of(LeaderboardEntry.builder().userId("u1").guesses(3).elapsedMs(41_000L).build()))
                .build());

        mvc.perform(get("/api/daily/leaderboard").param("date", "2025-08-24"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.date").value("2025-08-24"))
                .andExpect(jsonPath("$.top[0].userId").value("u1"))
                .andExpect(jsonPath("$.top[0].guesses").value(3))
                .andExpect(jsonPath("$.top[0].elapsedMs").value(41000));
    }

    @Test
    void testLeaderboardDefaultsToToday() throws Exception {
        when(leaderboardService.getLeaderboard(null)).thenReturn(LeaderboardResponse.builder()
                .date("2025-08-25").top(List.of()).build());

        mvc.perform(get("/api/daily/leaderboard"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.date").value("2025-08-25"));
    }

    @Test
    void testLeaderboardBadDate() throws Exception {
        mvc.perform(get("/api/daily/leaderboard").param("date", "24/08/2025"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("BadRequest"));
    }

    @Test
    void testStatsRequireToken() throws Exception {
        mvc.perform(get("/api/stats/me"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("Unauthorized"));
        verifyNoInteractions(leaderboardService);
    }

    @Test
    void testMyStats() throws Exception {
        PlayerStats stats = PlayerStats.empty("u1", Instant.parse("2025-08-24T00:00:00Z"));
        stats.setGamesPlayed(3);
        stats.setWins(2);
        stats.setCurrentStreak(2);
        stats.setLongestStreak(2);
        when(leaderboardService.getStats("u1")).thenReturn(stats);

        mvc.perform(get("/api/stats/me").header("Authorization", bearer("u1")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.userId").value("u1"))
                .andExpect(jsonPath("$.gamesPlayed").value(3))
                .andExpect(jsonPath("$.wins").value(2));
    }
}
