package com.wordlegame.service.service;

import com.wordlegame.engine.CheatingHostEvaluator;
import com.wordlegame.engine.DailyPuzzle;
import com.wordlegame.engine.GameFactory;
import com.wordlegame.engine.GameMode;
import com.wordlegame.engine.GameSession;
import com.wordlegame.engine.GameState;
import com.wordlegame.engine.GuessResult;
import com.wordlegame.engine.Mark;
import com.wordlegame.service.dto.GuessRequest;
import com.wordlegame.service.dto.GuessResponse;
import com.wordlegame.service.dto.StartGameRequest;
import com.wordlegame.service.dto.StartGameResponse;
import com.wordlegame.service.model.ActiveGame;
import com.wordlegame.service.session.SessionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Starts sessions in every mode and applies guesses to them.
 */
@Slf4j
@Service
public class GameService {

    private final GameFactory gameFactory;
    private final SessionStore sessionStore;
    private final LeaderboardService leaderboardService;
    private final Clock clock;
    private final int defaultMaxRounds;

    public GameService(GameFactory gameFactory,
                       SessionStore sessionStore,
                       LeaderboardService leaderboardService,
                       Clock clock,
                       @Value("${wordle.default-max-rounds:6}") int defaultMaxRounds) {
        this.gameFactory = gameFactory;
        this.sessionStore = sessionStore;
        this.leaderboardService = leaderboardService;
        this.clock = clock;
        this.defaultMaxRounds = defaultMaxRounds;
    }

    /**
     * Start a game.
     *
     * @param userId the signed-in player, or null for a guest
     * @throws IllegalArgumentException for an unknown mode or a round limit outside 1-10
     * @throws DailyAlreadyPlayedException if the player already has a result for today's puzzle
     */
    public StartGameResponse startGame(StartGameRequest request, String userId) {
        GameMode mode = GameMode.fromWireName(request.getMode());
        int maxRounds = request.getMaxRounds() != null ? request.getMaxRounds() : defaultMaxRounds;
        Instant now = clock.instant();

        ActiveGame game = switch (mode) {
            case CHEAT -> store(new ActiveGame(gameFactory.newCheatGame(maxRounds), userId, null, now));
            case DAILY -> startDaily(maxRounds, userId, now);
            case NORMAL -> store(new ActiveGame(gameFactory.newNormalGame(maxRounds, request.getSeed()),
                    userId, null, now));
        };

        log.info("Started {} game {} ({} rounds) for {}", mode.getWireName(), game.getId(),
                game.getSession().getMaxRounds(), userId != null ? userId : "guest");

        return StartGameResponse.builder()
                .gameId(game.getId())
                .mode(mode.getWireName())
                .maxRounds(game.getSession().getMaxRounds())
                .date(game.getDailyPuzzle() != null ? game.getDailyPuzzle().getDateKey() : null)
                .build();
    }

    /**
     * Apply one guess. Guesses for the same game are applied one at a time.
     *
     * @throws com.wordlegame.engine.SessionNotFoundException if the game id is unknown or expired
     */
    public GuessResponse submitGuess(GuessRequest request) {
        return sessionStore.withLock(request.getGameId(), game -> {
            GameSession session = game.getSession();
            GuessResult result = session.submitGuess(request.getGuess());
            Instant now = clock.instant();
            game.touch(now);

            if (session.getEvaluator() instanceof CheatingHostEvaluator) {
                log.debug("Game {} round {}: {} candidates left", game.getId(), result.getRound(),
                        ((CheatingHostEvaluator) session.getEvaluator()).getCandidates().size());
            }
            if (result.getState().isFinished()) {
                onFinished(game, result, now);
            }

            return toResponse(result, session.getKeyboard());
        });
    }

    private ActiveGame startDaily(int maxRounds, String userId, Instant now) {
        DailyPuzzle puzzle = gameFactory.dailyPuzzle(LocalDate.now(clock));
        if (userId == null) {
            return store(new ActiveGame(gameFactory.newDailyGame(maxRounds, puzzle), null, puzzle, now));
        }

        String dateKey = puzzle.getDateKey();
        if (leaderboardService.hasPlayedDaily(userId, dateKey)) {
            throw new DailyAlreadyPlayedException(dateKey);
        }

        // One daily session per player per day, so a lost game cannot be restarted
        return sessionStore.putIfAbsent(ActiveGame.dailyKey(userId, dateKey),
                () -> new ActiveGame(gameFactory.newDailyGame(maxRounds, puzzle), userId, puzzle, now));
    }

    private ActiveGame store(ActiveGame game) {
        sessionStore.put(game);
        return game;
    }

    private void onFinished(ActiveGame game, GuessResult result, Instant now) {
        boolean won = result.getState() == GameState.WON;
        log.info("Game {} finished: {} in {} rounds", game.getId(), result.getState().getWireName(), result.getRound());

        Optional<String> owner = game.owner();
        if (owner.isEmpty()) {
            return;
        }

        try {
            leaderboardService.recordFinishedGame(owner.get(), won);
            DailyPuzzle puzzle = game.getDailyPuzzle();
            if (won && puzzle != null) {
                long elapsedMs = Duration.between(game.getStartedAt(), now).toMillis();
                leaderboardService.recordDailyWin(owner.get(), puzzle.getDateKey(), puzzle.getWordIndex(),
                        result.getRound(), elapsedMs);
            }
        } catch (DataAccessException | TransactionException e) {
            log.warn("Could not record result of game {} for {}: {}", game.getId(), owner.get(), e.getMessage());
        }
    }

    private GuessResponse toResponse(GuessResult result, Map<Character, Mark> keyboard) {
        Map<String, String> letters = new LinkedHashMap<>();
        keyboard.forEach((letter, mark) -> letters.put(String.valueOf(letter), mark.getWireName()));

        return GuessResponse.builder()
                .marks(result.getMarks().toWireNames())
                .round(result.getRound())
                .state(result.getState().getWireName())
                .keyboard(letters)
                .build();
    }
}
