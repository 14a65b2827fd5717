package com.wordlegame.service.service;

import com.wordlegame.engine.DailySeed;
import com.wordlegame.service.dto.LeaderboardEntry;
import com.wordlegame.service.dto.LeaderboardResponse;
import com.wordlegame.service.entity.DailyResult;
import com.wordlegame.service.entity.PlayerStats;
import com.wordlegame.service.repository.DailyResultRepository;
import com.wordlegame.service.repository.PlayerStatsRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Persists daily results and player statistics, and reads the daily leaderboard.
 */
@Slf4j
@Service
public class LeaderboardService {

    private final DailyResultRepository dailyResultRepository;
    private final PlayerStatsRepository statsRepository;
    private final Clock clock;

    public LeaderboardService(DailyResultRepository dailyResultRepository,
                              PlayerStatsRepository statsRepository,
                              Clock clock) {
        this.dailyResultRepository = dailyResultRepository;
        this.statsRepository = statsRepository;
        this.clock = clock;
    }

    public boolean hasPlayedDaily(String userId, String dateKey) {
        return dailyResultRepository.existsByUserIdAndDate(userId, dateKey);
    }

    /**
     * Store a daily win. A second result for the same player and day is ignored.
     */
    @Transactional
    public void recordDailyWin(String userId, String dateKey, int wordIndex, int guesses, long elapsedMs) {
        if (dailyResultRepository.existsByUserIdAndDate(userId, dateKey)) {
            log.debug("Daily result for {} on {} already stored", userId, dateKey);
            return;
        }

        DailyResult result = DailyResult.builder()
                .userId(userId)
                .date(dateKey)
                .wordIndex(wordIndex)
                .guesses(guesses)
                .elapsedMs(elapsedMs)
                .createdAt(clock.instant())
                .build();
        dailyResultRepository.save(result);
        log.info("Recorded daily win for {} on {} in {} guesses", userId, dateKey, guesses);
    }

    /**
     * Update a player's totals after a finished game. A win extends the streak, a loss resets it.
     */
    @Transactional
    public PlayerStats recordFinishedGame(String userId, boolean won) {
        PlayerStats stats = statsRepository.findByUserId(userId)
                .orElse(PlayerStats.empty(userId, clock.instant()));

        stats.setGamesPlayed(stats.getGamesPlayed() + 1);
        if (won) {
            stats.setWins(stats.getWins() + 1);
            stats.setCurrentStreak(stats.getCurrentStreak() + 1);
            if (stats.getCurrentStreak() > stats.getLongestStreak()) {
                stats.setLongestStreak(stats.getCurrentStreak());
            }
        } else {
            stats.setCurrentStreak(0);
        }

        return statsRepository.save(stats);
    }

    /**
     * Top 20 for a day, fastest first, then fewest guesses, then earliest.
     *
     * @param date the day to read, or null for today (UTC)
     */
    public LeaderboardResponse getLeaderboard(LocalDate date) {
        String dateKey = DailySeed.dateKey(date != null ? date : LocalDate.now(clock));
        List<LeaderboardEntry> top = dailyResultRepository
                .findTop20ByDateOrderByElapsedMsAscGuessesAscCreatedAtAsc(dateKey)
                .stream()
                .map(r -> LeaderboardEntry.builder()
                        .userId(r.getUserId())
                        .guesses(r.getGuesses())
                        .elapsedMs(r.getElapsedMs())
                        .build())
                .collect(Collectors.toList());

        return LeaderboardResponse.builder()
                .date(dateKey)
                .top(top)
                .build();
    }

    public PlayerStats getStats(String userId) {
        return statsRepository.findByUserId(userId)
                .orElse(PlayerStats.empty(userId, clock.instant()));
    }
}
