package com.wordlegame.service.controller;

import com.wordlegame.service.dto.LeaderboardResponse;
import com.wordlegame.service.service.LeaderboardService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;

@RestController
@RequestMapping("/api/daily")
@CrossOrigin(origins = "${cors.allowed.origins}")
public class DailyController {

    private final LeaderboardService leaderboardService;

    public DailyController(LeaderboardService leaderboardService) {
        this.leaderboardService = leaderboardService;
    }

    /**
     * GET /api/daily/leaderboard?date=YYYY-MM-DD
     * Top 20 for a day, today (UTC) if no date is given
     */
    @GetMapping("/leaderboard")
    public ResponseEntity<LeaderboardResponse> getLeaderboard(@RequestParam(required = false) String date) {
        LocalDate day = date == null || date.isBlank() ? null : LocalDate.parse(date);
        return ResponseEntity.ok(leaderboardService.getLeaderboard(day));
    }
}
