package com.wordlegame.service.controller;

import com.wordlegame.service.entity.PlayerStats;
import com.wordlegame.service.security.JwtUtil;
import com.wordlegame.service.service.LeaderboardService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/stats")
@CrossOrigin(origins = "${cors.allowed.origins}")
public class StatsController {

    private final LeaderboardService leaderboardService;
    private final JwtUtil jwtUtil;

    public StatsController(LeaderboardService leaderboardService, JwtUtil jwtUtil) {
        this.leaderboardService = leaderboardService;
        this.jwtUtil = jwtUtil;
    }

    /**
     * GET /api/stats/me
     * Get current player's statistics
     */
    @GetMapping("/me")
    public ResponseEntity<PlayerStats> getMyStats(
            @RequestHeader(value = "Authorization", required = false) String authHeader) {

        String userId = jwtUtil.requireUserId(authHeader);
        return ResponseEntity.ok(leaderboardService.getStats(userId));
    }
}
