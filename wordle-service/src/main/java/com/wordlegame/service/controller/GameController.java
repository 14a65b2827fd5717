package com.wordlegame.service.controller;

import com.wordlegame.service.dto.GuessRequest;
import com.wordlegame.service.dto.GuessResponse;
import com.wordlegame.service.dto.StartGameRequest;
import com.wordlegame.service.dto.StartGameResponse;
import com.wordlegame.service.security.JwtUtil;
import com.wordlegame.service.service.GameService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/games")
@CrossOrigin(origins = "${cors.allowed.origins}")
public class GameController {

    private final GameService gameService;
    private final JwtUtil jwtUtil;

    public GameController(GameService gameService, JwtUtil jwtUtil) {
        this.gameService = gameService;
        this.jwtUtil = jwtUtil;
    }

    /**
     * POST /api/games
     * Start a normal, cheat or daily game. Signing in is optional.
     */
    @PostMapping
    public ResponseEntity<StartGameResponse> startGame(
            @RequestHeader(value = "Authorization", required = false) String authHeader,
            @RequestBody(required = false) StartGameRequest request) {

        String userId = jwtUtil.resolveUserId(authHeader).orElse(null);
        StartGameResponse response = gameService.startGame(
                request != null ? request : new StartGameRequest(), userId);
        return ResponseEntity.ok(response);
    }

    /**
     * POST /api/games/guess
     * Submit a guess for a running game
     */
    @PostMapping("/guess")
    public ResponseEntity<GuessResponse> guess(@RequestBody GuessRequest request) {
        return ResponseEntity.ok(gameService.submitGuess(request));
    }
}
