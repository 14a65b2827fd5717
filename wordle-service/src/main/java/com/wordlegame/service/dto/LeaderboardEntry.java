package com.wordlegame.service.dto;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class LeaderboardEntry {
    private String userId;
    private int guesses;
    private long elapsedMs;
}
