package com.wordlegame.service.dto;

import lombok.Data;

@Data
public class StartGameRequest {
    private String mode;       // normal | cheat | daily, defaults to normal
    private Integer maxRounds; // 1-10, defaults to the configured value
    private String seed;       // normal mode only
}
