package com.wordlegame.service.dto;

import lombok.Data;

@Data
public class GuessRequest {
    private String gameId;
    private String guess;
}
