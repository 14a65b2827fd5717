package com.wordlegame.service.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StartGameResponse {
    private String gameId;
    private String mode;
    private int maxRounds;
    private String date; // daily only
}
