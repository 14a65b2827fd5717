package com.wordlegame.service.dto;

import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

@Data
@Builder
public class GuessResponse {
    private List<String> marks;
    private int round;
    private String state;
    private Map<String, String> keyboard; // letter -> best mark so far
}
