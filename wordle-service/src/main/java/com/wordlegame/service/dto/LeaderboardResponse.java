package com.wordlegame.service.dto;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class LeaderboardResponse {
    private String date;
    private List<LeaderboardEntry> top;
}
