package com.quick.trio.trio;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Monday to Friday of the current week; dates as dd/MM.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record WeeklyLeaderboard(List<LeaderboardEntry> players, String weekStart, String weekEnd) {
}
