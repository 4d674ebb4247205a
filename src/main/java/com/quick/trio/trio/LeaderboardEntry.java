package com.quick.trio.trio;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record LeaderboardEntry(Long id, String name, int wins, int matchesPlayed, double winRate) {
}
