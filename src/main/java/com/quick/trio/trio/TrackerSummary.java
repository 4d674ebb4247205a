package com.quick.trio.trio;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TrackerSummary(List<LeaderboardEntry> leaderboard,
                             WeeklyLeaderboard weekly,
                             List<RecentMatch> recentMatches,
                             List<WinStreak> winStreaks,
                             List<PodiumDays> podiumDays) {
}
