package com.quick.trio.trio;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.LocalDateTime;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RecentMatch(Long id, LocalDateTime playedAt, Long winnerId, String winnerName, List<Opponent> opponents) {

    public static RecentMatch from(TrackerMatch match) {
        TrackerPlayer winner = match.getWinner();
        return new RecentMatch(
                match.getId(),
                match.getPlayedAt(),
                winner.getId(),
                winner.getName(),
                match.getParticipants().stream()
                        .filter(p -> !p.getId().equals(winner.getId()))
                        .map(p -> new Opponent(p.getId(), p.getName()))
                        .toList());
    }

    public record Opponent(Long id, String name) {
    }
}
