package com.quick.trio.trio;

import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/tracker")
@CrossOrigin("*")
@RequiredArgsConstructor
public class TrackerController {

    private final StatsService statsService;

    @GetMapping("/players")
    public List<TrackerPlayer> players() {
        return statsService.players();
    }

    @PostMapping("/players")
    public ResponseEntity<TrackerPlayer> addPlayer(@RequestBody NewPlayerRequest request) {
        return ResponseEntity.ok(statsService.addPlayer(request.getName()));
    }

    @DeleteMapping("/players/{playerId}")
    public ResponseEntity<Void> deletePlayer(@PathVariable Long playerId) {
        statsService.deletePlayer(playerId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/matches")
    public ResponseEntity<RecentMatch> recordMatch(@RequestBody NewMatchRequest request) {
        TrackerMatch match = statsService.recordMatch(request.getWinnerId(), request.getParticipantIds());
        return ResponseEntity.ok(RecentMatch.from(match));
    }

    @GetMapping("/matches/recent")
    public List<RecentMatch> recentMatches(
            @RequestParam(defaultValue = "" + StatsService.DEFAULT_RECENT_LIMIT) int limit) {
        return statsService.recentMatches(limit);
    }

    @GetMapping("/leaderboard")
    public List<LeaderboardEntry> leaderboard() {
        return statsService.leaderboard();
    }

    @GetMapping("/leaderboard/weekly")
    public WeeklyLeaderboard weeklyLeaderboard() {
        return statsService.weeklyLeaderboard();
    }

    @GetMapping("/win-streaks")
    public List<WinStreak> winStreaks() {
        return statsService.winStreaks();
    }

    @GetMapping("/podium-days")
    public List<PodiumDays> podiumDays() {
        return statsService.podiumDays();
    }

    @GetMapping("/summary")
    public TrackerSummary summary() {
        return statsService.summary();
    }
}
