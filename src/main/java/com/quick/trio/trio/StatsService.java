package com.quick.trio.trio;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Player registry, match history and the numbers derived from them.
 */
@Service
public class StatsService {

    private static final Logger log = LoggerFactory.getLogger(StatsService.class);
    private static final DateTimeFormatter WEEK_DAY = DateTimeFormatter.ofPattern("dd/MM");
    private static final int PODIUM_SIZE = 3;
    static final int DEFAULT_RECENT_LIMIT = 10;

    private static final Comparator<LeaderboardEntry> RANKING = Comparator
            .comparingInt(LeaderboardEntry::wins).reversed()
            .thenComparing(Comparator.comparingDouble(LeaderboardEntry::winRate).reversed())
            .thenComparing(LeaderboardEntry::name);

    private final TrackerPlayerRepository playerRepository;
    private final TrackerMatchRepository matchRepository;
    private final Clock clock;

    public StatsService(TrackerPlayerRepository playerRepository,
                        TrackerMatchRepository matchRepository,
                        Clock clock) {
        this.playerRepository = playerRepository;
        this.matchRepository = matchRepository;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public List<TrackerPlayer> players() {
        return playerRepository.findAllByOrderByNameAsc();
    }

    @Transactional
    public TrackerPlayer addPlayer(String name) {
        String trimmed = name == null ? "" : name.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Player name required");
        }
        if (playerRepository.existsByName(trimmed)) {
            throw new IllegalStateException("Player already exists");
        }
        TrackerPlayer player = new TrackerPlayer();
        player.setName(trimmed);
        player.setCreatedAt(Instant.now(clock));
        TrackerPlayer saved = playerRepository.save(player);
        log.info("tracker player={} '{}' added", saved.getId(), saved.getName());
        return saved;
    }

    @Transactional
    public void deletePlayer(Long playerId) {
        TrackerPlayer player = playerRepository.findById(playerId)
                .orElseThrow(() -> new PlayerNotFoundException(playerId));
        if (matchRepository.existsByParticipants_Id(playerId)) {
            throw new IllegalStateException("Player has recorded matches");
        }
        playerRepository.delete(player);
        log.info("tracker player={} deleted", playerId);
    }

    @Transactional
    public TrackerMatch recordMatch(Long winnerId, List<Long> participantIds) {
        return recordMatch(winnerId, participantIds, LocalDateTime.now(clock));
    }

    @Transactional
    TrackerMatch recordMatch(Long winnerId, List<Long> participantIds, LocalDateTime playedAt) {
        Set<Long> distinct = participantIds == null ? Set.of() : new LinkedHashSet<>(participantIds);
        if (winnerId == null || !distinct.contains(winnerId)) {
            throw new IllegalArgumentException("Winner must be a participant");
        }
        if (distinct.size() < 2) {
            throw new IllegalArgumentException("At least 2 players required");
        }

        List<TrackerPlayer> participants = new ArrayList<>();
        TrackerPlayer winner = null;
        for (Long id : distinct) {
            TrackerPlayer player = playerRepository.findById(id)
                    .orElseThrow(() -> new PlayerNotFoundException(id));
            participants.add(player);
            if (id.equals(winnerId)) {
                winner = player;
            }
        }

        TrackerMatch match = new TrackerMatch();
        match.setWinner(winner);
        match.setParticipants(participants);
        match.setPlayedAt(playedAt);
        TrackerMatch saved = matchRepository.save(match);
        log.info("tracker match={} winner={} participants={}", saved.getId(), winnerId, distinct);
        return saved;
    }

    @Transactional(readOnly = true)
    public List<LeaderboardEntry> leaderboard() {
        return rank(playerRepository.findAll(), matchRepository.findAll(), false);
    }

    @Transactional(readOnly = true)
    public WeeklyLeaderboard weeklyLeaderboard() {
        LocalDate monday = LocalDate.now(clock).with(DayOfWeek.MONDAY);
        LocalDate friday = monday.plusDays(4);
        LocalDateTime from = monday.atStartOfDay();
        LocalDateTime to = friday.atTime(LocalTime.of(23, 59, 59));

        List<TrackerMatch> inWeek = matchRepository.findAll().stream()
                .filter(m -> !m.getPlayedAt().isBefore(from) && !m.getPlayedAt().isAfter(to))
                .toList();
        return new WeeklyLeaderboard(rank(playerRepository.findAll(), inWeek, true),
                monday.format(WEEK_DAY), friday.format(WEEK_DAY));
    }

    @Transactional(readOnly = true)
    public List<RecentMatch> recentMatches(int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive");
        }
        return matchRepository.findAllByOrderByPlayedAtDescIdDesc(PageRequest.of(0, limit)).stream()
                .map(RecentMatch::from)
                .toList();
    }

    /**
     * The streak of whoever won the latest match, if it is at least two long.
     */
    @Transactional(readOnly = true)
    public List<WinStreak> winStreaks() {
        List<TrackerMatch> newestFirst = matchRepository.findAllByOrderByPlayedAtDescIdDesc();
        if (newestFirst.isEmpty()) {
            return List.of();
        }
        TrackerPlayer holder = newestFirst.get(0).getWinner();
        int streak = 0;
        for (TrackerMatch match : newestFirst) {
            if (!match.getWinner().getId().equals(holder.getId())) {
                break;
            }
            streak++;
        }
        if (streak < 2) {
            return List.of();
        }
        return List.of(new WinStreak(holder.getId(), holder.getName(), streak));
    }

    /**
     * Replays the cumulative leaderboard at the end of every match day and
     * records, per player, the best top-three position reached and for how many
     * days it was held.
     */
    @Transactional(readOnly = true)
    public List<PodiumDays> podiumDays() {
        List<TrackerPlayer> players = playerRepository.findAll();
        List<TrackerMatch> matches = matchRepository.findAll();
        TreeSet<LocalDate> matchDays = new TreeSet<>();
        for (TrackerMatch match : matches) {
            matchDays.add(match.getPlayedAt().toLocalDate());
        }

        Map<Long, PodiumDays> podium = new LinkedHashMap<>();
        for (LocalDate day : matchDays) {
            List<TrackerMatch> upToDay = matches.stream()
                    .filter(m -> !m.getPlayedAt().toLocalDate().isAfter(day))
                    .toList();
            List<LeaderboardEntry> board = rank(players, upToDay, true);
            for (int i = 0; i < Math.min(PODIUM_SIZE, board.size()); i++) {
                int position = i + 1;
                LeaderboardEntry entry = board.get(i);
                PodiumDays current = podium.get(entry.id());
                if (current == null || position < current.bestPosition()) {
                    podium.put(entry.id(), new PodiumDays(entry.name(), position, 1));
                } else if (position == current.bestPosition()) {
                    podium.put(entry.id(), new PodiumDays(entry.name(), position, current.days() + 1));
                }
            }
        }

        return podium.values().stream()
                .sorted(Comparator.comparingInt(PodiumDays::bestPosition)
                        .thenComparing(Comparator.comparingInt(PodiumDays::days).reversed()))
                .toList();
    }

    @Transactional(readOnly = true)
    public TrackerSummary summary() {
        return new TrackerSummary(leaderboard(), weeklyLeaderboard(),
                recentMatches(DEFAULT_RECENT_LIMIT), winStreaks(), podiumDays());
    }

    private List<LeaderboardEntry> rank(Collection<TrackerPlayer> players,
                                        Collection<TrackerMatch> matches,
                                        boolean activeOnly) {
        Map<Long, Integer> wins = new HashMap<>();
        Map<Long, Integer> played = new HashMap<>();
        for (TrackerMatch match : matches) {
            wins.merge(match.getWinner().getId(), 1, Integer::sum);
            for (TrackerPlayer participant : match.getParticipants()) {
                played.merge(participant.getId(), 1, Integer::sum);
            }
        }

        List<LeaderboardEntry> board = new ArrayList<>();
        for (TrackerPlayer player : players) {
            int w = wins.getOrDefault(player.getId(), 0);
            int p = played.getOrDefault(player.getId(), 0);
            if (activeOnly && p == 0) {
                continue;
            }
            board.add(new LeaderboardEntry(player.getId(), player.getName(), w, p, winRate(w, p)));
        }
        board.sort(RANKING);
        return board;
    }

    static double winRate(int wins, int played) {
        if (played == 0) {
            return 0.0;
        }
        return Math.round(wins * 1000.0 / played) / 10.0;
    }
}
