package com.quick.trio.trio;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Win check run after every captured trio, scoped to the capturing seat.
 */
public final class WinConditions {

    public static final int LUCKY_NUMBER = 7;
    public static final int SIMPLE_TRIOS_TO_WIN = 3;
    public static final int SPICY_TRIOS_TO_WIN = 2;

    // neighbours within distance 2, truncated at 1 and 12
    static final Map<Integer, Set<Integer>> CONNECTIONS = Map.ofEntries(
            Map.entry(1, Set.of(2, 3)),
            Map.entry(2, Set.of(1, 3, 4)),
            Map.entry(3, Set.of(1, 2, 4, 5)),
            Map.entry(4, Set.of(2, 3, 5, 6)),
            Map.entry(5, Set.of(3, 4, 6, 7)),
            Map.entry(6, Set.of(4, 5, 7, 8)),
            Map.entry(7, Set.of(5, 6, 8, 9)),
            Map.entry(8, Set.of(6, 7, 9, 10)),
            Map.entry(9, Set.of(7, 8, 10, 11)),
            Map.entry(10, Set.of(8, 9, 11, 12)),
            Map.entry(11, Set.of(9, 10, 12)),
            Map.entry(12, Set.of(10, 11))
    );

    /**
     * @param reason  machine-readable reason stored on the room
     * @param message text shown to the players
     */
    public record Victory(String reason, String message) {
    }

    private WinConditions() {
    }

    public static boolean connected(int a, int b) {
        return CONNECTIONS.getOrDefault(a, Set.of()).contains(b);
    }

    public static Optional<Victory> check(GameMode mode, List<Trio> trios) {
        for (Trio trio : trios) {
            if (trio.number() == LUCKY_NUMBER) {
                return Optional.of(new Victory("7-trio", "Got the legendary 7-7-7 trio!"));
            }
        }

        if (mode == GameMode.SIMPLE) {
            if (trios.size() >= SIMPLE_TRIOS_TO_WIN) {
                return Optional.of(new Victory("3 trios", "Collected 3 trios!"));
            }
            return Optional.empty();
        }

        if (trios.size() < SPICY_TRIOS_TO_WIN) {
            return Optional.empty();
        }
        for (int i = 0; i < trios.size(); i++) {
            int first = trios.get(i).number();
            for (int j = i + 1; j < trios.size(); j++) {
                int second = trios.get(j).number();
                if (connected(first, second)) {
                    return Optional.of(new Victory(
                            "connected trios (" + first + "," + second + ")",
                            "Got 2 connected trios (" + first + " and " + second + ")!"));
                }
            }
        }
        return Optional.empty();
    }
}
