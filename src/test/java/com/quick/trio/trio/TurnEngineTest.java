package com.quick.trio.trio;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static com.quick.trio.trio.EventType.*;
import static org.junit.jupiter.api.Assertions.*;

class TurnEngineTest {

    private final TurnEngine engine = new TurnEngine(new Random(42));

    // --- start ---

    @Test
    void startGame_threeSeats_dealsNineEachAndNineToMiddle() {
        Room room = TestRooms.waiting(3);

        List<OutboundMessage> out = engine.startGame(room, "p1");

        assertEquals(RoomPhase.PLAYING, room.getPhase());
        room.getPlayers().forEach(p -> assertEquals(9, p.handSize()));
        assertEquals(9, room.getMiddle().size());
        assertEquals(9, room.faceDownCount());
        assertEquals(36, TestRooms.cardsAccountedFor(room));
        assertEquals(List.of(GAME_STARTED, YOUR_HAND, YOUR_HAND, YOUR_HAND, YOUR_TURN, GAME_STATE),
                TestRooms.types(out));
        assertEquals(room.currentPlayerId(), out.get(4).recipientId());
        assertEquals(3, out.get(0).event().getTurnOrder().size());
        assertEquals(9, out.get(0).event().getMiddleCardCount());
    }

    @Test
    void startGame_fourSeats_dealsSevenEachAndEightToMiddle() {
        Room room = TestRooms.waiting(4);

        engine.startGame(room, "p1");

        room.getPlayers().forEach(p -> assertEquals(7, p.handSize()));
        assertEquals(8, room.getMiddle().size());
        assertEquals(36, TestRooms.cardsAccountedFor(room));
    }

    @Test
    void startGame_dealsEveryCardExactlyOnce() {
        Room room = TestRooms.waiting(5);
        engine.startGame(room, "p1");

        Set<Integer> ids = new HashSet<>();
        room.getPlayers().forEach(p -> p.getHand().forEach(c -> assertTrue(ids.add(c.id()))));
        room.getMiddle().forEach(slot -> assertTrue(ids.add(slot.getCard().id())));
        assertEquals(36, ids.size());
    }

    @Test
    void startGame_handsAreSorted() {
        Room room = TestRooms.waiting(3);
        engine.startGame(room, "p1");

        for (Player player : room.getPlayers()) {
            List<Integer> numbers = TestRooms.handNumbers(room, player.getId());
            List<Integer> sorted = new ArrayList<>(numbers);
            sorted.sort(null);
            assertEquals(sorted, numbers);
        }
    }

    @Test
    void startGame_shufflesSeating() {
        Set<String> firstSeats = new HashSet<>();
        for (int seed = 0; seed < 40; seed++) {
            Room room = TestRooms.waiting(3);
            new TurnEngine(new Random(seed)).startGame(room, "p1");
            firstSeats.add(room.currentPlayerId());
        }
        assertEquals(3, firstSeats.size());
    }

    @Test
    void startGame_belowMinimum_failsAndStaysWaiting() {
        Room room = TestRooms.waiting(2);

        GameActionException e = assertThrows(GameActionException.class, () -> engine.startGame(room, "p1"));

        assertEquals(GameActionException.Kind.CAPACITY, e.getKind());
        assertEquals("Need at least 3 players to start", e.getMessage());
        assertEquals(RoomPhase.WAITING, room.getPhase());
        assertTrue(room.getPlayers().stream().allMatch(p -> p.handSize() == 0));
    }

    @Test
    void startGame_twice_failsWithPhaseError() {
        Room room = TestRooms.waiting(3);
        engine.startGame(room, "p1");

        GameActionException e = assertThrows(GameActionException.class, () -> engine.startGame(room, "p1"));
        assertEquals(GameActionException.Kind.PHASE, e.getKind());
    }

    // --- mode ---

    @Test
    void setMode_whileWaiting_broadcastsChange() {
        Room room = TestRooms.waiting(3);

        List<OutboundMessage> out = engine.setMode(room, "p1", "spicy");

        assertEquals(GameMode.SPICY, room.getMode());
        assertEquals(List.of(MODE_CHANGED), TestRooms.types(out));
        assertFalse(out.get(0).isPrivate());
        assertEquals(GameMode.SPICY, out.get(0).event().getMode());
    }

    @Test
    void setMode_unknownValue_fallsBackToSimple() {
        Room room = TestRooms.waiting(3);
        engine.setMode(room, "p1", "spicy");

        engine.setMode(room, "p1", "extra-hot");

        assertEquals(GameMode.SIMPLE, room.getMode());
    }

    @Test
    void setMode_whilePlaying_failsWithPhaseError() {
        Room room = threeSeats(List.of(1), List.of(2), List.of(3), List.of(4));

        GameActionException e = assertThrows(GameActionException.class, () -> engine.setMode(room, "p1", "spicy"));
        assertEquals(GameActionException.Kind.PHASE, e.getKind());
        assertEquals(GameMode.SIMPLE, room.getMode());
    }

    // --- reveal preconditions ---

    @Test
    void reveal_beforeStart_failsWithPhaseError() {
        Room room = TestRooms.waiting(3);

        GameActionException e = assertThrows(GameActionException.class,
                () -> engine.revealFromMiddle(room, "p1", 0));
        assertEquals(GameActionException.Kind.PHASE, e.getKind());
    }

    @Test
    void reveal_notYourTurn_failsWithoutChange() {
        Room room = threeSeats(List.of(1), List.of(2), List.of(3), List.of(4, 5));

        GameActionException e = assertThrows(GameActionException.class,
                () -> engine.revealFromMiddle(room, "p2", TestRooms.middleCard(room, 0)));

        assertEquals(GameActionException.Kind.TURN, e.getKind());
        assertEquals("It's not your turn!", e.getMessage());
        assertEquals(2, room.faceDownCount());
        assertTrue(room.getReveals().isEmpty());
    }

    @Test
    void revealFromMiddle_unknownCard_failsWithTargetError() {
        Room room = threeSeats(List.of(1), List.of(2), List.of(3), List.of(4));

        GameActionException e = assertThrows(GameActionException.class,
                () -> engine.revealFromMiddle(room, "p1", 999));
        assertEquals(GameActionException.Kind.TARGET, e.getKind());
        assertEquals("Card not found in middle", e.getMessage());
    }

    @Test
    void revealFromMiddle_faceUpCard_failsWithTargetError() {
        Room room = threeSeats(List.of(1), List.of(2), List.of(3), List.of(4, 5));
        int cardId = TestRooms.middleCard(room, 0);
        engine.revealFromMiddle(room, "p1", cardId);

        GameActionException e = assertThrows(GameActionException.class,
                () -> engine.revealFromMiddle(room, "p1", cardId));

        assertEquals("This card is already face up", e.getMessage());
        assertEquals(1, room.getReveals().size());
    }

    @Test
    void revealFromMiddle_takenCard_failsWithTargetError() {
        Room room = threeSeats(List.of(1), List.of(2), List.of(3), List.of(9, 9, 9, 4));
        revealMiddle(room, "p1", 0, 1, 2);

        GameActionException e = assertThrows(GameActionException.class,
                () -> engine.revealFromMiddle(room, "p1", TestRooms.middleCard(room, 0)));

        assertEquals(GameActionException.Kind.TARGET, e.getKind());
        assertEquals(SlotState.TAKEN, room.getMiddle().get(0).getState());
    }

    @Test
    void revealFromPlayer_invalidPosition_failsWithTargetError() {
        Room room = threeSeats(List.of(1), List.of(2), List.of(3), List.of(4));

        GameActionException e = assertThrows(GameActionException.class,
                () -> engine.revealFromPlayer(room, "p1", "p2", "middle"));

        assertEquals("Must reveal 'lowest' or 'highest'", e.getMessage());
        assertEquals(1, room.findPlayer("p2").orElseThrow().handSize());
    }

    @Test
    void revealFromPlayer_unknownPlayer_failsWithTargetError() {
        Room room = threeSeats(List.of(1), List.of(2), List.of(3), List.of(4));

        GameActionException e = assertThrows(GameActionException.class,
                () -> engine.revealFromPlayer(room, "p1", "nobody", "lowest"));

        assertEquals(GameActionException.Kind.TARGET, e.getKind());
        assertEquals("Player not found", e.getMessage());
    }

    @Test
    void revealFromPlayer_emptyHand_failsWithTargetError() {
        Room room = threeSeats(List.of(1), List.of(2), List.of(), List.of(4));

        GameActionException e = assertThrows(GameActionException.class,
                () -> engine.revealFromPlayer(room, "p1", "p3", "highest"));

        assertEquals("Cara has no cards", e.getMessage());
    }

    // --- outcomes ---

    @Test
    void firstReveal_isUndecided() {
        Room room = threeSeats(List.of(1), List.of(2), List.of(3), List.of(4, 5));

        List<OutboundMessage> out = engine.revealFromMiddle(room, "p1", TestRooms.middleCard(room, 0));

        assertEquals(List.of(CARD_REVEALED, GAME_STATE), TestRooms.types(out));
        TrioEvent revealed = out.get(0).event();
        assertEquals(4, revealed.getCard().getNumber());
        assertEquals("Middle", revealed.getSource());
        assertNull(revealed.getSourceId());
        assertEquals("Alice", revealed.getRevealedBy());
        assertEquals(SlotState.FACE_UP, room.getMiddle().get(0).getState());
    }

    @Test
    void matchingPair_continuesTurn() {
        Room room = threeSeats(List.of(1), List.of(3, 8), List.of(5), List.of(3, 6));
        engine.revealFromMiddle(room, "p1", TestRooms.middleCard(room, 0));

        List<OutboundMessage> out = engine.revealFromPlayer(room, "p1", "p2", "lowest");

        assertEquals(List.of(CARD_REVEALED, YOUR_HAND, REVEAL_MATCH, GAME_STATE), TestRooms.types(out));
        assertEquals("p2", out.get(1).recipientId());
        assertEquals(2, out.get(2).event().getCount());
        assertEquals("Match! (3) Keep revealing...", out.get(2).event().getMessage());
        assertEquals("p1", room.currentPlayerId());
        assertEquals(2, room.getReveals().size());
    }

    @Test
    void mismatch_holdsCardsUntilReturned() {
        Room room = threeSeats(List.of(1, 2), List.of(4, 8), List.of(10, 11), List.of(4, 6, 9));
        engine.revealFromPlayer(room, "p1", "p2", "highest");

        List<OutboundMessage> out = engine.revealFromMiddle(room, "p1", TestRooms.middleCard(room, 0));

        assertEquals(List.of(CARD_REVEALED, GAME_STATE, TURN_FAILED), TestRooms.types(out));
        assertEquals(Boolean.TRUE, out.get(2).event().getDelayReturn());
        assertTrue(room.isAwaitingReturn());
        // still on show
        assertEquals(List.of(4), TestRooms.handNumbers(room, "p2"));
        assertEquals(SlotState.FACE_UP, room.getMiddle().get(0).getState());
        assertEquals(2, out.get(1).event().getRevealedThisTurn().size());
    }

    @Test
    void reveal_whileCardsAreOut_failsWithPhaseError() {
        Room room = threeSeats(List.of(1, 2), List.of(4, 8), List.of(10, 11), List.of(4, 6, 9));
        revealMiddle(room, "p1", 1, 2);

        GameActionException e = assertThrows(GameActionException.class,
                () -> engine.revealFromMiddle(room, "p1", TestRooms.middleCard(room, 0)));
        assertEquals(GameActionException.Kind.PHASE, e.getKind());
    }

    @Test
    void returnRevealedCards_restoresOriginsAndPassesTurn() {
        Room room = threeSeats(List.of(1, 2), List.of(4, 8), List.of(10, 11), List.of(4, 6, 9));
        engine.revealFromPlayer(room, "p1", "p2", "highest");
        engine.revealFromMiddle(room, "p1", TestRooms.middleCard(room, 0));

        List<OutboundMessage> out = engine.returnRevealedCards(room);

        assertEquals(List.of(YOUR_HAND, GAME_STATE, TURN_CHANGED, YOUR_TURN, GAME_STATE), TestRooms.types(out));
        assertEquals("p2", out.get(0).recipientId());
        assertEquals("p2", out.get(3).recipientId());
        assertEquals("Bob", out.get(2).event().getCurrentPlayer());
        assertEquals(List.of(4, 8), TestRooms.handNumbers(room, "p2"));
        assertEquals(SlotState.FACE_DOWN, room.getMiddle().get(0).getState());
        assertEquals(3, room.faceDownCount());
        assertTrue(room.getReveals().isEmpty());
        assertFalse(room.isAwaitingReturn());
        assertEquals("p2", room.currentPlayerId());
    }

    @Test
    void returnRevealedCards_lastSeatWrapsToFirst() {
        Room room = threeSeats(List.of(1), List.of(2), List.of(3), List.of(5, 6, 7, 8));
        for (String seat : List.of("p1", "p2", "p3")) {
            int index = room.getCurrentTurnIndex();
            engine.revealFromMiddle(room, seat, TestRooms.middleCard(room, index));
            engine.revealFromMiddle(room, seat, TestRooms.middleCard(room, index + 1));
            engine.returnRevealedCards(room);
        }
        assertEquals("p1", room.currentPlayerId());
    }

    @Test
    void returnRevealedCards_withoutFailure_isIllegal() {
        Room room = threeSeats(List.of(1), List.of(2), List.of(3), List.of(4));
        assertThrows(IllegalStateException.class, () -> engine.returnRevealedCards(room));
    }

    @Test
    void pairThenMismatch_failsOnThirdReveal() {
        Room room = threeSeats(List.of(1), List.of(2), List.of(3), List.of(3, 3, 5));
        revealMiddle(room, "p1", 0, 1);

        List<OutboundMessage> out = engine.revealFromMiddle(room, "p1", TestRooms.middleCard(room, 2));

        assertEquals(TURN_FAILED, out.get(out.size() - 1).event().getType());
        engine.returnRevealedCards(room);
        assertEquals(3, room.faceDownCount());
    }

    @Test
    void trioFromHands_capturesCardsAndKeepsTurn() {
        Room room = threeSeats(List.of(1, 2), List.of(5, 5, 9), List.of(5, 10), List.of(3));
        engine.revealFromPlayer(room, "p1", "p2", "lowest");
        engine.revealFromPlayer(room, "p1", "p2", "lowest");

        List<OutboundMessage> out = engine.revealFromPlayer(room, "p1", "p3", "lowest");

        assertEquals(List.of(CARD_REVEALED, YOUR_HAND, TRIO_COMPLETE, YOUR_HAND, YOUR_HAND, GAME_STATE, YOUR_TURN),
                TestRooms.types(out));
        assertEquals("p2", out.get(3).recipientId());
        assertEquals("p3", out.get(4).recipientId());
        assertEquals("p1", out.get(6).recipientId());
        assertEquals(5, out.get(2).event().getTrioNumber());

        Player alice = room.findPlayer("p1").orElseThrow();
        assertEquals(1, alice.trioCount());
        assertEquals(List.of(9), TestRooms.handNumbers(room, "p2"));
        assertEquals(List.of(10), TestRooms.handNumbers(room, "p3"));
        assertTrue(room.getReveals().isEmpty());
        assertEquals("p1", room.currentPlayerId());
        // 8 cards dealt in this layout
        assertEquals(8, TestRooms.cardsAccountedFor(room));
    }

    @Test
    void trioFromMiddle_marksSlotsTaken() {
        Room room = threeSeats(List.of(1), List.of(2), List.of(3), List.of(9, 4, 9, 9));
        revealMiddle(room, "p1", 0, 2, 3);

        assertEquals(SlotState.TAKEN, room.getMiddle().get(0).getState());
        assertEquals(SlotState.FACE_DOWN, room.getMiddle().get(1).getState());
        assertEquals(SlotState.TAKEN, room.getMiddle().get(2).getState());
        assertEquals(SlotState.TAKEN, room.getMiddle().get(3).getState());
        assertEquals(1, room.faceDownCount());
        assertEquals(1, room.middleRemaining());
        assertEquals(4, room.getMiddle().size());
    }

    @Test
    void sevenTrio_endsGameImmediately() {
        Room room = threeSeats(List.of(1), List.of(2), List.of(3), List.of(7, 7, 7, 4));
        revealMiddle(room, "p1", 0, 1);

        List<OutboundMessage> out = engine.revealFromMiddle(room, "p1", TestRooms.middleCard(room, 2));

        assertEquals(List.of(CARD_REVEALED, TRIO_COMPLETE, GAME_OVER), TestRooms.types(out));
        TrioEvent gameOver = out.get(2).event();
        assertEquals("Alice", gameOver.getWinner());
        assertEquals("p1", gameOver.getWinnerId());
        assertEquals("7-trio", gameOver.getReason());
        assertEquals(new FinalScore("Alice", 1), gameOver.getFinalScores().get(0));
        assertEquals(3, gameOver.getFinalScores().size());
        assertEquals(RoomPhase.FINISHED, room.getPhase());
        assertEquals("p1", room.getWinnerId());
        assertEquals("7-trio", room.getWinReason());
    }

    @Test
    void reveal_afterGameOver_failsWithPhaseError() {
        Room room = threeSeats(List.of(1), List.of(2), List.of(3), List.of(7, 7, 7, 4));
        revealMiddle(room, "p1", 0, 1, 2);

        GameActionException e = assertThrows(GameActionException.class,
                () -> engine.revealFromMiddle(room, "p1", TestRooms.middleCard(room, 3)));
        assertEquals(GameActionException.Kind.PHASE, e.getKind());
    }

    @Test
    void simpleMode_thirdTrioWins() {
        Room room = threeSeats(List.of(1), List.of(2), List.of(3), List.of(1, 1, 1, 2, 2, 2, 3, 3, 3));
        revealMiddle(room, "p1", 0, 1, 2, 3, 4, 5);
        assertEquals(RoomPhase.PLAYING, room.getPhase());

        revealMiddle(room, "p1", 6, 7, 8);

        assertEquals(RoomPhase.FINISHED, room.getPhase());
        assertEquals("3 trios", room.getWinReason());
    }

    @Test
    void spicyMode_connectedSecondTrioWins() {
        Room room = TestRooms.playing(GameMode.SPICY,
                List.of(List.of(1), List.of(2), List.of(3)), List.of(4, 4, 4, 6, 6, 6));
        revealMiddle(room, "p1", 0, 1, 2);
        assertEquals(RoomPhase.PLAYING, room.getPhase());

        revealMiddle(room, "p1", 3, 4, 5);

        assertEquals(RoomPhase.FINISHED, room.getPhase());
        assertEquals("connected trios (4,6)", room.getWinReason());
    }

    @Test
    void spicyMode_unconnectedTriosPlayOn() {
        Room room = TestRooms.playing(GameMode.SPICY,
                List.of(List.of(1), List.of(2), List.of(3)), List.of(4, 4, 4, 11, 11, 11));
        revealMiddle(room, "p1", 0, 1, 2, 3, 4, 5);

        assertEquals(RoomPhase.PLAYING, room.getPhase());
        assertEquals(2, room.findPlayer("p1").orElseThrow().trioCount());
    }

    @Test
    void finalScores_sortedByTriosThenJoinOrder() {
        Room room = threeSeats(List.of(1), List.of(2), List.of(3), List.of(5, 5, 5, 6));
        revealMiddle(room, "p1", 0, 1, 2);

        List<FinalScore> scores = TurnEngine.finalScores(room);

        assertEquals(List.of(new FinalScore("Alice", 1), new FinalScore("Bob", 0), new FinalScore("Cara", 0)), scores);
    }

    // --- whole games ---

    @Test
    void randomPlay_neverLosesACard() {
        for (int seats = 3; seats <= 6; seats++) {
            for (int seed = 0; seed < 15; seed++) {
                playRandomGame(seats, seed);
            }
        }
    }

    private void playRandomGame(int seats, long seed) {
        Random choices = new Random(seed);
        TurnEngine seeded = new TurnEngine(new Random(seed));
        Room room = TestRooms.waiting(seats);
        seeded.startGame(room, "p1");

        for (int step = 0; step < 2_000 && room.getPhase() == RoomPhase.PLAYING; step++) {
            if (room.isAwaitingReturn()) {
                seeded.returnRevealedCards(room);
            } else {
                String actor = room.currentPlayerId();
                List<Runnable> moves = new ArrayList<>();
                for (MiddleSlot slot : room.getMiddle()) {
                    if (slot.isFaceDown()) {
                        moves.add(() -> seeded.revealFromMiddle(room, actor, slot.getCard().id()));
                    }
                }
                for (Player target : room.getPlayers()) {
                    if (target.handSize() > 0) {
                        moves.add(() -> seeded.revealFromPlayer(room, actor, target.getId(), "lowest"));
                        moves.add(() -> seeded.revealFromPlayer(room, actor, target.getId(), "highest"));
                    }
                }
                if (moves.isEmpty()) {
                    break;
                }
                moves.get(choices.nextInt(moves.size())).run();
            }
            if (room.getReveals().isEmpty()) {
                assertEquals(36, TestRooms.cardsAccountedFor(room),
                        "seats=" + seats + " seed=" + seed + " step=" + step);
            }
        }
    }

    private Room threeSeats(List<Integer> p1, List<Integer> p2, List<Integer> p3, List<Integer> middle) {
        return TestRooms.playing(GameMode.SIMPLE, List.of(p1, p2, p3), middle);
    }

    private void revealMiddle(Room room, String actor, int... indexes) {
        for (int index : indexes) {
            engine.revealFromMiddle(room, actor, TestRooms.middleCard(room, index));
        }
    }
}
