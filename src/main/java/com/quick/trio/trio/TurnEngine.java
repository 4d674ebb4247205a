package com.quick.trio.trio;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

/**
 * Game rules applied to a {@link Room}. Every operation validates first and
 * throws {@link GameActionException} without touching state, then mutates the
 * room and returns the events to deliver, in order.
 * <p>
 * Callers must serialize calls per room.
 */
@Component
public class TurnEngine {

    private static final Logger log = LoggerFactory.getLogger(TurnEngine.class);
    private static final String MIDDLE_LABEL = "Middle";

    private final Random random;

    public TurnEngine() {
        this(new Random());
    }

    TurnEngine(Random random) {
        this.random = random;
    }

    public List<OutboundMessage> setMode(Room room, String actorId, String mode) {
        if (room.getPhase() != RoomPhase.WAITING) {
            throw GameActionException.phase("Mode can only be changed before the game starts");
        }
        room.setMode(GameMode.from(mode));
        log.info("room={} mode={} by={}", room.getId(), room.getMode().value(), actorId);

        return List.of(OutboundMessage.broadcast(TrioEvent.builder()
                .type(EventType.MODE_CHANGED)
                .mode(room.getMode())
                .room(RoomView.from(room))
                .build()));
    }

    /**
     * Shuffles the seating once, deals by the seat-count table and hands the
     * first turn to seat 0.
     */
    public List<OutboundMessage> startGame(Room room, String actorId) {
        if (room.getPhase() != RoomPhase.WAITING) {
            throw GameActionException.phase("Game already started");
        }
        if (room.playerCount() < room.getMinPlayers()) {
            throw GameActionException.capacity("Need at least " + room.getMinPlayers() + " players to start");
        }

        List<String> turnOrder = new ArrayList<>();
        for (Player player : room.getPlayers()) {
            turnOrder.add(player.getId());
        }
        Deck.shuffle(turnOrder, random);

        List<Card> deck = Deck.shuffled(random);
        DealTable deal = DealTable.forSeats(turnOrder.size());
        Map<String, List<Card>> hands = new LinkedHashMap<>();
        int next = 0;
        for (String playerId : turnOrder) {
            hands.put(playerId, new ArrayList<>(deck.subList(next, next + deal.handSize())));
            next += deal.handSize();
        }
        List<Card> middle = new ArrayList<>(deck.subList(next, next + deal.middleSize()));

        room.begin(turnOrder, hands, middle);
        Player first = room.currentPlayer().orElseThrow();
        log.info("room={} started by={} seats={} mode={} first={}",
                room.getId(), actorId, turnOrder.size(), room.getMode().value(), first.getId());

        List<OutboundMessage> out = new ArrayList<>();
        out.add(OutboundMessage.broadcast(TrioEvent.builder()
                .type(EventType.GAME_STARTED)
                .mode(room.getMode())
                .turnOrder(turnOrder.stream().map(id -> room.requirePlayer(id).getName()).toList())
                .currentPlayer(first.getName())
                .currentPlayerId(first.getId())
                .middleCardCount(room.getMiddle().size())
                .room(RoomView.from(room))
                .build()));
        for (Player player : room.getPlayers()) {
            out.add(handUpdate(player));
        }
        // your_turn must precede the first snapshot
        out.add(yourTurn(first, "It's your turn! Reveal cards to find a trio."));
        out.add(gameState(room));
        return out;
    }

    public List<OutboundMessage> revealFromMiddle(Room room, String actorId, int cardId) {
        Player actor = requireTurn(room, actorId);
        MiddleSlot slot = room.findSlot(cardId)
                .orElseThrow(() -> GameActionException.target("Card not found in middle"));
        switch (slot.getState()) {
            case FACE_UP -> throw GameActionException.target("This card is already face up");
            case TAKEN -> throw GameActionException.target("This card was already taken");
            case FACE_DOWN -> {
            }
        }

        slot.flipUp();
        RevealEntry entry = new RevealEntry(slot.getCard(), RevealOrigin.middle(), MIDDLE_LABEL);
        room.addReveal(entry);

        List<OutboundMessage> out = new ArrayList<>();
        out.add(cardRevealed(entry, actor));
        evaluate(room, actor, out);
        return out;
    }

    public List<OutboundMessage> revealFromPlayer(Room room, String actorId, String targetPlayerId, String position) {
        Player actor = requireTurn(room, actorId);
        HandPosition handPosition = HandPosition.parse(position)
                .orElseThrow(() -> GameActionException.target("Must reveal 'lowest' or 'highest'"));
        Player target = room.requirePlayer(targetPlayerId);
        if (target.handSize() == 0) {
            throw GameActionException.target(target.getName() + " has no cards");
        }

        Card card = target.take(handPosition);
        RevealEntry entry = new RevealEntry(card, RevealOrigin.hand(target.getId(), handPosition), target.getName());
        room.addReveal(entry);

        List<OutboundMessage> out = new ArrayList<>();
        out.add(cardRevealed(entry, actor));
        out.add(handUpdate(target));
        evaluate(room, actor, out);
        return out;
    }

    /**
     * Second half of a failed turn, run once the mismatched cards have been on
     * show: every card goes back to its origin and the turn passes on.
     */
    public List<OutboundMessage> returnRevealedCards(Room room) {
        if (!room.isAwaitingReturn()) {
            throw new IllegalStateException("Room " + room.getId() + " has no failed sequence to return");
        }

        Set<String> changedSeats = new LinkedHashSet<>();
        for (RevealEntry entry : room.getReveals()) {
            String seat = entry.origin().restore(room, entry.card());
            if (seat != null) {
                changedSeats.add(seat);
            }
        }
        room.clearReveals();
        room.setAwaitingReturn(false);

        List<OutboundMessage> out = new ArrayList<>();
        for (String seat : changedSeats) {
            out.add(handUpdate(room.requirePlayer(seat)));
        }
        out.add(gameState(room));

        room.advanceTurn();
        Player next = room.currentPlayer().orElseThrow();
        log.info("room={} turn passed to={} index={}", room.getId(), next.getId(), room.getCurrentTurnIndex());

        out.add(OutboundMessage.broadcast(TrioEvent.builder()
                .type(EventType.TURN_CHANGED)
                .currentPlayer(next.getName())
                .currentPlayerId(next.getId())
                .build()));
        out.add(yourTurn(next, "It's your turn! Reveal cards to find a trio."));
        out.add(gameState(room));
        return out;
    }

    public OutboundMessage gameState(Room room) {
        Optional<Player> current = room.currentPlayer();
        return OutboundMessage.broadcast(TrioEvent.builder()
                .type(EventType.GAME_STATE)
                .players(room.getPlayers().stream().map(PlayerView::from).toList())
                .middleCards(room.getMiddle().stream().map(MiddleSlotView::from).toList())
                .middleCardCount(room.faceDownCount())
                .revealedThisTurn(room.getReveals().stream().map(RevealView::from).toList())
                .currentPlayer(current.map(Player::getName).orElse(null))
                .currentPlayerId(current.map(Player::getId).orElse(null))
                .build());
    }

    private Player requireTurn(Room room, String actorId) {
        if (room.getPhase() != RoomPhase.PLAYING) {
            throw GameActionException.phase(room.getPhase() == RoomPhase.FINISHED
                    ? "Game is over"
                    : "Game has not started");
        }
        if (room.isAwaitingReturn()) {
            throw GameActionException.phase("Cards are being returned");
        }
        Player current = room.currentPlayer().orElseThrow();
        if (!current.getId().equals(actorId)) {
            throw GameActionException.turn("It's not your turn!");
        }
        return current;
    }

    private void evaluate(Room room, Player actor, List<OutboundMessage> out) {
        List<Integer> numbers = room.revealedNumbers();
        switch (RevealOutcome.of(numbers)) {
            case UNDECIDED -> out.add(gameState(room));
            case CONTINUE -> {
                int number = numbers.get(numbers.size() - 1);
                out.add(OutboundMessage.broadcast(TrioEvent.builder()
                        .type(EventType.REVEAL_MATCH)
                        .message("Match! (" + number + ") Keep revealing...")
                        .count(numbers.size())
                        .build()));
                out.add(gameState(room));
            }
            case TRIO -> completeTrio(room, actor, out);
            case FAIL -> failTurn(room, actor, out);
        }
    }

    private void completeTrio(Room room, Player actor, List<OutboundMessage> out) {
        List<RevealEntry> captured = room.lastReveals(3);
        Trio trio = new Trio(captured.stream().map(RevealEntry::card).toList());
        actor.addTrio(trio);

        Set<String> changedSeats = new LinkedHashSet<>();
        for (RevealEntry entry : captured) {
            String seat = entry.origin().capture(room, entry.card());
            if (seat != null) {
                changedSeats.add(seat);
            }
        }
        room.clearReveals();
        log.info("room={} trio={} by={} trios={}", room.getId(), trio.number(), actor.getId(), actor.trioCount());

        out.add(OutboundMessage.broadcast(TrioEvent.builder()
                .type(EventType.TRIO_COMPLETE)
                .playerName(actor.getName())
                .playerId(actor.getId())
                .trioNumber(trio.number())
                .message(actor.getName() + " got a trio of " + trio.number() + "s!")
                .build()));
        for (String seat : changedSeats) {
            out.add(handUpdate(room.requirePlayer(seat)));
        }

        Optional<WinConditions.Victory> victory = WinConditions.check(room.getMode(), actor.getTrios());
        if (victory.isPresent()) {
            finishGame(room, actor, victory.get(), out);
            return;
        }

        // a trio keeps the turn
        out.add(gameState(room));
        out.add(yourTurn(actor, "Great trio! Continue your turn - find another!"));
    }

    /**
     * Announces the mismatch while the cards are still showing. The cards stay
     * out until {@link #returnRevealedCards(Room)} runs.
     */
    private void failTurn(Room room, Player actor, List<OutboundMessage> out) {
        room.setAwaitingReturn(true);
        log.info("room={} turn failed by={} revealed={}", room.getId(), actor.getId(), room.revealedNumbers());

        out.add(gameState(room));
        out.add(OutboundMessage.broadcast(TrioEvent.builder()
                .type(EventType.TURN_FAILED)
                .playerName(actor.getName())
                .playerId(actor.getId())
                .message("Different numbers! " + actor.getName() + "'s turn ends.")
                .delayReturn(true)
                .build()));
    }

    private void finishGame(Room room, Player winner, WinConditions.Victory victory, List<OutboundMessage> out) {
        room.finish(winner.getId(), victory.reason());
        log.info("room={} finished winner={} reason={}", room.getId(), winner.getId(), victory.reason());

        out.add(OutboundMessage.broadcast(TrioEvent.builder()
                .type(EventType.GAME_OVER)
                .winner(winner.getName())
                .winnerId(winner.getId())
                .reason(victory.reason())
                .message(winner.getName() + " wins! " + victory.message())
                .finalScores(finalScores(room))
                .build()));
    }

    /**
     * Seats by trio count, highest first; ties keep join order.
     */
    public static List<FinalScore> finalScores(Room room) {
        return room.getPlayers().stream()
                .sorted(Comparator.comparingInt(Player::trioCount).reversed())
                .map(player -> new FinalScore(player.getName(), player.trioCount()))
                .toList();
    }

    private OutboundMessage cardRevealed(RevealEntry entry, Player actor) {
        return OutboundMessage.broadcast(TrioEvent.builder()
                .type(EventType.CARD_REVEALED)
                .card(CardView.from(entry.card(), true))
                .source(entry.sourceLabel())
                .sourceId(entry.origin().sourceId())
                .position(entry.origin().position())
                .revealedBy(actor.getName())
                .build());
    }

    private OutboundMessage handUpdate(Player player) {
        return OutboundMessage.toPlayer(player.getId(), TrioEvent.builder()
                .type(EventType.YOUR_HAND)
                .hand(HandView.from(player))
                .build());
    }

    private OutboundMessage yourTurn(Player player, String message) {
        return OutboundMessage.toPlayer(player.getId(), TrioEvent.builder()
                .type(EventType.YOUR_TURN)
                .message(message)
                .build());
    }
}
