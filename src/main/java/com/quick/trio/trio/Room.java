package com.quick.trio.trio;

import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Authoritative state of one game. Mutated only from the room's mailbox; the
 * fields read by the REST listing (phase, seats, turn) are safely published.
 */
@Getter
public class Room {

    private final String id;
    private final String name;
    private final int minPlayers;
    private final int maxPlayers;
    private final Instant createdAt = Instant.now();

    private volatile GameMode mode;
    private volatile RoomPhase phase = RoomPhase.WAITING;

    // join order, used for public views
    private final List<Player> players = new CopyOnWriteArrayList<>();
    // turn rotation, fixed at start
    private volatile List<String> seating = List.of();
    private volatile int currentTurnIndex;

    private final List<MiddleSlot> middle = new ArrayList<>();
    private final List<RevealEntry> reveals = new ArrayList<>();
    private boolean awaitingReturn;

    private volatile String winnerId;
    private volatile String winReason;

    public Room(String id, String name, GameMode mode, int minPlayers, int maxPlayers) {
        this.id = id;
        this.name = name;
        this.mode = mode;
        this.minPlayers = minPlayers;
        this.maxPlayers = maxPlayers;
    }

    public List<Player> getPlayers() {
        return Collections.unmodifiableList(players);
    }

    public List<MiddleSlot> getMiddle() {
        return Collections.unmodifiableList(middle);
    }

    public List<RevealEntry> getReveals() {
        return Collections.unmodifiableList(reveals);
    }

    public int playerCount() {
        return players.size();
    }

    public boolean isEmpty() {
        return players.isEmpty();
    }

    public boolean isFull() {
        return players.size() >= maxPlayers;
    }

    public boolean isOpen() {
        return phase == RoomPhase.WAITING && !isFull();
    }

    public Optional<Player> findPlayer(String playerId) {
        if (playerId == null) {
            return Optional.empty();
        }
        return players.stream().filter(p -> p.getId().equals(playerId)).findFirst();
    }

    public Optional<Player> findPlayerBySession(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        return players.stream().filter(p -> sessionId.equals(p.getSessionId())).findFirst();
    }

    Player requirePlayer(String playerId) {
        return findPlayer(playerId)
                .orElseThrow(() -> GameActionException.target("Player not found"));
    }

    public String currentPlayerId() {
        List<String> order = seating;
        if (phase != RoomPhase.PLAYING || order.isEmpty()) {
            return null;
        }
        return order.get(currentTurnIndex % order.size());
    }

    public Optional<Player> currentPlayer() {
        return findPlayer(currentPlayerId());
    }

    public Optional<MiddleSlot> findSlot(int cardId) {
        return middle.stream().filter(slot -> slot.getCard().id() == cardId).findFirst();
    }

    MiddleSlot middleSlot(int cardId) {
        return findSlot(cardId)
                .orElseThrow(() -> new IllegalStateException("Card " + cardId + " is not in the middle of " + id));
    }

    public int faceDownCount() {
        return (int) middle.stream().filter(MiddleSlot::isFaceDown).count();
    }

    /**
     * Cards still in the middle pile (face-down or face-up, not taken).
     */
    public int middleRemaining() {
        return (int) middle.stream().filter(slot -> slot.getState() != SlotState.TAKEN).count();
    }

    void setMode(GameMode mode) {
        this.mode = mode;
    }

    Player seat(String playerId, String playerName, String sessionId) {
        if (isFull()) {
            throw GameActionException.capacity("Room is full");
        }
        if (phase != RoomPhase.WAITING) {
            throw GameActionException.phase("Game already in progress");
        }
        Player player = new Player(playerId, playerName, sessionId);
        players.add(player);
        return player;
    }

    boolean unseat(String playerId) {
        if (phase != RoomPhase.WAITING) {
            throw new IllegalStateException("Seats are fixed once the game has started");
        }
        return players.removeIf(p -> p.getId().equals(playerId));
    }

    /**
     * Freezes the rotation, hands out the dealt cards and lays out the middle.
     */
    void begin(List<String> turnOrder, Map<String, List<Card>> hands, List<Card> middleCards) {
        for (Map.Entry<String, List<Card>> entry : hands.entrySet()) {
            requirePlayer(entry.getKey()).receive(entry.getValue());
        }
        middle.clear();
        for (Card card : middleCards) {
            middle.add(new MiddleSlot(card));
        }
        reveals.clear();
        awaitingReturn = false;
        seating = List.copyOf(turnOrder);
        currentTurnIndex = 0;
        phase = RoomPhase.PLAYING;
    }

    void addReveal(RevealEntry entry) {
        reveals.add(entry);
    }

    List<Integer> revealedNumbers() {
        List<Integer> numbers = new ArrayList<>(reveals.size());
        for (RevealEntry entry : reveals) {
            numbers.add(entry.card().number());
        }
        return numbers;
    }

    List<RevealEntry> lastReveals(int count) {
        return new ArrayList<>(reveals.subList(reveals.size() - count, reveals.size()));
    }

    void clearReveals() {
        reveals.clear();
    }

    void setAwaitingReturn(boolean awaitingReturn) {
        this.awaitingReturn = awaitingReturn;
    }

    void advanceTurn() {
        currentTurnIndex = (currentTurnIndex + 1) % seating.size();
    }

    void finish(String winnerId, String winReason) {
        this.winnerId = winnerId;
        this.winReason = winReason;
        this.phase = RoomPhase.FINISHED;
    }
}
