package com.quick.trio.trio;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.messaging.MessagingException;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Registry of live rooms and of which STOMP session sits where. Every change
 * to a room runs on that room's {@link RoomMailbox}; events produced by the
 * {@link TurnEngine} are fanned out seat by seat through {@link SeatMessenger}.
 */
@Service
public class RoomManager {

    private static final Logger log = LoggerFactory.getLogger(RoomManager.class);

    private static final String ROOM_CODE_ALPHABET = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789";
    private static final int ROOM_CODE_LENGTH = 5;
    private static final String PLAYER_ID_ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";
    private static final int PLAYER_ID_LENGTH = 8;

    static final String DEFAULT_ROOM_NAME = "Trio Room";
    static final String DEFAULT_PLAYER_NAME = "Player";

    private final Map<String, ManagedRoom> rooms = new ConcurrentHashMap<>();
    private final Map<String, SeatRef> sessions = new ConcurrentHashMap<>();
    private final Random random = new SecureRandom();

    private final TurnEngine engine;
    private final SeatMessenger messenger;
    private final GameArchiveService archive;
    private final ScheduledExecutorService scheduler;
    private final int minPlayers;
    private final int maxPlayers;
    private final long failRevealDelayMs;

    public RoomManager(TurnEngine engine,
                       SeatMessenger messenger,
                       GameArchiveService archive,
                       @Qualifier("trioRoomScheduler") ScheduledExecutorService scheduler,
                       @Value("${trio.room.min-players:3}") int minPlayers,
                       @Value("${trio.room.max-players:6}") int maxPlayers,
                       @Value("${trio.turn.fail-reveal-delay-ms:2500}") long failRevealDelayMs) {
        if (minPlayers < DealTable.MIN_SEATS || maxPlayers > DealTable.MAX_SEATS || maxPlayers < minPlayers) {
            throw new IllegalArgumentException("Invalid seat bounds: min=" + minPlayers + " max=" + maxPlayers
                    + ", both must lie in " + DealTable.MIN_SEATS + ".." + DealTable.MAX_SEATS);
        }
        this.engine = engine;
        this.messenger = messenger;
        this.archive = archive;
        this.scheduler = scheduler;
        this.minPlayers = minPlayers;
        this.maxPlayers = maxPlayers;
        this.failRevealDelayMs = failRevealDelayMs;
    }

    public Room createRoom(String name, String mode) {
        String roomName = name == null || name.isBlank() ? DEFAULT_ROOM_NAME : name.trim();
        String code;
        ManagedRoom managed;
        do {
            code = generateCode(ROOM_CODE_ALPHABET, ROOM_CODE_LENGTH);
            Room room = new Room(code, roomName, GameMode.from(mode), minPlayers, maxPlayers);
            managed = new ManagedRoom(room, new RoomMailbox(code, scheduler));
        } while (rooms.putIfAbsent(code, managed) != null);

        log.info("room={} created name='{}' mode={}", code, roomName, managed.room().getMode().value());
        return managed.room();
    }

    /**
     * Rooms still accepting players, oldest first.
     */
    public List<Room> listOpenRooms() {
        return rooms.values().stream()
                .map(ManagedRoom::room)
                .filter(Room::isOpen)
                .sorted(Comparator.comparing(Room::getCreatedAt))
                .toList();
    }

    public Optional<Room> findRoom(String roomCode) {
        if (roomCode == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(rooms.get(roomCode)).map(ManagedRoom::room);
    }

    public Optional<String> playerIdFor(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId)).map(SeatRef::playerId);
    }

    /**
     * The session is bound to the room before the seat task is queued, so a
     * leave for it always lands in the same mailbox behind the join.
     */
    public void join(String sessionId, String roomCode, String playerName) {
        if (sessions.containsKey(sessionId)) {
            sendDirect(sessionId, TrioEvent.error("Already seated in a room"));
            return;
        }
        ManagedRoom managed = roomCode == null ? null : rooms.get(roomCode);
        if (managed == null) {
            sendDirect(sessionId, TrioEvent.error("Room not found"));
            return;
        }
        if (sessions.putIfAbsent(sessionId, SeatRef.pending(roomCode)) != null) {
            sendDirect(sessionId, TrioEvent.error("Already seated in a room"));
            return;
        }
        String name = playerName == null || playerName.isBlank() ? DEFAULT_PLAYER_NAME : playerName.trim();
        managed.mailbox().submit(() -> seat(managed, sessionId, name));
    }

    /**
     * Connection gone. Before the game starts the seat is dropped; afterwards it
     * is kept and only marked disconnected.
     */
    public void leave(String sessionId) {
        SeatRef ref = sessions.remove(sessionId);
        if (ref == null) {
            return;
        }
        ManagedRoom managed = rooms.get(ref.roomCode());
        if (managed == null) {
            return;
        }
        managed.mailbox().submit(() -> unseat(managed, sessionId));
    }

    public void dispatch(String sessionId, String roomCode, ActionMessage message) {
        SeatRef ref = sessions.get(sessionId);
        if (ref == null || ref.isPending() || !ref.roomCode().equals(roomCode)) {
            log.debug("ignoring action from session={} not seated in room={}", sessionId, roomCode);
            return;
        }
        ManagedRoom managed = rooms.get(roomCode);
        if (managed == null || message == null) {
            return;
        }
        managed.mailbox().submit(() -> handleAction(managed, ref.playerId(), message));
    }

    private void seat(ManagedRoom managed, String sessionId, String name) {
        Room room = managed.room();
        SeatRef pending = SeatRef.pending(room.getId());
        if (rooms.get(room.getId()) != managed) {
            sessions.remove(sessionId, pending);
            sendDirect(sessionId, TrioEvent.error("Room not found"));
            return;
        }
        String playerId = newPlayerId(room);

        Player player;
        try {
            player = room.seat(playerId, name, sessionId);
        } catch (GameActionException e) {
            sessions.remove(sessionId, pending);
            log.debug("room={} join refused for session={}: {}", room.getId(), sessionId, e.getMessage());
            sendDirect(sessionId, TrioEvent.error(e.getMessage()));
            return;
        }
        // no-op when the session already left; its unseat task is queued behind this one
        sessions.replace(sessionId, pending, new SeatRef(room.getId(), playerId));
        log.info("room={} player={} '{}' joined seats={}", room.getId(), playerId, name, room.playerCount());

        deliver(room, List.of(
                OutboundMessage.broadcast(TrioEvent.builder()
                        .type(EventType.PLAYER_JOINED)
                        .player(PlayerView.from(player))
                        .room(RoomView.from(room))
                        .build()),
                OutboundMessage.toPlayer(playerId, TrioEvent.builder()
                        .type(EventType.WELCOME)
                        .playerId(playerId)
                        .room(RoomView.from(room))
                        .build())));
    }

    private void unseat(ManagedRoom managed, String sessionId) {
        Room room = managed.room();
        Optional<Player> found = room.findPlayerBySession(sessionId);
        if (found.isEmpty()) {
            return;
        }
        Player player = found.get();
        String playerId = player.getId();

        if (room.getPhase() == RoomPhase.WAITING) {
            room.unseat(playerId);
            log.info("room={} player={} left seats={}", room.getId(), playerId, room.playerCount());
            if (room.isEmpty()) {
                rooms.remove(room.getId(), managed);
                log.info("room={} closed", room.getId());
                return;
            }
        } else {
            player.setConnected(false);
            log.info("room={} player={} disconnected phase={}", room.getId(), playerId, room.getPhase().value());
        }

        deliver(room, List.of(OutboundMessage.broadcastExcept(Set.of(playerId), TrioEvent.builder()
                .type(EventType.PLAYER_DISCONNECTED)
                .playerId(playerId)
                .playerName(player.getName())
                .room(RoomView.from(room))
                .build())));
    }

    private void handleAction(ManagedRoom managed, String playerId, ActionMessage message) {
        Room room = managed.room();
        Optional<Player> actor = room.findPlayer(playerId);
        if (actor.isEmpty()) {
            return;
        }
        RoomPhase before = room.getPhase();

        List<OutboundMessage> out;
        try {
            out = route(room, actor.get(), message);
        } catch (GameActionException e) {
            log.debug("room={} player={} action={} rejected kind={}: {}",
                    room.getId(), playerId, message.getAction(), e.getKind(), e.getMessage());
            out = List.of(OutboundMessage.toPlayer(playerId, TrioEvent.error(e.getMessage())));
        }
        deliver(room, out);

        if (room.isAwaitingReturn()) {
            managed.mailbox().holdFor(failRevealDelayMs, () -> deliver(room, engine.returnRevealedCards(room)));
        }
        if (before != RoomPhase.FINISHED && room.getPhase() == RoomPhase.FINISHED) {
            archive.archive(room);
        }
    }

    /**
     * Missing fields and unknown actions are dropped without a reply.
     */
    private List<OutboundMessage> route(Room room, Player actor, ActionMessage message) {
        String action = message.getAction();
        if (action == null) {
            return ignored(room, actor, "missing action");
        }
        switch (action) {
            case "set_mode":
                if (message.getMode() == null) {
                    return ignored(room, actor, "set_mode without mode");
                }
                return engine.setMode(room, actor.getId(), message.getMode());
            case "start_game":
                return engine.startGame(room, actor.getId());
            case "reveal_middle":
                if (message.getCardId() == null) {
                    return ignored(room, actor, "reveal_middle without card_id");
                }
                return engine.revealFromMiddle(room, actor.getId(), message.getCardId());
            case "reveal_player":
                if (isBlank(message.getTargetPlayerId()) || isBlank(message.getPosition())) {
                    return ignored(room, actor, "reveal_player without target or position");
                }
                return engine.revealFromPlayer(room, actor.getId(), message.getTargetPlayerId(), message.getPosition());
            case "chat":
                return List.of(OutboundMessage.broadcast(TrioEvent.builder()
                        .type(EventType.CHAT)
                        .playerId(actor.getId())
                        .playerName(actor.getName())
                        .message(message.getMessage() == null ? "" : message.getMessage())
                        .build()));
            default:
                return ignored(room, actor, "unknown action " + action);
        }
    }

    private List<OutboundMessage> ignored(Room room, Player actor, String reason) {
        log.debug("room={} player={} ignored: {}", room.getId(), actor.getId(), reason);
        return List.of();
    }

    void deliver(Room room, List<OutboundMessage> messages) {
        for (OutboundMessage message : messages) {
            if (message.isPrivate()) {
                room.findPlayer(message.recipientId())
                        .filter(Player::isConnected)
                        .ifPresent(player -> sendToSeat(room, player, message.event()));
                continue;
            }
            for (Player player : room.getPlayers()) {
                if (player.isConnected() && !message.excluded().contains(player.getId())) {
                    sendToSeat(room, player, message.event());
                }
            }
        }
    }

    private void sendToSeat(Room room, Player player, TrioEvent event) {
        try {
            messenger.send(player.getSessionId(), event);
        } catch (MessagingException e) {
            player.setConnected(false);
            log.warn("room={} delivery of {} to player={} failed, seat marked disconnected: {}",
                    room.getId(), event.getType(), player.getId(), e.getMessage());
        }
    }

    private void sendDirect(String sessionId, TrioEvent event) {
        try {
            messenger.send(sessionId, event);
        } catch (MessagingException e) {
            log.warn("delivery of {} to session={} failed: {}", event.getType(), sessionId, e.getMessage());
        }
    }

    private String newPlayerId(Room room) {
        String id;
        do {
            id = generateCode(PLAYER_ID_ALPHABET, PLAYER_ID_LENGTH);
        } while (room.findPlayer(id).isPresent());
        return id;
    }

    private String generateCode(String alphabet, int length) {
        StringBuilder builder = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            builder.append(alphabet.charAt(random.nextInt(alphabet.length())));
        }
        return builder.toString();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private record ManagedRoom(Room room, RoomMailbox mailbox) {
    }

    /**
     * A null player id means the join is still queued in the room's mailbox.
     */
    private record SeatRef(String roomCode, String playerId) {

        static SeatRef pending(String roomCode) {
            return new SeatRef(roomCode, null);
        }

        boolean isPending() {
            return playerId == null;
        }
    }
}
