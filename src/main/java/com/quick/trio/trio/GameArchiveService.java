package com.quick.trio.trio;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Keeps a record of every game that reached {@link RoomPhase#FINISHED}.
 */
@Service
public class GameArchiveService {

    private static final Logger log = LoggerFactory.getLogger(GameArchiveService.class);

    private final FinishedGameRepository finishedGameRepository;
    private final ObjectMapper objectMapper;

    public GameArchiveService(FinishedGameRepository finishedGameRepository, ObjectMapper objectMapper) {
        this.finishedGameRepository = finishedGameRepository;
        this.objectMapper = objectMapper;
    }

    public FinishedGame archive(Room room) {
        if (room.getPhase() != RoomPhase.FINISHED) {
            throw new IllegalStateException("Room " + room.getId() + " has not finished");
        }
        try {
            FinishedGame finishedGame = new FinishedGame();
            finishedGame.setRoomCode(room.getId());
            finishedGame.setRoomName(room.getName());
            finishedGame.setMode(room.getMode());
            finishedGame.setWinnerName(room.findPlayer(room.getWinnerId()).map(Player::getName).orElse(null));
            finishedGame.setWinReason(room.getWinReason());
            finishedGame.setPlayerCount(room.playerCount());
            finishedGame.setPayload(objectMapper.writeValueAsString(TurnEngine.finalScores(room)));
            finishedGame.setFinishedAt(Instant.now());
            FinishedGame saved = finishedGameRepository.save(finishedGame);
            log.info("archived room={} as finishedGame={}", room.getId(), saved.getId());
            return saved;
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize finished game", e);
        }
    }

    public List<FinishedGame> recent() {
        return finishedGameRepository.findTop20ByOrderByFinishedAtDesc();
    }
}
