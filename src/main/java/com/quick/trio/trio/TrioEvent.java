package com.quick.trio.trio;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Every message pushed to a seat. Only the fields relevant to {@link #type} are set.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TrioEvent {
    private EventType type;
    private String message;

    private String playerId;
    private String playerName;
    private PlayerView player;
    private RoomView room;
    private GameMode mode;

    private List<String> turnOrder;
    private String currentPlayer;
    private String currentPlayerId;

    private HandView hand;
    private List<PlayerView> players;
    private List<MiddleSlotView> middleCards;
    private Integer middleCardCount;
    private List<RevealView> revealedThisTurn;

    private CardView card;
    private String source;
    private String sourceId;
    private HandPosition position;
    private String revealedBy;
    private Integer count;
    private Integer trioNumber;
    private Boolean delayReturn;

    private String winner;
    private String winnerId;
    private String reason;
    private List<FinalScore> finalScores;

    public static TrioEvent error(String message) {
        return TrioEvent.builder().type(EventType.ERROR).message(message).build();
    }
}
