package com.quick.trio.trio;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

/**
 * Inbound action from a seated connection, tagged by {@link #action}.
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ActionMessage {
    private String action;   // set_mode, start_game, reveal_middle, reveal_player, chat
    private String mode;
    private Integer cardId;
    private String targetPlayerId;
    private String position; // lowest or highest
    private String message;
}
