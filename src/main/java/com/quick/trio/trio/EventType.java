package com.quick.trio.trio;

import com.fasterxml.jackson.annotation.JsonValue;

public enum EventType {
    ERROR,
    WELCOME,
    PLAYER_JOINED,
    PLAYER_DISCONNECTED,
    MODE_CHANGED,
    GAME_STARTED,
    YOUR_HAND,
    YOUR_TURN,
    GAME_STATE,
    CARD_REVEALED,
    REVEAL_MATCH,
    TURN_FAILED,
    TRIO_COMPLETE,
    GAME_OVER,
    TURN_CHANGED,
    CHAT;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}
