package com.quick.trio.trio;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RoomPhase {
    WAITING,   // accepting joins
    PLAYING,   // seating fixed, cards dealt
    FINISHED;  // terminal

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}
