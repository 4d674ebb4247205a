package com.quick.trio.trio;

import lombok.Getter;

/**
 * A rule violation reported privately to the acting seat. Thrown before any
 * state is touched, so the room is unchanged.
 */
@Getter
public class GameActionException extends RuntimeException {

    public enum Kind {
        PHASE,     // action not allowed in the current room phase
        TURN,      // actor is not the current seat
        TARGET,    // card, seat or position not found or already exposed
        CAPACITY   // room full, or not enough seats to start
    }

    private final Kind kind;

    public GameActionException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    static GameActionException phase(String message) {
        return new GameActionException(Kind.PHASE, message);
    }

    static GameActionException turn(String message) {
        return new GameActionException(Kind.TURN, message);
    }

    static GameActionException target(String message) {
        return new GameActionException(Kind.TARGET, message);
    }

    static GameActionException capacity(String message) {
        return new GameActionException(Kind.CAPACITY, message);
    }
}
