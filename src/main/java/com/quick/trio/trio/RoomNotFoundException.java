package com.quick.trio.trio;

public class RoomNotFoundException extends RuntimeException {
    public RoomNotFoundException(String roomCode) {
        super("Room not found: " + roomCode);
    }
}
