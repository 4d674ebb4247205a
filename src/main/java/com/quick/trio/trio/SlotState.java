package com.quick.trio.trio;

public enum SlotState {
    FACE_DOWN,
    FACE_UP,   // revealed during the current sequence
    TAKEN      // captured into a trio, the slot stays as an empty space
}
