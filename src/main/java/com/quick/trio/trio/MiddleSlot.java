package com.quick.trio.trio;

import lombok.Getter;

@Getter
public class MiddleSlot {
    private final Card card;
    private SlotState state = SlotState.FACE_DOWN;

    public MiddleSlot(Card card) {
        this.card = card;
    }

    void flipUp() {
        state = SlotState.FACE_UP;
    }

    void flipDown() {
        state = SlotState.FACE_DOWN;
    }

    void markTaken() {
        state = SlotState.TAKEN;
    }

    public boolean isFaceDown() {
        return state == SlotState.FACE_DOWN;
    }
}
