package com.quick.trio.trio;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class MiddleSlotView {
    private int id;
    private Integer number;
    private boolean faceUp;
    private boolean taken;

    public static MiddleSlotView from(MiddleSlot slot) {
        MiddleSlotView view = new MiddleSlotView();
        view.setId(slot.getCard().id());
        boolean faceUp = slot.getState() == SlotState.FACE_UP;
        view.setNumber(faceUp ? slot.getCard().number() : null);
        view.setFaceUp(faceUp);
        view.setTaken(slot.getState() == SlotState.TAKEN);
        return view;
    }
}
