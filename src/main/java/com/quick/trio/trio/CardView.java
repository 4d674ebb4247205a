package com.quick.trio.trio;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CardView {
    private int id;
    private Integer number;   // null while face down
    private boolean faceUp;

    public static CardView from(Card card, boolean faceUp) {
        CardView view = new CardView();
        view.setId(card.id());
        view.setNumber(faceUp ? card.number() : null);
        view.setFaceUp(faceUp);
        return view;
    }
}
