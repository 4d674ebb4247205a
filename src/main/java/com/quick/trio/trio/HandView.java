package com.quick.trio.trio;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.util.List;

/**
 * Private view of a seat's own hand.
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class HandView {
    private List<CardView> hand;
    private Integer lowest;
    private Integer highest;

    public static HandView from(Player player) {
        HandView view = new HandView();
        view.setHand(player.getHand().stream().map(card -> CardView.from(card, true)).toList());
        Card lowest = player.lowest();
        Card highest = player.highest();
        view.setLowest(lowest == null ? null : lowest.number());
        view.setHighest(highest == null ? null : highest.number());
        return view;
    }
}
