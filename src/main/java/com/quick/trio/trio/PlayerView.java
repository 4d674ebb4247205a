package com.quick.trio.trio;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.util.List;

/**
 * What every seat may know about a player: counts, never hand contents.
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PlayerView {
    private String id;
    private String name;
    private int cardCount;
    private int trioCount;
    private List<List<Integer>> trios;
    private boolean connected;

    public static PlayerView from(Player player) {
        PlayerView view = new PlayerView();
        view.setId(player.getId());
        view.setName(player.getName());
        view.setCardCount(player.handSize());
        List<Trio> trios = player.getTrios();
        view.setTrioCount(trios.size());
        view.setTrios(trios.stream()
                .map(trio -> trio.cards().stream().map(Card::number).toList())
                .toList());
        view.setConnected(player.isConnected());
        return view;
    }
}
