package com.quick.trio.trio;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.util.List;

@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RoomView {
    private String id;
    private String name;
    private GameMode mode;
    private int playerCount;
    private int maxPlayers;
    private int minPlayers;
    private RoomPhase state;
    private List<PlayerView> players;
    private String currentPlayer;
    private String currentPlayerId;

    public static RoomView from(Room room) {
        RoomView view = new RoomView();
        view.setId(room.getId());
        view.setName(room.getName());
        view.setMode(room.getMode());
        List<Player> players = room.getPlayers();
        view.setPlayerCount(players.size());
        view.setMaxPlayers(room.getMaxPlayers());
        view.setMinPlayers(room.getMinPlayers());
        view.setState(room.getPhase());
        view.setPlayers(players.stream().map(PlayerView::from).toList());
        room.currentPlayer().ifPresent(current -> {
            view.setCurrentPlayer(current.getName());
            view.setCurrentPlayerId(current.getId());
        });
        return view;
    }
}
