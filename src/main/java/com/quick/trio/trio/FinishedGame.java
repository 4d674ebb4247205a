package com.quick.trio.trio;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;
import lombok.Data;

import java.time.Instant;

@Data
@Entity
@Table(name = "finished_games")
public class FinishedGame {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "room_code", nullable = false)
    private String roomCode;

    @Column(name = "room_name")
    private String roomName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private GameMode mode;

    @Column(name = "winner_name")
    private String winnerName;

    @Column(name = "win_reason")
    private String winReason;

    @Column(name = "player_count")
    private int playerCount;

    // final scores as JSON
    @Lob
    @Column(nullable = false)
    private String payload;

    @Column(name = "finished_at", nullable = false)
    private Instant finishedAt;
}
