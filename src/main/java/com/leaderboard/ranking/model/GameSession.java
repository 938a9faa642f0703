package com.leaderboard.ranking.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One submitted score. Sessions are only ever inserted; the per-player total is
 * always derived from them.
 */
@Entity
@Table(name = "game_sessions", indexes = {
    @Index(name = "idx_game_session_player_submitted", columnList = "player_id,submitted_at"),
    @Index(name = "idx_game_session_player_score", columnList = "player_id,score"),
    @Index(name = "idx_game_session_submitted", columnList = "submitted_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GameSession {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "player_id", nullable = false, updatable = false)
    private Long playerId;

    @Column(name = "score", nullable = false, updatable = false)
    private Integer score;

    @Column(name = "game_mode", nullable = false, length = 50, updatable = false)
    private String gameMode;

    @Column(name = "submitted_at", nullable = false, updatable = false)
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant submittedAt;
}
