package com.leaderboard.ranking.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.DynamicUpdate;

/**
 * Materialized per-player aggregate. {@code totalScore} always equals the sum of the
 * player's sessions; {@code rank} is a projection written by the recomputation engine
 * and stays null until the first pass reaches the row.
 */
@Entity
@DynamicUpdate
@Table(name = "leaderboard_entries", indexes = {
    @Index(name = "idx_leaderboard_total_score_player", columnList = "total_score DESC,player_id"),
    @Index(name = "idx_leaderboard_rank", columnList = "player_rank")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LeaderboardEntry {
    @Id
    @Column(name = "player_id")
    private Long playerId;

    @Column(name = "total_score", nullable = false)
    private Long totalScore;

    @Column(name = "player_rank")
    private Integer rank;
}
