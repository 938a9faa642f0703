package com.leaderboard.ranking.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Aggregate row joined with the player's display name, as read by the ranking queries.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LeaderboardRow {
    private Long playerId;
    private String displayName;
    private Long totalScore;
}
