package com.leaderboard.ranking.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One row of a top-N snapshot.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RankedPlayer {
    private Long playerId;
    private String displayName;
    private Long totalScore;
    private Integer rank;
}
