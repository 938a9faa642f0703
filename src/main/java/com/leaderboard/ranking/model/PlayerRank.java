package com.leaderboard.ranking.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlayerRank {
    private Long playerId;
    private String displayName;
    private Long totalScore;
    private Integer rank;
    private Long totalPlayers;
}
