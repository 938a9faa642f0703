package com.leaderboard.ranking.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LeaderboardStats {
    private Long totalPlayers;
    private Long totalSessions;
    private Long averageScore;
}
