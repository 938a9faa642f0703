package com.leaderboard.ranking.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecomputationQueueStats {
    private long pending;
    private long active;
    private long completed;
    private long dead;
}
