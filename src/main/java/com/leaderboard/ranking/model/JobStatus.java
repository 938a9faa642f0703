package com.leaderboard.ranking.model;

public enum JobStatus {
    PENDING,
    ACTIVE,
    COMPLETED,
    DEAD
}
