package com.leaderboard.ranking.model;

public enum JobScope {
    FULL(1),
    INCREMENTAL(10);

    // Lower value is claimed first.
    private final int priority;

    JobScope(int priority) {
        this.priority = priority;
    }

    public int getPriority() {
        return priority;
    }
}
