package com.leaderboard.ranking.service;

/**
 * Assigns dense ranks to totals visited in descending order: equal totals share a rank and
 * the next lower total gets the following rank, without gaps. The cursor can be carried
 * across pages of one ordering pass.
 */
public class DenseRankCursor {

    private Long previousTotal;
    private int currentRank;

    public int next(long totalScore) {
        if (previousTotal == null) {
            currentRank = 1;
        } else if (totalScore > previousTotal) {
            throw new IllegalArgumentException(
                "Totals must be visited in descending order: " + totalScore + " after " + previousTotal);
        } else if (totalScore < previousTotal) {
            currentRank++;
        }
        previousTotal = totalScore;
        return currentRank;
    }
}
