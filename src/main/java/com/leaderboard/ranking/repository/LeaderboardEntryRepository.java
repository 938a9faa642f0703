package com.leaderboard.ranking.repository;

import com.leaderboard.ranking.model.LeaderboardEntry;
import com.leaderboard.ranking.model.LeaderboardRow;

import java.util.List;
import java.util.Optional;

public interface LeaderboardEntryRepository {
    LeaderboardEntry save(LeaderboardEntry entry);
    Optional<LeaderboardEntry> findByPlayerId(long playerId);

    /** Highest totals first, ties ordered by player id. */
    List<LeaderboardRow> findTopRows(int limit);

    Optional<LeaderboardRow> findRowByPlayerId(long playerId);
    long countDistinctTotalsAbove(long totalScore);
    long count();

    /**
     * Keyset page of the ranking order. A null cursor starts from the top; otherwise the
     * page starts strictly after {@code (afterTotalScore, afterPlayerId)}.
     */
    List<LeaderboardEntry> findRankingPage(Long afterTotalScore, Long afterPlayerId, int pageSize);

    int updateRank(long playerId, int rank);
}
