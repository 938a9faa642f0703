package com.leaderboard.ranking.repository;

import com.leaderboard.ranking.model.PlayerRank;
import com.leaderboard.ranking.model.RankedPlayer;

import java.util.List;
import java.util.Optional;

/**
 * Tier of disposable snapshots in front of the aggregate table. The top-N cache and the
 * per-player cache expire independently of each other.
 */
public interface RankCacheRepository {
    Optional<List<RankedPlayer>> getTopN(int limit);
    void putTopN(int limit, List<RankedPlayer> players);
    Optional<PlayerRank> getPlayerRank(long playerId);
    void putPlayerRank(PlayerRank playerRank);

    /** Drops the snapshots of every N. */
    void invalidateTopN();

    void invalidatePlayer(long playerId);
    boolean isAvailable();
}
