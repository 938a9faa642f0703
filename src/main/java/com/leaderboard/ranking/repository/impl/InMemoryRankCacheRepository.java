package com.leaderboard.ranking.repository.impl;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Ticker;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.collect.ImmutableList;
import com.leaderboard.ranking.model.PlayerRank;
import com.leaderboard.ranking.model.RankedPlayer;
import com.leaderboard.ranking.repository.RankCacheRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Process-local snapshot cache for single-node runs and tests. Entries are copied on the
 * way in and out so callers never share mutable snapshots with the cache.
 */
@Repository
@ConditionalOnProperty(name = "leaderboard.cache.type", havingValue = "memory")
public class InMemoryRankCacheRepository implements RankCacheRepository {

    private final Cache<Integer, List<RankedPlayer>> topCache;
    private final Cache<Long, PlayerRank> rankCache;

    @Autowired
    public InMemoryRankCacheRepository(@Value("${leaderboard.cache.top-ttl-seconds:60}") long topTtlSeconds,
                                       @Value("${leaderboard.cache.rank-ttl-seconds:30}") long rankTtlSeconds) {
        this(Duration.ofSeconds(topTtlSeconds), Duration.ofSeconds(rankTtlSeconds), Ticker.systemTicker());
    }

    @VisibleForTesting
    InMemoryRankCacheRepository(Duration topTtl, Duration rankTtl, Ticker ticker) {
        this.topCache = CacheBuilder.newBuilder()
            .expireAfterWrite(topTtl)
            .ticker(ticker)
            .build();
        this.rankCache = CacheBuilder.newBuilder()
            .expireAfterWrite(rankTtl)
            .maximumSize(100_000)
            .ticker(ticker)
            .build();
    }

    @Override
    public Optional<List<RankedPlayer>> getTopN(int limit) {
        List<RankedPlayer> cached = topCache.getIfPresent(limit);
        if (cached == null) {
            return Optional.empty();
        }
        return Optional.of(cached.stream().map(InMemoryRankCacheRepository::copy).toList());
    }

    @Override
    public void putTopN(int limit, List<RankedPlayer> players) {
        topCache.put(limit, players.stream()
            .map(InMemoryRankCacheRepository::copy)
            .collect(ImmutableList.toImmutableList()));
    }

    @Override
    public Optional<PlayerRank> getPlayerRank(long playerId) {
        return Optional.ofNullable(rankCache.getIfPresent(playerId)).map(InMemoryRankCacheRepository::copy);
    }

    @Override
    public void putPlayerRank(PlayerRank playerRank) {
        rankCache.put(playerRank.getPlayerId(), copy(playerRank));
    }

    @Override
    public void invalidateTopN() {
        topCache.invalidateAll();
    }

    @Override
    public void invalidatePlayer(long playerId) {
        rankCache.invalidate(playerId);
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    private static RankedPlayer copy(RankedPlayer player) {
        return RankedPlayer.builder()
            .playerId(player.getPlayerId())
            .displayName(player.getDisplayName())
            .totalScore(player.getTotalScore())
            .rank(player.getRank())
            .build();
    }

    private static PlayerRank copy(PlayerRank rank) {
        return PlayerRank.builder()
            .playerId(rank.getPlayerId())
            .displayName(rank.getDisplayName())
            .totalScore(rank.getTotalScore())
            .rank(rank.getRank())
            .totalPlayers(rank.getTotalPlayers())
            .build();
    }
}
