package com.leaderboard.ranking.service;

import com.leaderboard.ranking.exception.PlayerNotFoundException;
import com.leaderboard.ranking.exception.TransientStoreException;
import com.leaderboard.ranking.exception.ValidationException;
import com.leaderboard.ranking.model.LeaderboardRow;
import com.leaderboard.ranking.model.LeaderboardStats;
import com.leaderboard.ranking.model.PlayerRank;
import com.leaderboard.ranking.model.RankedPlayer;
import com.leaderboard.ranking.repository.GameSessionRepository;
import com.leaderboard.ranking.repository.LeaderboardEntryRepository;
import com.leaderboard.ranking.repository.PlayerRepository;
import com.leaderboard.ranking.repository.RankCacheRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Read side of the leaderboard. Both reads go through the snapshot cache first and fall
 * back to the aggregate table on a miss or when the cache misbehaves. Ranks are dense on
 * both paths, so a top-N row and a per-player read agree for the same totals.
 */
@Service
public class LeaderboardQueryService {

    private static final Logger logger = LoggerFactory.getLogger(LeaderboardQueryService.class);

    private final LeaderboardEntryRepository entryRepository;
    private final PlayerRepository playerRepository;
    private final GameSessionRepository sessionRepository;
    private final RankCacheRepository cacheRepository;
    private final int maxTopLimit;

    @Autowired
    public LeaderboardQueryService(
            LeaderboardEntryRepository entryRepository,
            PlayerRepository playerRepository,
            GameSessionRepository sessionRepository,
            RankCacheRepository cacheRepository,
            @Value("${leaderboard.top.max-limit:100}") int maxTopLimit) {
        this.entryRepository = entryRepository;
        this.playerRepository = playerRepository;
        this.sessionRepository = sessionRepository;
        this.cacheRepository = cacheRepository;
        this.maxTopLimit = maxTopLimit;
    }

    /**
     * Top {@code limit} players by total score, highest first.
     */
    public List<RankedPlayer> getTop(int limit) {
        if (limit < 1 || limit > maxTopLimit) {
            throw new ValidationException("limit must be between 1 and " + maxTopLimit);
        }

        List<RankedPlayer> cached = tryGetTopFromCache(limit);
        if (cached != null) {
            logger.debug("Top {} cache hit", limit);
            return cached;
        }

        logger.debug("Top {} cache miss", limit);
        List<RankedPlayer> topPlayers = loadTopFromStorage(limit);
        tryCache(() -> cacheRepository.putTopN(limit, topPlayers), "top " + limit);
        logger.info("Retrieved top {} players from storage ({} rows)", limit, topPlayers.size());
        return topPlayers;
    }

    /**
     * Rank snapshot of one player.
     *
     * @throws PlayerNotFoundException if the player has never submitted a score
     */
    public PlayerRank getRank(long playerId) {
        if (playerId <= 0) {
            throw new ValidationException("playerId must be a positive integer");
        }

        PlayerRank cached = tryGetRankFromCache(playerId);
        if (cached != null) {
            logger.debug("Rank cache hit for player {}", playerId);
            return cached;
        }

        logger.debug("Rank cache miss for player {}", playerId);
        PlayerRank playerRank = loadRankFromStorage(playerId);
        tryCache(() -> cacheRepository.putPlayerRank(playerRank), "rank of player " + playerId);
        logger.info("Retrieved rank for player {}: rank {}", playerId, playerRank.getRank());
        return playerRank;
    }

    public LeaderboardStats getStats() {
        try {
            return LeaderboardStats.builder()
                .totalPlayers(playerRepository.count())
                .totalSessions(sessionRepository.count())
                .averageScore(Math.round(sessionRepository.averageScore()))
                .build();
        } catch (DataAccessException e) {
            throw new TransientStoreException("Failed to read leaderboard statistics", e);
        }
    }

    private List<RankedPlayer> tryGetTopFromCache(int limit) {
        try {
            return cacheRepository.getTopN(limit).orElse(null);
        } catch (Exception e) {
            logger.warn("Failed to read top {} from cache, falling back to storage", limit, e);
            return null;
        }
    }

    private PlayerRank tryGetRankFromCache(long playerId) {
        try {
            return cacheRepository.getPlayerRank(playerId).orElse(null);
        } catch (Exception e) {
            logger.warn("Failed to read rank of player {} from cache, falling back to storage", playerId, e);
            return null;
        }
    }

    private List<RankedPlayer> loadTopFromStorage(int limit) {
        List<LeaderboardRow> rows;
        try {
            rows = entryRepository.findTopRows(limit);
        } catch (DataAccessException e) {
            throw new TransientStoreException("Failed to retrieve leaderboard", e);
        }

        DenseRankCursor ranks = new DenseRankCursor();
        List<RankedPlayer> rankedPlayers = new ArrayList<>(rows.size());
        for (LeaderboardRow row : rows) {
            rankedPlayers.add(RankedPlayer.builder()
                .playerId(row.getPlayerId())
                .displayName(row.getDisplayName())
                .totalScore(row.getTotalScore())
                .rank(ranks.next(row.getTotalScore()))
                .build());
        }
        return rankedPlayers;
    }

    private PlayerRank loadRankFromStorage(long playerId) {
        try {
            Optional<LeaderboardRow> row = entryRepository.findRowByPlayerId(playerId);
            if (row.isEmpty()) {
                throw new PlayerNotFoundException(playerId);
            }
            long totalScore = row.get().getTotalScore();
            long distinctHigherTotals = entryRepository.countDistinctTotalsAbove(totalScore);
            return PlayerRank.builder()
                .playerId(playerId)
                .displayName(row.get().getDisplayName())
                .totalScore(totalScore)
                .rank(Math.toIntExact(distinctHigherTotals + 1))
                .totalPlayers(entryRepository.count())
                .build();
        } catch (DataAccessException e) {
            throw new TransientStoreException("Failed to retrieve player rank", e);
        }
    }

    private void tryCache(Runnable write, String description) {
        try {
            write.run();
        } catch (Exception e) {
            logger.warn("Failed to cache {}", description, e);
        }
    }
}
