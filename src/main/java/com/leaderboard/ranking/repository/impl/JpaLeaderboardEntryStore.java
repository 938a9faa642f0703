package com.leaderboard.ranking.repository.impl;

import com.leaderboard.ranking.model.LeaderboardEntry;
import com.leaderboard.ranking.model.LeaderboardRow;
import com.leaderboard.ranking.repository.LeaderboardEntryRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class JpaLeaderboardEntryStore implements LeaderboardEntryRepository {

    private final JpaLeaderboardEntryRepository jpaRepository;

    @Autowired
    public JpaLeaderboardEntryStore(JpaLeaderboardEntryRepository jpaRepository) {
        this.jpaRepository = jpaRepository;
    }

    @Override
    public LeaderboardEntry save(LeaderboardEntry entry) {
        return jpaRepository.save(entry);
    }

    @Override
    public Optional<LeaderboardEntry> findByPlayerId(long playerId) {
        return jpaRepository.findById(playerId);
    }

    @Override
    public List<LeaderboardRow> findTopRows(int limit) {
        return jpaRepository.findTopRows(PageRequest.of(0, limit));
    }

    @Override
    public Optional<LeaderboardRow> findRowByPlayerId(long playerId) {
        return jpaRepository.findRowByPlayerId(playerId);
    }

    @Override
    public long countDistinctTotalsAbove(long totalScore) {
        return jpaRepository.countDistinctTotalsAbove(totalScore);
    }

    @Override
    public long count() {
        return jpaRepository.count();
    }

    @Override
    public List<LeaderboardEntry> findRankingPage(Long afterTotalScore, Long afterPlayerId, int pageSize) {
        PageRequest page = PageRequest.of(0, pageSize);
        if (afterTotalScore == null || afterPlayerId == null) {
            return jpaRepository.findRankingHead(page);
        }
        return jpaRepository.findRankingAfter(afterTotalScore, afterPlayerId, page);
    }

    @Override
    public int updateRank(long playerId, int rank) {
        return jpaRepository.updateRank(playerId, rank);
    }
}
