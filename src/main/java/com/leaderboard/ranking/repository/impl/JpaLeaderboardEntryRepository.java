package com.leaderboard.ranking.repository.impl;

import com.leaderboard.ranking.model.LeaderboardEntry;
import com.leaderboard.ranking.model.LeaderboardRow;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Repository
public interface JpaLeaderboardEntryRepository extends JpaRepository<LeaderboardEntry, Long> {

    @Query("select new com.leaderboard.ranking.model.LeaderboardRow(e.playerId, p.displayName, e.totalScore) "
        + "from LeaderboardEntry e join Player p on p.id = e.playerId "
        + "order by e.totalScore desc, e.playerId asc")
    List<LeaderboardRow> findTopRows(Pageable pageable);

    @Query("select new com.leaderboard.ranking.model.LeaderboardRow(e.playerId, p.displayName, e.totalScore) "
        + "from LeaderboardEntry e join Player p on p.id = e.playerId "
        + "where e.playerId = :playerId")
    Optional<LeaderboardRow> findRowByPlayerId(@Param("playerId") Long playerId);

    @Query("select count(distinct e.totalScore) from LeaderboardEntry e where e.totalScore > :totalScore")
    long countDistinctTotalsAbove(@Param("totalScore") Long totalScore);

    @Query("select e from LeaderboardEntry e order by e.totalScore desc, e.playerId asc")
    List<LeaderboardEntry> findRankingHead(Pageable pageable);

    @Query("select e from LeaderboardEntry e "
        + "where e.totalScore < :totalScore or (e.totalScore = :totalScore and e.playerId > :playerId) "
        + "order by e.totalScore desc, e.playerId asc")
    List<LeaderboardEntry> findRankingAfter(@Param("totalScore") Long totalScore,
                                            @Param("playerId") Long playerId,
                                            Pageable pageable);

    @Transactional
    @Modifying
    @Query("update LeaderboardEntry e set e.rank = :rank where e.playerId = :playerId")
    int updateRank(@Param("playerId") Long playerId, @Param("rank") Integer rank);
}
