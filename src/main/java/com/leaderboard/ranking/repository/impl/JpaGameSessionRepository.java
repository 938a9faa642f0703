package com.leaderboard.ranking.repository.impl;

import com.leaderboard.ranking.model.GameSession;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaGameSessionRepository extends JpaRepository<GameSession, Long> {
    @Query("select sum(s.score) from GameSession s where s.playerId = :playerId")
    Long sumScoreByPlayerId(@Param("playerId") Long playerId);

    @Query("select avg(s.score) from GameSession s")
    Double averageScore();
}
