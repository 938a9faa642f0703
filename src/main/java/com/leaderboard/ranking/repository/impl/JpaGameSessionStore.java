package com.leaderboard.ranking.repository.impl;

import com.leaderboard.ranking.model.GameSession;
import com.leaderboard.ranking.repository.GameSessionRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

@Repository
public class JpaGameSessionStore implements GameSessionRepository {

    private final JpaGameSessionRepository jpaRepository;

    @Autowired
    public JpaGameSessionStore(JpaGameSessionRepository jpaRepository) {
        this.jpaRepository = jpaRepository;
    }

    @Override
    public GameSession save(GameSession session) {
        // Flushed immediately so the following SUM sees the new row.
        return jpaRepository.saveAndFlush(session);
    }

    @Override
    public long sumScoresByPlayerId(long playerId) {
        Long sum = jpaRepository.sumScoreByPlayerId(playerId);
        return sum != null ? sum : 0L;
    }

    @Override
    public long count() {
        return jpaRepository.count();
    }

    @Override
    public double averageScore() {
        Double average = jpaRepository.averageScore();
        return average != null ? average : 0.0;
    }
}
