package com.leaderboard.ranking.repository;

import com.leaderboard.ranking.model.GameSession;

public interface GameSessionRepository {
    GameSession save(GameSession session);
    long sumScoresByPlayerId(long playerId);
    long count();
    double averageScore();
}
