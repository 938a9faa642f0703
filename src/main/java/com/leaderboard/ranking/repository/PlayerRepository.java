package com.leaderboard.ranking.repository;

import com.leaderboard.ranking.model.Player;

import java.util.Optional;

public interface PlayerRepository {
    /**
     * Inserts a new player row and flushes it. Fails with a data integrity violation when
     * the id is already taken.
     */
    Player insert(Player player);

    boolean existsById(long playerId);

    /**
     * Loads the player row holding a write lock until the surrounding transaction ends.
     * Must be called inside a transaction.
     */
    Optional<Player> lockById(long playerId);

    long count();
}
