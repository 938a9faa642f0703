package com.leaderboard.ranking.repository.impl;

import com.leaderboard.ranking.model.Player;
import com.leaderboard.ranking.repository.PlayerRepository;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public class JpaPlayerStore implements PlayerRepository {

    private final JpaPlayerRepository jpaRepository;

    @PersistenceContext
    private EntityManager entityManager;

    @Autowired
    public JpaPlayerStore(JpaPlayerRepository jpaRepository) {
        this.jpaRepository = jpaRepository;
    }

    @Override
    public Player insert(Player player) {
        // persist rather than merge, so an existing row is never overwritten
        entityManager.persist(player);
        entityManager.flush();
        return player;
    }

    @Override
    public boolean existsById(long playerId) {
        return jpaRepository.existsById(playerId);
    }

    @Override
    public Optional<Player> lockById(long playerId) {
        return jpaRepository.findByIdForUpdate(playerId);
    }

    @Override
    public long count() {
        return jpaRepository.count();
    }
}
