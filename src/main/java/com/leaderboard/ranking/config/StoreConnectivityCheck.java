package com.leaderboard.ranking.config;

import com.leaderboard.ranking.exception.FatalConfigurationException;
import com.leaderboard.ranking.repository.PlayerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Fails startup when the relational store does not answer a trivial query.
 */
@Component
public class StoreConnectivityCheck implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(StoreConnectivityCheck.class);

    private final PlayerRepository playerRepository;

    @Autowired
    public StoreConnectivityCheck(PlayerRepository playerRepository) {
        this.playerRepository = playerRepository;
    }

    @Override
    public void run(ApplicationArguments args) {
        try {
            long players = playerRepository.count();
            logger.info("Relational store reachable, {} players registered", players);
        } catch (DataAccessException e) {
            throw new FatalConfigurationException("Cannot reach the relational store", e);
        }
    }
}
