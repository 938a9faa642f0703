package com.leaderboard.ranking.controller;

import com.leaderboard.ranking.dto.HealthResponse;
import com.leaderboard.ranking.repository.PlayerRepository;
import com.leaderboard.ranking.repository.RankCacheRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;

/**
 * Liveness of the two tiers. The service keeps answering without the cache, so a cache
 * outage degrades the status but leaves it 200; a store outage returns 503.
 */
@RestController
public class HealthController {

    private static final Logger logger = LoggerFactory.getLogger(HealthController.class);

    private final PlayerRepository playerRepository;
    private final RankCacheRepository cacheRepository;
    private final Clock clock;

    @Autowired
    public HealthController(PlayerRepository playerRepository, RankCacheRepository cacheRepository, Clock clock) {
        this.playerRepository = playerRepository;
        this.cacheRepository = cacheRepository;
        this.clock = clock;
    }

    /**
     * GET /health
     */
    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        boolean storeUp = isStoreReachable();
        boolean cacheUp = isCacheReachable();

        HealthResponse response = HealthResponse.builder()
            .status(!storeUp ? "unavailable" : cacheUp ? "ok" : "degraded")
            .database(storeUp ? HealthResponse.UP : HealthResponse.DOWN)
            .cache(cacheUp ? HealthResponse.UP : HealthResponse.DOWN)
            .timestamp(Instant.now(clock))
            .build();
        HttpStatus status = storeUp ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(status).body(response);
    }

    private boolean isStoreReachable() {
        try {
            playerRepository.count();
            return true;
        } catch (DataAccessException e) {
            logger.warn("Health check: relational store unreachable", e);
            return false;
        }
    }

    private boolean isCacheReachable() {
        try {
            return cacheRepository.isAvailable();
        } catch (RuntimeException e) {
            logger.warn("Health check: cache tier unreachable", e);
            return false;
        }
    }
}
