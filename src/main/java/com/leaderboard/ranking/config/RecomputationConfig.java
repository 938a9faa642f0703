package com.leaderboard.ranking.config;

import com.google.common.util.concurrent.RateLimiter;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class RecomputationConfig {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService recomputationExecutor(
            @Value("${leaderboard.recomputation.concurrency:2}") int concurrency) {
        return Executors.newFixedThreadPool(concurrency, new ThreadFactoryBuilder()
            .setNameFormat("rank-recompute-%d")
            .setDaemon(true)
            .build());
    }

    /**
     * Caps how many recomputation jobs start per second across all workers.
     */
    @Bean
    public RateLimiter recomputationRateLimiter(
            @Value("${leaderboard.recomputation.max-jobs-per-second:5.0}") double maxJobsPerSecond) {
        return RateLimiter.create(maxJobsPerSecond);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
