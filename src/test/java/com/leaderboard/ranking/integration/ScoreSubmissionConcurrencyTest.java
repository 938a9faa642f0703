package com.leaderboard.ranking.integration;

import com.leaderboard.ranking.model.LeaderboardEntry;
import com.leaderboard.ranking.repository.impl.JpaGameSessionRepository;
import com.leaderboard.ranking.repository.impl.JpaLeaderboardEntryRepository;
import com.leaderboard.ranking.repository.impl.JpaPlayerRepository;
import com.leaderboard.ranking.repository.impl.JpaRecomputationJobRepository;
import com.leaderboard.ranking.service.ScoreSubmissionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class ScoreSubmissionConcurrencyTest {

    @Autowired
    private ScoreSubmissionService submissionService;

    @Autowired
    private JpaPlayerRepository playerRepository;

    @Autowired
    private JpaGameSessionRepository sessionRepository;

    @Autowired
    private JpaLeaderboardEntryRepository entryRepository;

    @Autowired
    private JpaRecomputationJobRepository jobRepository;

    @BeforeEach
    void setUp() {
        jobRepository.deleteAllInBatch();
        entryRepository.deleteAllInBatch();
        sessionRepository.deleteAllInBatch();
        playerRepository.deleteAllInBatch();
    }

    @Test
    @DisplayName("50 concurrent submissions of score 1 for a fresh player add up to 50")
    void concurrentSubmissionsKeepSumInvariant() throws InterruptedException {
        // Given
        int numberOfThreads = 50;
        long playerId = 1001L;
        ExecutorService executorService = Executors.newFixedThreadPool(numberOfThreads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(numberOfThreads);
        List<Throwable> failures = new CopyOnWriteArrayList<>();

        // When
        for (int i = 0; i < numberOfThreads; i++) {
            executorService.submit(() -> {
                try {
                    start.await();
                    submissionService.submitScore(playerId, 1, "solo");
                } catch (Throwable t) {
                    failures.add(t);
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();
        assertThat(done.await(60, TimeUnit.SECONDS)).isTrue();
        executorService.shutdown();

        // Then
        assertThat(failures).isEmpty();
        LeaderboardEntry entry = entryRepository.findById(playerId).orElseThrow();
        assertThat(entry.getTotalScore()).isEqualTo(50L);
        assertThat(sessionRepository.sumScoreByPlayerId(playerId)).isEqualTo(50L);
        assertThat(playerRepository.count()).isEqualTo(1L);
    }

    @Test
    @DisplayName("Concurrent submissions for different players do not interfere")
    void concurrentSubmissionsAcrossPlayers() throws InterruptedException {
        // Given
        int players = 5;
        int submissionsPerPlayer = 10;
        ExecutorService executorService = Executors.newFixedThreadPool(16);
        CountDownLatch done = new CountDownLatch(players * submissionsPerPlayer);
        List<Throwable> failures = new CopyOnWriteArrayList<>();

        // When
        for (int p = 1; p <= players; p++) {
            long playerId = 2000L + p;
            int score = p * 10;
            for (int i = 0; i < submissionsPerPlayer; i++) {
                executorService.submit(() -> {
                    try {
                        submissionService.submitScore(playerId, score, null);
                    } catch (Throwable t) {
                        failures.add(t);
                    } finally {
                        done.countDown();
                    }
                });
            }
        }
        assertThat(done.await(60, TimeUnit.SECONDS)).isTrue();
        executorService.shutdown();

        // Then
        assertThat(failures).isEmpty();
        for (int p = 1; p <= players; p++) {
            assertThat(entryRepository.findById(2000L + p).orElseThrow().getTotalScore())
                .isEqualTo((long) p * 10 * submissionsPerPlayer);
        }
    }
}
