package com.leaderboard.ranking.integration;

import com.leaderboard.ranking.model.LeaderboardEntry;
import com.leaderboard.ranking.model.LeaderboardRow;
import com.leaderboard.ranking.repository.LeaderboardEntryRepository;
import com.leaderboard.ranking.repository.RankCacheRepository;
import com.leaderboard.ranking.repository.RecomputationJobRepository;
import com.leaderboard.ranking.repository.impl.JpaGameSessionRepository;
import com.leaderboard.ranking.repository.impl.JpaLeaderboardEntryRepository;
import com.leaderboard.ranking.repository.impl.JpaPlayerRepository;
import com.leaderboard.ranking.repository.impl.JpaRecomputationJobRepository;
import com.leaderboard.ranking.service.LeaderboardQueryService;
import com.leaderboard.ranking.service.RankRecomputationService;
import com.leaderboard.ranking.service.ScoreSubmissionService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Submissions that commit while a full pass holds a page open must keep their totals.
 */
@SpringBootTest
class RankPassConcurrencyTest {

    @Autowired
    private ScoreSubmissionService submissionService;

    @Autowired
    private LeaderboardEntryRepository entryStore;

    @Autowired
    private RecomputationJobRepository jobStore;

    @Autowired
    private RankCacheRepository cacheRepository;

    @Autowired
    private LeaderboardQueryService queryService;

    @Autowired
    private PlatformTransactionManager transactionManager;

    @Autowired
    private Clock clock;

    @Autowired
    private JpaPlayerRepository playerRepository;

    @Autowired
    private JpaGameSessionRepository sessionRepository;

    @Autowired
    private JpaLeaderboardEntryRepository entryRepository;

    @Autowired
    private JpaRecomputationJobRepository jobRepository;

    private final ExecutorService submitter = Executors.newSingleThreadExecutor();

    @BeforeEach
    void setUp() {
        jobRepository.deleteAllInBatch();
        entryRepository.deleteAllInBatch();
        sessionRepository.deleteAllInBatch();
        playerRepository.deleteAllInBatch();
        cacheRepository.invalidateTopN();
    }

    @AfterEach
    void tearDown() {
        submitter.shutdownNow();
    }

    @Test
    @DisplayName("A submission committed mid-page survives the page's rank writes")
    void submissionDuringFullPassKeepsTotal() {
        // Given
        submissionService.submitScore(1L, 100, null);
        submissionService.submitScore(2L, 200, null);
        AtomicBoolean submitted = new AtomicBoolean();
        RankRecomputationService service = new RankRecomputationService(
            new SubmittingEntryRepository(submitted), jobStore, cacheRepository, queryService,
            transactionManager, clock);

        // When
        service.recomputeAll();

        // Then
        assertThat(submitted).isTrue();
        LeaderboardEntry entry = entryRepository.findById(1L).orElseThrow();
        assertThat(entry.getTotalScore()).isEqualTo(250L);
        assertThat(sessionRepository.sumScoreByPlayerId(1L)).isEqualTo(250L);
        assertThat(entryRepository.findById(2L).orElseThrow().getTotalScore()).isEqualTo(200L);

        // the stale order is only repaired by the next pass
        service.recomputeAll();
        assertThat(entryRepository.findById(1L).orElseThrow().getRank()).isEqualTo(1);
        assertThat(entryRepository.findById(2L).orElseThrow().getRank()).isEqualTo(2);
    }

    /**
     * Runs one submission for player 1 on another thread right after the first ranking page
     * is loaded, while the page transaction is still open.
     */
    private class SubmittingEntryRepository implements LeaderboardEntryRepository {

        private final AtomicBoolean submitted;

        SubmittingEntryRepository(AtomicBoolean submitted) {
            this.submitted = submitted;
        }

        @Override
        public List<LeaderboardEntry> findRankingPage(Long afterTotalScore, Long afterPlayerId, int pageSize) {
            List<LeaderboardEntry> page = entryStore.findRankingPage(afterTotalScore, afterPlayerId, pageSize);
            if (submitted.compareAndSet(false, true)) {
                try {
                    submitter.submit(() -> submissionService.submitScore(1L, 150, null)).get(30, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException(e);
                } catch (ExecutionException | TimeoutException e) {
                    throw new IllegalStateException("Concurrent submission did not complete", e);
                }
            }
            return page;
        }

        @Override
        public LeaderboardEntry save(LeaderboardEntry entry) {
            return entryStore.save(entry);
        }

        @Override
        public Optional<LeaderboardEntry> findByPlayerId(long playerId) {
            return entryStore.findByPlayerId(playerId);
        }

        @Override
        public List<LeaderboardRow> findTopRows(int limit) {
            return entryStore.findTopRows(limit);
        }

        @Override
        public Optional<LeaderboardRow> findRowByPlayerId(long playerId) {
            return entryStore.findRowByPlayerId(playerId);
        }

        @Override
        public long countDistinctTotalsAbove(long totalScore) {
            return entryStore.countDistinctTotalsAbove(totalScore);
        }

        @Override
        public long count() {
            return entryStore.count();
        }

        @Override
        public int updateRank(long playerId, int rank) {
            return entryStore.updateRank(playerId, rank);
        }
    }
}
