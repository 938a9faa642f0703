package com.leaderboard.ranking.service;

import com.leaderboard.ranking.exception.TransientStoreException;
import com.leaderboard.ranking.exception.ValidationException;
import com.leaderboard.ranking.model.JobScope;
import com.leaderboard.ranking.model.JobStatus;
import com.leaderboard.ranking.model.LeaderboardEntry;
import com.leaderboard.ranking.model.RankRecomputationJob;
import com.leaderboard.ranking.model.RecomputationQueueStats;
import com.leaderboard.ranking.repository.LeaderboardEntryRepository;
import com.leaderboard.ranking.repository.RankCacheRepository;
import com.leaderboard.ranking.repository.RecomputationJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns the recomputation queue and the two recomputation scopes.
 *
 * <p>A full pass walks the aggregate table once in ranking order and writes dense ranks,
 * touching only rows whose rank changed. An incremental pass rewrites the rank of a single
 * player with the same dense formula the per-player read uses; players it overtook keep a
 * stale rank until the next full pass. Both scopes are idempotent; a failed job is simply
 * run again.
 */
@Service
public class RankRecomputationService {

    private static final Logger logger = LoggerFactory.getLogger(RankRecomputationService.class);

    private static final int MAX_ERROR_LENGTH = 1000;

    private final LeaderboardEntryRepository entryRepository;
    private final RecomputationJobRepository jobRepository;
    private final RankCacheRepository cacheRepository;
    private final LeaderboardQueryService queryService;
    private final Clock clock;
    private final TransactionTemplate transactionTemplate;
    private final AtomicInteger incrementalsSinceFull = new AtomicInteger();

    @Value("${leaderboard.recomputation.batch-size:1000}")
    private int batchSize = 1000;

    @Value("${leaderboard.recomputation.max-attempts:3}")
    private int maxAttempts = 3;

    @Value("${leaderboard.recomputation.backoff-base-ms:2000}")
    private long backoffBaseMs = 2000;

    @Value("${leaderboard.recomputation.full-after-incrementals:100}")
    private int fullAfterIncrementals = 100;

    @Value("${leaderboard.recomputation.warm-top-sizes:10,50}")
    private List<Integer> warmTopSizes = List.of(10, 50);

    @Autowired
    public RankRecomputationService(
            LeaderboardEntryRepository entryRepository,
            RecomputationJobRepository jobRepository,
            RankCacheRepository cacheRepository,
            LeaderboardQueryService queryService,
            PlatformTransactionManager transactionManager,
            Clock clock) {
        this.entryRepository = entryRepository;
        this.jobRepository = jobRepository;
        this.cacheRepository = cacheRepository;
        this.queryService = queryService;
        this.clock = clock;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * Queues a single-player rank update unless one is already waiting for that player.
     */
    public void requestIncremental(long playerId) {
        if (jobRepository.hasPendingIncremental(playerId)) {
            logger.debug("Incremental recomputation already pending for player {}", playerId);
            return;
        }
        RankRecomputationJob job = jobRepository.save(
            RankRecomputationJob.pending(JobScope.INCREMENTAL, playerId, Instant.now(clock)));
        logger.debug("Queued incremental recomputation job {} for player {}", job.getId(), playerId);
    }

    /**
     * Queues a full pass, or returns the full job that is already waiting.
     */
    public RankRecomputationJob requestFull() {
        try {
            Optional<RankRecomputationJob> pending = jobRepository.findPendingFull();
            if (pending.isPresent()) {
                logger.info("Full recomputation already queued as job {}", pending.get().getId());
                return pending.get();
            }
            RankRecomputationJob job = jobRepository.save(
                RankRecomputationJob.pending(JobScope.FULL, null, Instant.now(clock)));
            logger.info("Queued full recomputation job {}", job.getId());
            return job;
        } catch (DataAccessException e) {
            throw new TransientStoreException("Failed to queue rank recomputation", e);
        }
    }

    /**
     * Picks the next due job and marks it active in one transaction, so two pollers never
     * run the same job.
     */
    public Optional<RankRecomputationJob> claimNextDue() {
        return Optional.ofNullable(transactionTemplate.execute(status -> {
            Optional<RankRecomputationJob> next = jobRepository.lockNextDue(Instant.now(clock));
            if (next.isEmpty()) {
                return null;
            }
            RankRecomputationJob job = next.get();
            job.setStatus(JobStatus.ACTIVE);
            job.setStartedAt(Instant.now(clock));
            job.setAttempts(job.getAttempts() + 1);
            return jobRepository.save(job);
        }));
    }

    public void execute(RankRecomputationJob job) {
        logger.info("Processing rank recomputation job {} ({}, attempt {})",
            job.getId(), job.getScope(), job.getAttempts());
        if (job.getScope() == JobScope.FULL) {
            recomputeAll(() -> heartbeat(job));
        } else {
            recomputePlayer(job.getPlayerId());
        }
    }

    public void markCompleted(RankRecomputationJob job) {
        Instant now = Instant.now(clock);
        job.setStatus(JobStatus.COMPLETED);
        job.setFinishedAt(now);
        job.setLastError(null);
        jobRepository.save(job);
        logger.info("Rank recomputation job {} completed", job.getId());

        if (job.getScope() == JobScope.INCREMENTAL
                && incrementalsSinceFull.incrementAndGet() >= fullAfterIncrementals) {
            incrementalsSinceFull.set(0);
            requestFull();
        }
    }

    /**
     * Schedules a retry with exponential backoff, or parks the job as dead once it has used
     * all its attempts.
     */
    public void markFailed(RankRecomputationJob job, Exception error) {
        Instant now = Instant.now(clock);
        job.setLastError(describe(error));
        if (job.getAttempts() >= maxAttempts) {
            job.setStatus(JobStatus.DEAD);
            job.setFinishedAt(now);
            logger.error("Rank recomputation job {} failed {} times, moved to dead set",
                job.getId(), job.getAttempts(), error);
        } else {
            Duration delay = backoffDelay(job.getAttempts());
            job.setStatus(JobStatus.PENDING);
            job.setStartedAt(null);
            job.setNextAttemptAt(now.plus(delay));
            logger.warn("Rank recomputation job {} failed on attempt {}, retrying in {} ms",
                job.getId(), job.getAttempts(), delay.toMillis(), error);
        }
        jobRepository.save(job);
    }

    Duration backoffDelay(int attemptsSoFar) {
        return Duration.ofMillis(backoffBaseMs << Math.max(0, attemptsSoFar - 1));
    }

    /**
     * Dense rank for every aggregate row. Each page is written in its own transaction; a
     * total that changes mid-pass is picked up by the next pass.
     *
     * @return number of rows whose rank changed
     */
    public int recomputeAll() {
        return recomputeAll(() -> { });
    }

    private int recomputeAll(Runnable afterPage) {
        logger.info("Starting full rank recalculation");
        DenseRankCursor ranks = new DenseRankCursor();
        Long afterTotal = null;
        Long afterPlayer = null;
        int changed = 0;
        int visited = 0;

        while (true) {
            Long cursorTotal = afterTotal;
            Long cursorPlayer = afterPlayer;
            PageResult page = transactionTemplate.execute(status -> rankPage(ranks, cursorTotal, cursorPlayer));
            if (page == null || page.size == 0) {
                break;
            }
            changed += page.changed;
            visited += page.size;
            afterTotal = page.lastTotal;
            afterPlayer = page.lastPlayerId;
            afterPage.run();
            if (page.size < batchSize) {
                break;
            }
        }

        incrementalsSinceFull.set(0);
        refreshTopCache();
        logger.info("Full rank recalculation completed: {} rows visited, {} ranks changed", visited, changed);
        return changed;
    }

    private PageResult rankPage(DenseRankCursor ranks, Long afterTotal, Long afterPlayer) {
        List<LeaderboardEntry> entries = entryRepository.findRankingPage(afterTotal, afterPlayer, batchSize);
        PageResult result = new PageResult();
        result.size = entries.size();
        for (LeaderboardEntry entry : entries) {
            int rank = ranks.next(entry.getTotalScore());
            if (entry.getRank() == null || entry.getRank() != rank) {
                // rank column only; the loaded total may already be stale
                entryRepository.updateRank(entry.getPlayerId(), rank);
                result.changed++;
            }
            result.lastTotal = entry.getTotalScore();
            result.lastPlayerId = entry.getPlayerId();
        }
        return result;
    }

    private void heartbeat(RankRecomputationJob job) {
        if (job.getId() == null) {
            return;
        }
        try {
            jobRepository.heartbeat(job.getId(), Instant.now(clock));
        } catch (DataAccessException e) {
            logger.warn("Failed to refresh heartbeat of recomputation job {}", job.getId(), e);
        }
    }

    /**
     * Rewrites one player's rank from the number of distinct higher totals.
     *
     * @return the new rank, or empty when the player has no aggregate entry
     */
    public Optional<Integer> recomputePlayer(long playerId) {
        Optional<LeaderboardEntry> entry = entryRepository.findByPlayerId(playerId);
        if (entry.isEmpty()) {
            logger.warn("No leaderboard entry for player {}, skipping incremental recomputation", playerId);
            return Optional.empty();
        }
        long higherTotals = entryRepository.countDistinctTotalsAbove(entry.get().getTotalScore());
        int rank = Math.toIntExact(higherTotals + 1);
        entryRepository.updateRank(playerId, rank);
        logger.info("Incremental rank update for player {}: rank {}", playerId, rank);
        return Optional.of(rank);
    }

    private void refreshTopCache() {
        if (!cacheRepository.isAvailable()) {
            logger.warn("Rank cache unavailable, skipping top-N refresh after full recalculation");
            return;
        }
        try {
            cacheRepository.invalidateTopN();
        } catch (Exception e) {
            logger.warn("Failed to invalidate top-N cache after full recalculation", e);
            return;
        }
        for (Integer size : warmTopSizes) {
            try {
                queryService.getTop(size);
            } catch (Exception e) {
                logger.warn("Failed to warm top {} cache", size, e);
            }
        }
    }

    public RecomputationQueueStats getQueueStats() {
        try {
            return RecomputationQueueStats.builder()
                .pending(jobRepository.countByStatus(JobStatus.PENDING))
                .active(jobRepository.countByStatus(JobStatus.ACTIVE))
                .completed(jobRepository.countByStatus(JobStatus.COMPLETED))
                .dead(jobRepository.countByStatus(JobStatus.DEAD))
                .build();
        } catch (DataAccessException e) {
            throw new TransientStoreException("Failed to read recomputation queue status", e);
        }
    }

    public List<RankRecomputationJob> getDeadJobs(int limit) {
        if (limit < 1 || limit > 1000) {
            throw new ValidationException("limit must be between 1 and 1000");
        }
        return jobRepository.findByStatus(JobStatus.DEAD, limit);
    }

    /**
     * Puts a dead job back in the queue with a fresh attempt budget.
     */
    public RankRecomputationJob retryDeadJob(long jobId) {
        RankRecomputationJob job = jobRepository.findById(jobId)
            .orElseThrow(() -> new ValidationException("Unknown recomputation job: " + jobId));
        if (job.getStatus() != JobStatus.DEAD) {
            throw new ValidationException("Job " + jobId + " is " + job.getStatus() + ", only dead jobs can be retried");
        }
        Instant now = Instant.now(clock);
        job.setStatus(JobStatus.PENDING);
        job.setAttempts(0);
        job.setNextAttemptAt(now);
        job.setStartedAt(null);
        job.setFinishedAt(null);
        RankRecomputationJob saved = jobRepository.save(job);
        logger.info("Dead recomputation job {} re-queued", jobId);
        return saved;
    }

    /**
     * Returns jobs stuck in ACTIVE, left behind by a worker that died mid-job, to the queue.
     */
    public int recoverStaleJobs(Duration staleAfter) {
        int recovered = jobRepository.resetActiveStartedBefore(Instant.now(clock).minus(staleAfter));
        if (recovered > 0) {
            logger.warn("Re-queued {} recomputation jobs left active for more than {}", recovered, staleAfter);
        }
        return recovered;
    }

    public int purgeCompletedJobs(Duration retention) {
        int purged = jobRepository.deleteCompletedBefore(Instant.now(clock).minus(retention));
        logger.debug("Purged {} completed recomputation jobs", purged);
        return purged;
    }

    private static String describe(Exception error) {
        String message = error.getClass().getSimpleName() + ": " + error.getMessage();
        return message.length() > MAX_ERROR_LENGTH ? message.substring(0, MAX_ERROR_LENGTH) : message;
    }

    private static class PageResult {
        private int size;
        private int changed;
        private Long lastTotal;
        private Long lastPlayerId;
    }
}
