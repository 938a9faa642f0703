package com.leaderboard.ranking.service;

import com.google.common.util.concurrent.RateLimiter;
import com.leaderboard.ranking.model.RankRecomputationJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.Semaphore;

/**
 * Background side of the recomputation queue. A poller claims due jobs only while a worker
 * slot is free, so at most {@code concurrency} jobs run at once, and every job takes a
 * permit from the shared rate limiter before it touches the store.
 */
@Component
public class RankRecomputationWorker {

    private static final Logger logger = LoggerFactory.getLogger(RankRecomputationWorker.class);

    private final RankRecomputationService recomputationService;
    private final Executor executor;
    private final RateLimiter rateLimiter;
    private final Semaphore slots;
    private final boolean enabled;

    @Value("${leaderboard.recomputation.stale-after-ms:600000}")
    private long staleAfterMs = 600_000;

    @Value("${leaderboard.recomputation.completed-retention-ms:3600000}")
    private long completedRetentionMs = 3_600_000;

    @Autowired
    public RankRecomputationWorker(
            RankRecomputationService recomputationService,
            @Qualifier("recomputationExecutor") Executor executor,
            RateLimiter recomputationRateLimiter,
            @Value("${leaderboard.recomputation.concurrency:2}") int concurrency,
            @Value("${leaderboard.recomputation.worker.enabled:true}") boolean enabled) {
        this.recomputationService = recomputationService;
        this.executor = executor;
        this.rateLimiter = recomputationRateLimiter;
        this.slots = new Semaphore(concurrency);
        this.enabled = enabled;
    }

    @Scheduled(fixedDelayString = "${leaderboard.recomputation.poll-interval-ms:500}")
    public void poll() {
        if (!enabled) {
            return;
        }
        try {
            dispatchDueJobs();
        } catch (Exception e) {
            logger.error("Error polling rank recomputation queue", e);
        }
    }

    /**
     * Hands due jobs to the executor until the queue is drained or every slot is busy.
     *
     * @return number of jobs dispatched
     */
    public int dispatchDueJobs() {
        int dispatched = 0;
        while (slots.tryAcquire()) {
            Optional<RankRecomputationJob> claimed;
            try {
                claimed = recomputationService.claimNextDue();
            } catch (RuntimeException e) {
                slots.release();
                throw e;
            }
            if (claimed.isEmpty()) {
                slots.release();
                break;
            }

            RankRecomputationJob job = claimed.get();
            try {
                executor.execute(() -> {
                    try {
                        runJob(job);
                    } finally {
                        slots.release();
                    }
                });
            } catch (RuntimeException e) {
                // Rejected by the executor; the job stays active and is recovered later.
                slots.release();
                throw e;
            }
            dispatched++;
        }
        return dispatched;
    }

    void runJob(RankRecomputationJob job) {
        rateLimiter.acquire();
        try {
            recomputationService.execute(job);
        } catch (Exception e) {
            try {
                recomputationService.markFailed(job, e);
            } catch (Exception bookkeeping) {
                logger.error("Could not record failure of recomputation job {}", job.getId(), bookkeeping);
            }
            return;
        }
        try {
            recomputationService.markCompleted(job);
        } catch (Exception e) {
            logger.error("Could not mark recomputation job {} completed", job.getId(), e);
        }
    }

    /**
     * Periodic full pass; bounds how long ranks overtaken by incremental updates stay stale.
     */
    @Scheduled(fixedRateString = "${leaderboard.recomputation.full-interval-ms:300000}",
               initialDelayString = "${leaderboard.recomputation.full-interval-ms:300000}")
    public void scheduleFullRecomputation() {
        if (!enabled) {
            return;
        }
        try {
            recomputationService.requestFull();
        } catch (Exception e) {
            logger.error("Failed to schedule full rank recomputation", e);
        }
    }

    @EventListener(ApplicationReadyEvent.class)
    public void recoverAfterStartup() {
        if (!enabled) {
            return;
        }
        try {
            recomputationService.recoverStaleJobs(Duration.ofMillis(staleAfterMs));
        } catch (Exception e) {
            logger.error("Failed to recover stale recomputation jobs", e);
        }
    }

    @Scheduled(fixedDelayString = "${leaderboard.recomputation.housekeeping-interval-ms:600000}")
    public void housekeeping() {
        if (!enabled) {
            return;
        }
        try {
            recomputationService.recoverStaleJobs(Duration.ofMillis(staleAfterMs));
            recomputationService.purgeCompletedJobs(Duration.ofMillis(completedRetentionMs));
        } catch (Exception e) {
            logger.error("Error during recomputation queue housekeeping", e);
        }
    }
}
