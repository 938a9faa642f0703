package com.leaderboard.ranking.repository;

import com.leaderboard.ranking.model.JobScope;
import com.leaderboard.ranking.model.JobStatus;
import com.leaderboard.ranking.model.RankRecomputationJob;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface RecomputationJobRepository {
    RankRecomputationJob save(RankRecomputationJob job);
    Optional<RankRecomputationJob> findById(long jobId);

    /**
     * Next pending job whose backoff has elapsed, locked for the surrounding transaction.
     * Full jobs come before incremental ones, then oldest first.
     */
    Optional<RankRecomputationJob> lockNextDue(Instant now);

    Optional<RankRecomputationJob> findPendingFull();
    boolean hasPendingIncremental(long playerId);
    long countByStatus(JobStatus status);
    List<RankRecomputationJob> findByStatus(JobStatus status, int limit);
    /**
     * Moves the start time of an active job forward so stale-job recovery leaves it alone.
     *
     * @return false when the job is no longer active
     */
    boolean heartbeat(long jobId, Instant now);

    int resetActiveStartedBefore(Instant cutoff);
    int deleteCompletedBefore(Instant cutoff);
}
