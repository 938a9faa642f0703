package com.leaderboard.ranking.repository.impl;

import com.leaderboard.ranking.model.JobScope;
import com.leaderboard.ranking.model.JobStatus;
import com.leaderboard.ranking.model.RankRecomputationJob;
import com.leaderboard.ranking.repository.RecomputationJobRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class JpaRecomputationJobStore implements RecomputationJobRepository {

    private final JpaRecomputationJobRepository jpaRepository;

    @Autowired
    public JpaRecomputationJobStore(JpaRecomputationJobRepository jpaRepository) {
        this.jpaRepository = jpaRepository;
    }

    @Override
    public RankRecomputationJob save(RankRecomputationJob job) {
        return jpaRepository.save(job);
    }

    @Override
    public Optional<RankRecomputationJob> findById(long jobId) {
        return jpaRepository.findById(jobId);
    }

    @Override
    public Optional<RankRecomputationJob> lockNextDue(Instant now) {
        return jpaRepository.findDueForUpdate(JobStatus.PENDING, now, PageRequest.of(0, 1))
            .stream()
            .findFirst();
    }

    @Override
    public Optional<RankRecomputationJob> findPendingFull() {
        return jpaRepository.findFirstByScopeAndStatusOrderByIdAsc(JobScope.FULL, JobStatus.PENDING);
    }

    @Override
    public boolean hasPendingIncremental(long playerId) {
        return jpaRepository.existsByScopeAndPlayerIdAndStatus(JobScope.INCREMENTAL, playerId, JobStatus.PENDING);
    }

    @Override
    public long countByStatus(JobStatus status) {
        return jpaRepository.countByStatus(status);
    }

    @Override
    public List<RankRecomputationJob> findByStatus(JobStatus status, int limit) {
        return jpaRepository.findByStatusOrderByIdDesc(status, PageRequest.of(0, limit));
    }

    @Override
    public boolean heartbeat(long jobId, Instant now) {
        return jpaRepository.touchStartedAt(jobId, JobStatus.ACTIVE, now) > 0;
    }

    @Override
    public int resetActiveStartedBefore(Instant cutoff) {
        return jpaRepository.moveStartedBefore(JobStatus.ACTIVE, JobStatus.PENDING, cutoff);
    }

    @Override
    public int deleteCompletedBefore(Instant cutoff) {
        return jpaRepository.deleteFinishedBefore(JobStatus.COMPLETED, cutoff);
    }
}
