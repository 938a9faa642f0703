package com.leaderboard.ranking.repository.impl;

import com.leaderboard.ranking.model.JobScope;
import com.leaderboard.ranking.model.JobStatus;
import com.leaderboard.ranking.model.RankRecomputationJob;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface JpaRecomputationJobRepository extends JpaRepository<RankRecomputationJob, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select j from RankRecomputationJob j where j.status = :status and j.nextAttemptAt <= :now "
        + "order by j.priority asc, j.createdAt asc, j.id asc")
    List<RankRecomputationJob> findDueForUpdate(@Param("status") JobStatus status,
                                                @Param("now") Instant now,
                                                Pageable pageable);

    Optional<RankRecomputationJob> findFirstByScopeAndStatusOrderByIdAsc(JobScope scope, JobStatus status);

    boolean existsByScopeAndPlayerIdAndStatus(JobScope scope, Long playerId, JobStatus status);

    long countByStatus(JobStatus status);

    List<RankRecomputationJob> findByStatusOrderByIdDesc(JobStatus status, Pageable pageable);

    @Transactional
    @Modifying
    @Query("update RankRecomputationJob j set j.status = :target, j.startedAt = null "
        + "where j.status = :source and j.startedAt < :cutoff")
    int moveStartedBefore(@Param("source") JobStatus source,
                          @Param("target") JobStatus target,
                          @Param("cutoff") Instant cutoff);

    @Transactional
    @Modifying
    @Query("update RankRecomputationJob j set j.startedAt = :now where j.id = :id and j.status = :status")
    int touchStartedAt(@Param("id") Long id, @Param("status") JobStatus status, @Param("now") Instant now);

    @Transactional
    @Modifying
    @Query("delete from RankRecomputationJob j where j.status = :status and j.finishedAt < :cutoff")
    int deleteFinishedBefore(@Param("status") JobStatus status, @Param("cutoff") Instant cutoff);
}
