package com.leaderboard.ranking.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A queued request to rewrite ranks. Jobs live in the relational store so that work
 * enqueued before a crash is still picked up afterwards.
 */
@Entity
@Table(name = "rank_recomputation_jobs", indexes = {
    @Index(name = "idx_rank_job_status_next_attempt", columnList = "status,next_attempt_at"),
    @Index(name = "idx_rank_job_player_status", columnList = "player_id,status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RankRecomputationJob {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "scope", nullable = false, length = 20)
    private JobScope scope;

    @Column(name = "player_id")
    private Long playerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private JobStatus status;

    @Column(name = "priority", nullable = false)
    private Integer priority;

    @Column(name = "attempts", nullable = false)
    private Integer attempts;

    @Column(name = "next_attempt_at", nullable = false)
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant nextAttemptAt;

    @Column(name = "last_error", length = 1000)
    private String lastError;

    @Column(name = "created_at", nullable = false)
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant createdAt;

    @Column(name = "started_at")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant startedAt;

    @Column(name = "finished_at")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant finishedAt;

    public static RankRecomputationJob pending(JobScope scope, Long playerId, Instant now) {
        return RankRecomputationJob.builder()
            .scope(scope)
            .playerId(playerId)
            .status(JobStatus.PENDING)
            .priority(scope.getPriority())
            .attempts(0)
            .nextAttemptAt(now)
            .createdAt(now)
            .build();
    }
}
