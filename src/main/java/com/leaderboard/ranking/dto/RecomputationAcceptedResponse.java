package com.leaderboard.ranking.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Acknowledgment of a full recomputation request. The job id may belong to a full pass
 * that was already waiting in the queue.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecomputationAcceptedResponse {
    private Long jobId;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant acceptedAt;
}
