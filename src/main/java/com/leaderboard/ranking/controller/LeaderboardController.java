package com.leaderboard.ranking.controller;

import com.leaderboard.ranking.dto.RecomputationAcceptedResponse;
import com.leaderboard.ranking.dto.SubmitScoreRequest;
import com.leaderboard.ranking.dto.TopNResponse;
import com.leaderboard.ranking.model.LeaderboardStats;
import com.leaderboard.ranking.model.PlayerRank;
import com.leaderboard.ranking.model.RankRecomputationJob;
import com.leaderboard.ranking.model.RankedPlayer;
import com.leaderboard.ranking.model.RecomputationQueueStats;
import com.leaderboard.ranking.model.SubmissionResult;
import com.leaderboard.ranking.service.LeaderboardQueryService;
import com.leaderboard.ranking.service.RankRecomputationService;
import com.leaderboard.ranking.service.ScoreSubmissionService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/leaderboard")
public class LeaderboardController {

    private static final Logger logger = LoggerFactory.getLogger(LeaderboardController.class);

    private final ScoreSubmissionService submissionService;
    private final LeaderboardQueryService queryService;
    private final RankRecomputationService recomputationService;
    private final Clock clock;

    @Autowired
    public LeaderboardController(
            ScoreSubmissionService submissionService,
            LeaderboardQueryService queryService,
            RankRecomputationService recomputationService,
            Clock clock) {
        this.submissionService = submissionService;
        this.queryService = queryService;
        this.recomputationService = recomputationService;
        this.clock = clock;
    }

    /**
     * Submit a game score.
     * POST /api/leaderboard/submit
     */
    @PostMapping("/submit")
    public ResponseEntity<SubmissionResult> submitScore(@Valid @RequestBody SubmitScoreRequest request) {
        logger.info("Received score submission - playerId: {}, score: {}, mode: {}",
            request.getPlayerId(), request.getScore(), request.getMode());

        SubmissionResult result = submissionService.submitScore(
            request.getPlayerId(), request.getScore(), request.getMode());
        return ResponseEntity.ok(result);
    }

    /**
     * Get the top N players.
     * GET /api/leaderboard/top?limit=N
     */
    @GetMapping("/top")
    public ResponseEntity<TopNResponse> getTop(@RequestParam(defaultValue = "10") int limit) {
        logger.debug("Received GET request for top {} players", limit);

        List<RankedPlayer> players = queryService.getTop(limit);
        return ResponseEntity.ok(TopNResponse.builder()
            .players(players)
            .count(players.size())
            .retrievedAt(Instant.now(clock))
            .build());
    }

    /**
     * Get one player's rank.
     * GET /api/leaderboard/rank/{playerId}
     */
    @GetMapping("/rank/{playerId}")
    public ResponseEntity<PlayerRank> getRank(@PathVariable long playerId) {
        logger.debug("Received GET request for rank of player {}", playerId);
        return ResponseEntity.ok(queryService.getRank(playerId));
    }

    @GetMapping("/stats")
    public ResponseEntity<LeaderboardStats> getStats() {
        return ResponseEntity.ok(queryService.getStats());
    }

    /**
     * Queue a full rank recomputation.
     * POST /api/leaderboard/recalculate
     */
    @PostMapping("/recalculate")
    public ResponseEntity<RecomputationAcceptedResponse> triggerFullRecomputation() {
        RankRecomputationJob job = recomputationService.requestFull();
        logger.info("Full rank recomputation accepted - jobId: {}", job.getId());

        return ResponseEntity.status(HttpStatus.ACCEPTED).body(RecomputationAcceptedResponse.builder()
            .jobId(job.getId())
            .acceptedAt(Instant.now(clock))
            .build());
    }

    @GetMapping("/recalculate/status")
    public ResponseEntity<RecomputationQueueStats> getRecomputationStatus() {
        return ResponseEntity.ok(recomputationService.getQueueStats());
    }

    @GetMapping("/recalculate/dead")
    public ResponseEntity<List<RankRecomputationJob>> getDeadJobs(@RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(recomputationService.getDeadJobs(limit));
    }

    /**
     * Re-queue a dead job with a fresh attempt budget.
     * POST /api/leaderboard/recalculate/dead/{jobId}/retry
     */
    @PostMapping("/recalculate/dead/{jobId}/retry")
    public ResponseEntity<RankRecomputationJob> retryDeadJob(@PathVariable long jobId) {
        logger.info("Received retry request for dead recomputation job {}", jobId);
        return ResponseEntity.ok(recomputationService.retryDeadJob(jobId));
    }
}
