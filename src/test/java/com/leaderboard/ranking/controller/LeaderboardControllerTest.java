package com.leaderboard.ranking.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.leaderboard.ranking.dto.SubmitScoreRequest;
import com.leaderboard.ranking.exception.PlayerNotFoundException;
import com.leaderboard.ranking.exception.TransientStoreException;
import com.leaderboard.ranking.exception.ValidationException;
import com.leaderboard.ranking.model.JobScope;
import com.leaderboard.ranking.model.PlayerRank;
import com.leaderboard.ranking.model.RankRecomputationJob;
import com.leaderboard.ranking.model.RankedPlayer;
import com.leaderboard.ranking.model.RecomputationQueueStats;
import com.leaderboard.ranking.model.SubmissionResult;
import com.leaderboard.ranking.service.LeaderboardQueryService;
import com.leaderboard.ranking.service.RankRecomputationService;
import com.leaderboard.ranking.service.ScoreSubmissionService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(LeaderboardController.class)
class LeaderboardControllerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @TestConfiguration
    static class FixedClockConfig {
        @Bean
        Clock clock() {
            return Clock.fixed(NOW, ZoneOffset.UTC);
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private ScoreSubmissionService submissionService;

    @MockBean
    private LeaderboardQueryService queryService;

    @MockBean
    private RankRecomputationService recomputationService;

    @Test
    void submitScore_ShouldReturnTotal() throws Exception {
        // given
        given(submissionService.submitScore(7L, 150, "ranked")).willReturn(SubmissionResult.builder()
            .playerId(7L)
            .totalScore(400L)
            .submittedAt(NOW)
            .build());

        // when & then
        mockMvc.perform(post("/api/leaderboard/submit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new SubmitScoreRequest(7L, 150, "ranked"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.playerId").value(7))
                .andExpect(jsonPath("$.totalScore").value(400))
                .andExpect(jsonPath("$.submittedAt").value("2024-05-01T12:00:00.000Z"));
    }

    @Test
    void submitScore_ShouldAcceptSnakeCaseFields() throws Exception {
        given(submissionService.submitScore(7L, 10, "duo")).willReturn(SubmissionResult.builder()
            .playerId(7L)
            .totalScore(10L)
            .submittedAt(NOW)
            .build());

        mockMvc.perform(post("/api/leaderboard/submit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"user_id\": 7, \"score\": 10, \"game_mode\": \"duo\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalScore").value(10));
    }

    @Test
    void submitScore_NegativeScoreIsRejected() throws Exception {
        mockMvc.perform(post("/api/leaderboard/submit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new SubmitScoreRequest(7L, -5, null))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_ERROR"));

        verifyNoInteractions(submissionService);
    }

    @Test
    void submitScore_MissingPlayerIsRejected() throws Exception {
        mockMvc.perform(post("/api/leaderboard/submit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"score\": 10}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_ERROR"));
    }

    @Test
    void submitScore_MalformedBodyIsRejected() throws Exception {
        mockMvc.perform(post("/api/leaderboard/submit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"playerId\": \"seven\""))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_ERROR"));
    }

    @Test
    void submitScore_TransientStoreErrorMapsTo503() throws Exception {
        given(submissionService.submitScore(anyLong(), anyInt(), any()))
            .willThrow(new TransientStoreException("Failed to submit score. Please try again."));

        mockMvc.perform(post("/api/leaderboard/submit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new SubmitScoreRequest(7L, 10, null))))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.errorCode").value("TRANSIENT_STORE_ERROR"));
    }

    @Test
    void getTop_ShouldReturnRankedPlayers() throws Exception {
        given(queryService.getTop(2)).willReturn(List.of(
            RankedPlayer.builder().playerId(2L).displayName("user_2").totalScore(200L).rank(1).build(),
            RankedPlayer.builder().playerId(1L).displayName("user_1").totalScore(100L).rank(2).build()));

        mockMvc.perform(get("/api/leaderboard/top").param("limit", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(2))
                .andExpect(jsonPath("$.players[0].playerId").value(2))
                .andExpect(jsonPath("$.players[0].rank").value(1))
                .andExpect(jsonPath("$.players[1].rank").value(2));
    }

    @Test
    void getTop_DefaultsToTen() throws Exception {
        given(queryService.getTop(10)).willReturn(List.of());

        mockMvc.perform(get("/api/leaderboard/top"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(0));
    }

    @Test
    void getTop_InvalidLimitMapsTo400() throws Exception {
        given(queryService.getTop(500)).willThrow(new ValidationException("limit must be between 1 and 100"));

        mockMvc.perform(get("/api/leaderboard/top").param("limit", "500"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_ERROR"));
    }

    @Test
    void getRank_ShouldReturnSnapshot() throws Exception {
        given(queryService.getRank(1L)).willReturn(PlayerRank.builder()
            .playerId(1L)
            .displayName("user_1")
            .totalScore(250L)
            .rank(1)
            .totalPlayers(2L)
            .build());

        mockMvc.perform(get("/api/leaderboard/rank/1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalScore").value(250))
                .andExpect(jsonPath("$.rank").value(1))
                .andExpect(jsonPath("$.totalPlayers").value(2));
    }

    @Test
    void getRank_UnknownPlayerMapsTo404() throws Exception {
        given(queryService.getRank(42L)).willThrow(new PlayerNotFoundException(42L));

        mockMvc.perform(get("/api/leaderboard/rank/42"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("PLAYER_NOT_FOUND"));
    }

    @Test
    void getRank_NonNumericIdMapsTo400() throws Exception {
        mockMvc.perform(get("/api/leaderboard/rank/abc"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_ERROR"));
    }

    @Test
    void triggerRecalculation_ShouldReturnAccepted() throws Exception {
        RankRecomputationJob job = RankRecomputationJob.pending(JobScope.FULL, null, NOW);
        job.setId(12L);
        given(recomputationService.requestFull()).willReturn(job);

        mockMvc.perform(post("/api/leaderboard/recalculate"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.jobId").value(12))
                .andExpect(jsonPath("$.acceptedAt").value("2024-05-01T12:00:00.000Z"));
    }

    @Test
    void getRecalculationStatus_ShouldReturnCounts() throws Exception {
        given(recomputationService.getQueueStats()).willReturn(RecomputationQueueStats.builder()
            .pending(3).active(1).completed(10).dead(2).build());

        mockMvc.perform(get("/api/leaderboard/recalculate/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.pending").value(3))
                .andExpect(jsonPath("$.dead").value(2));
    }

    @Test
    void retryDeadJob_ShouldRequeue() throws Exception {
        RankRecomputationJob job = RankRecomputationJob.pending(JobScope.INCREMENTAL, 4L, NOW);
        job.setId(5L);
        given(recomputationService.retryDeadJob(5L)).willReturn(job);

        mockMvc.perform(post("/api/leaderboard/recalculate/dead/5/retry"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(5))
                .andExpect(jsonPath("$.status").value("PENDING"));
    }

    @Test
    void getDeadJobs_ShouldList() throws Exception {
        given(recomputationService.getDeadJobs(50)).willReturn(List.of());

        mockMvc.perform(get("/api/leaderboard/recalculate/dead"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isArray());
    }
}
