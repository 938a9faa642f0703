package com.leaderboard.ranking.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SubmitScoreRequest {
    @NotNull(message = "playerId is required")
    @Positive(message = "playerId must be a positive integer")
    @JsonAlias({"user_id", "userId"})
    private Long playerId;

    @NotNull(message = "score is required")
    @Min(value = 0, message = "score cannot be negative")
    @Max(value = 1_000_000, message = "score cannot exceed 1,000,000")
    private Integer score;

    @Size(min = 1, max = 50, message = "mode must be between 1 and 50 characters")
    @JsonAlias("game_mode")
    private String mode;
}
