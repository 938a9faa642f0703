package com.leaderboard.ranking.exception;

/**
 * Malformed or out-of-range input. Never retried.
 */
public class ValidationException extends LeaderboardException {
    public ValidationException(String message) {
        super(message, "VALIDATION_ERROR");
    }
}
