package com.leaderboard.ranking.exception;

/**
 * Root of the engine's error taxonomy. Every subtype carries a stable error code that
 * the transport layer reports back to callers.
 */
public class LeaderboardException extends RuntimeException {
    private final String errorCode;

    public LeaderboardException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public LeaderboardException(String message, String errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
