package com.leaderboard.ranking.exception;

/**
 * The store could not complete an operation in time or was unreachable. Safe to retry.
 */
public class TransientStoreException extends LeaderboardException {
    public TransientStoreException(String message, Throwable cause) {
        super(message, "TRANSIENT_STORE_ERROR", cause);
    }

    public TransientStoreException(String message) {
        super(message, "TRANSIENT_STORE_ERROR");
    }
}
