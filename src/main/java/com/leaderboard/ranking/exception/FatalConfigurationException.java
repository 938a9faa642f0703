package com.leaderboard.ranking.exception;

/**
 * A backing service required at startup could not be reached. Thrown while the
 * application context is being built, so the process does not come up half-wired.
 */
public class FatalConfigurationException extends LeaderboardException {
    public FatalConfigurationException(String message, Throwable cause) {
        super(message, "FATAL_CONFIGURATION", cause);
    }
}
