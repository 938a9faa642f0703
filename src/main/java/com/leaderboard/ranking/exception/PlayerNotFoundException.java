package com.leaderboard.ranking.exception;

public class PlayerNotFoundException extends LeaderboardException {
    public PlayerNotFoundException(long playerId) {
        super("Player not found in leaderboard: " + playerId, "PLAYER_NOT_FOUND");
    }
}
