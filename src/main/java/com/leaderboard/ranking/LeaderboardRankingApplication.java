package com.leaderboard.ranking;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class LeaderboardRankingApplication {

    public static void main(String[] args) {
        SpringApplication.run(LeaderboardRankingApplication.class, args);
    }
}
