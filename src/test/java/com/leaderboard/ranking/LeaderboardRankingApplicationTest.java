package com.leaderboard.ranking;

import com.leaderboard.ranking.repository.GameSessionRepository;
import com.leaderboard.ranking.repository.LeaderboardEntryRepository;
import com.leaderboard.ranking.repository.PlayerRepository;
import com.leaderboard.ranking.repository.RecomputationJobRepository;
import com.leaderboard.ranking.repository.impl.JpaGameSessionStore;
import com.leaderboard.ranking.repository.impl.JpaLeaderboardEntryStore;
import com.leaderboard.ranking.repository.impl.JpaPlayerStore;
import com.leaderboard.ranking.repository.impl.JpaRecomputationJobStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class LeaderboardRankingApplicationTest {

    @Autowired
    private ApplicationContext context;

    @Test
    void contextLoadsWithOneStorePerRepository() {
        assertThat(context.getBean(PlayerRepository.class)).isInstanceOf(JpaPlayerStore.class);
        assertThat(context.getBean(GameSessionRepository.class)).isInstanceOf(JpaGameSessionStore.class);
        assertThat(context.getBean(LeaderboardEntryRepository.class)).isInstanceOf(JpaLeaderboardEntryStore.class);
        assertThat(context.getBean(RecomputationJobRepository.class)).isInstanceOf(JpaRecomputationJobStore.class);
        assertThat(context.getBeanNamesForType(PlayerRepository.class)).hasSize(1);
    }
}
