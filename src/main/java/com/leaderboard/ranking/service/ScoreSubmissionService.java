package com.leaderboard.ranking.service;

import com.leaderboard.ranking.event.ScoreChangedEvent;
import com.leaderboard.ranking.event.ScoreEventSink;
import com.leaderboard.ranking.exception.TransientStoreException;
import com.leaderboard.ranking.exception.ValidationException;
import com.leaderboard.ranking.model.GameSession;
import com.leaderboard.ranking.model.LeaderboardEntry;
import com.leaderboard.ranking.model.Player;
import com.leaderboard.ranking.model.SubmissionResult;
import com.leaderboard.ranking.repository.GameSessionRepository;
import com.leaderboard.ranking.repository.LeaderboardEntryRepository;
import com.leaderboard.ranking.repository.PlayerRepository;
import com.leaderboard.ranking.repository.RankCacheRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;

/**
 * Records score submissions.
 *
 * <p>The session insert and the total refresh commit together. The total is recomputed as
 * the sum of all of the player's sessions while the player row is locked, so concurrent
 * submissions for the same player queue up behind each other and none of them can
 * overwrite the total with a sum that misses another's session. Other players' rows are
 * never touched.
 *
 * <p>Cache invalidation, the recomputation request and the score event happen after
 * commit and only ever log their failures.
 */
@Service
public class ScoreSubmissionService {

    private static final Logger logger = LoggerFactory.getLogger(ScoreSubmissionService.class);

    public static final int MIN_SCORE = 0;
    public static final int MAX_SCORE = 1_000_000;
    public static final int MAX_MODE_LENGTH = 50;
    public static final String DEFAULT_MODE = "solo";

    private static final int PLAYER_CREATE_ATTEMPTS = 3;

    private final PlayerRepository playerRepository;
    private final GameSessionRepository sessionRepository;
    private final LeaderboardEntryRepository entryRepository;
    private final RankCacheRepository cacheRepository;
    private final RankRecomputationService recomputationService;
    private final ScoreEventSink eventSink;
    private final Clock clock;
    private final TransactionTemplate submissionTransaction;
    private final TransactionTemplate playerCreationTransaction;

    @Autowired
    public ScoreSubmissionService(
            PlayerRepository playerRepository,
            GameSessionRepository sessionRepository,
            LeaderboardEntryRepository entryRepository,
            RankCacheRepository cacheRepository,
            RankRecomputationService recomputationService,
            ScoreEventSink eventSink,
            PlatformTransactionManager transactionManager,
            Clock clock,
            @Value("${leaderboard.submission.timeout-seconds:30}") int timeoutSeconds) {
        this.playerRepository = playerRepository;
        this.sessionRepository = sessionRepository;
        this.entryRepository = entryRepository;
        this.cacheRepository = cacheRepository;
        this.recomputationService = recomputationService;
        this.eventSink = eventSink;
        this.clock = clock;

        this.submissionTransaction = new TransactionTemplate(transactionManager);
        this.submissionTransaction.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
        this.submissionTransaction.setTimeout(timeoutSeconds);

        this.playerCreationTransaction = new TransactionTemplate(transactionManager);
        this.playerCreationTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.playerCreationTransaction.setTimeout(timeoutSeconds);
    }

    /**
     * Records one game session and refreshes the player's total.
     *
     * @param mode game mode, {@code solo} when null
     * @throws ValidationException     if an argument is out of range
     * @throws TransientStoreException if the store does not complete the transaction in time
     */
    public SubmissionResult submitScore(long playerId, int score, String mode) {
        String gameMode = validateSubmission(playerId, score, mode);

        ensurePlayerExists(playerId);
        SubmissionResult result = recordSession(playerId, score, gameMode);

        invalidateCaches(playerId);
        requestRecomputation(playerId);
        publishScoreChanged(playerId, score, result.getSubmittedAt());

        logger.info("Score submitted successfully: playerId={}, score={}, totalScore={}",
            playerId, score, result.getTotalScore());
        return result;
    }

    private String validateSubmission(long playerId, int score, String mode) {
        if (playerId <= 0) {
            throw new ValidationException("playerId must be a positive integer");
        }
        if (score < MIN_SCORE || score > MAX_SCORE) {
            throw new ValidationException("score must be between 0 and 1,000,000");
        }
        if (mode == null) {
            return DEFAULT_MODE;
        }
        if (mode.trim().isEmpty() || mode.length() > MAX_MODE_LENGTH) {
            throw new ValidationException("mode must be between 1 and " + MAX_MODE_LENGTH + " characters");
        }
        return mode;
    }

    /**
     * Creates the player row on first submission. Runs in its own transaction ahead of the
     * submission so the row exists to be locked; losing a creation race to another
     * submission counts as success.
     */
    private void ensurePlayerExists(long playerId) {
        for (int attempt = 1; attempt <= PLAYER_CREATE_ATTEMPTS; attempt++) {
            try {
                if (playerRepository.existsById(playerId)) {
                    return;
                }
                playerCreationTransaction.executeWithoutResult(status -> playerRepository.insert(Player.builder()
                    .id(playerId)
                    .displayName(Player.defaultDisplayName(playerId))
                    .joinedAt(Instant.now(clock))
                    .build()));
                logger.info("Registered new player {}", playerId);
                return;
            } catch (DataIntegrityViolationException | ConcurrencyFailureException e) {
                logger.debug("Player {} created concurrently (attempt {})", playerId, attempt);
            } catch (DataAccessException | TransactionException e) {
                logger.error("Failed to register player {}", playerId, e);
                throw new TransientStoreException("Failed to submit score. Please try again.", e);
            }
        }
        throw new TransientStoreException("Failed to register player " + playerId + ". Please try again.");
    }

    private SubmissionResult recordSession(long playerId, int score, String gameMode) {
        try {
            return submissionTransaction.execute(status -> {
                playerRepository.lockById(playerId)
                    .orElseThrow(() -> new TransientStoreException("Player " + playerId + " disappeared mid-submission"));

                Instant submittedAt = Instant.now(clock);
                sessionRepository.save(GameSession.builder()
                    .playerId(playerId)
                    .score(score)
                    .gameMode(gameMode)
                    .submittedAt(submittedAt)
                    .build());

                long totalScore = sessionRepository.sumScoresByPlayerId(playerId);

                LeaderboardEntry entry = entryRepository.findByPlayerId(playerId)
                    .orElseGet(() -> LeaderboardEntry.builder().playerId(playerId).build());
                entry.setTotalScore(totalScore);
                entryRepository.save(entry);

                return SubmissionResult.builder()
                    .playerId(playerId)
                    .totalScore(totalScore)
                    .submittedAt(submittedAt)
                    .build();
            });
        } catch (DataAccessException | TransactionException e) {
            logger.error("Failed to submit score: playerId={}, score={}", playerId, score, e);
            throw new TransientStoreException("Failed to submit score. Please try again.", e);
        }
    }

    private void invalidateCaches(long playerId) {
        try {
            cacheRepository.invalidateTopN();
        } catch (Exception e) {
            logger.error("Failed to invalidate top-N cache after submission by player {}", playerId, e);
        }
        try {
            cacheRepository.invalidatePlayer(playerId);
        } catch (Exception e) {
            logger.error("Failed to invalidate rank cache for player {}", playerId, e);
        }
    }

    private void requestRecomputation(long playerId) {
        try {
            recomputationService.requestIncremental(playerId);
        } catch (Exception e) {
            logger.error("Failed to queue incremental recomputation for player {}", playerId, e);
        }
    }

    private void publishScoreChanged(long playerId, int score, Instant occurredAt) {
        try {
            eventSink.publish(ScoreChangedEvent.builder()
                .playerId(playerId)
                .score(score)
                .occurredAt(occurredAt)
                .build());
        } catch (Exception e) {
            logger.error("Failed to publish score change for player {}", playerId, e);
        }
    }
}
