package com.leaderboard.ranking.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Hands score events to Spring's event bus; broadcast transports subscribe with
 * {@code @EventListener ScoreChangedEvent}.
 */
@Component
public class ApplicationEventScoreEventSink implements ScoreEventSink {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationEventScoreEventSink.class);

    private final ApplicationEventPublisher publisher;

    public ApplicationEventScoreEventSink(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
    }

    @Override
    public void publish(ScoreChangedEvent event) {
        publisher.publishEvent(event);
        logger.debug("Published score change for player {}", event.getPlayerId());
    }
}
