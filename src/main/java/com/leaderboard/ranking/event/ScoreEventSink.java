package com.leaderboard.ranking.event;

/**
 * Receives one event per committed submission. Delivery guarantees are up to the sink.
 */
public interface ScoreEventSink {
    void publish(ScoreChangedEvent event);
}
