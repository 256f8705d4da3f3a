package in.ticktrader.infrastructure.feed.metrics;

import in.ticktrader.domain.feed.FeedStatus;

import java.time.Duration;

/**
 * Counters and gauges for the tick pipeline.
 *
 * Called from the feed receive thread and the dispatch path, so
 * implementations must be thread-safe and must not block.
 */
public interface FeedMetrics {

    void recordTickReceived(String instrumentId);

    void recordTickEvicted(String instrumentId);

    void recordFormatError(String feedId);

    void recordCallbackFault(String instrumentId);

    void recordReconnectAttempt(String feedId, boolean success);

    void recordStatus(String feedId, FeedStatus status);

    /**
     * Time from tick arrival at the adapter to the end of its decision.
     */
    void recordDecisionLatency(String instrumentId, Duration latency);

    /**
     * Metrics sink that discards everything.
     */
    static FeedMetrics noop() {
        return NoopFeedMetrics.INSTANCE;
    }
}
