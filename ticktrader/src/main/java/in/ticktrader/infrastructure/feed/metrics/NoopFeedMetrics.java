package in.ticktrader.infrastructure.feed.metrics;

import in.ticktrader.domain.feed.FeedStatus;

import java.time.Duration;

final class NoopFeedMetrics implements FeedMetrics {
    static final NoopFeedMetrics INSTANCE = new NoopFeedMetrics();

    private NoopFeedMetrics() {}

    @Override
    public void recordTickReceived(String instrumentId) {}

    @Override
    public void recordTickEvicted(String instrumentId) {}

    @Override
    public void recordFormatError(String feedId) {}

    @Override
    public void recordCallbackFault(String instrumentId) {}

    @Override
    public void recordReconnectAttempt(String feedId, boolean success) {}

    @Override
    public void recordStatus(String feedId, FeedStatus status) {}

    @Override
    public void recordDecisionLatency(String instrumentId, Duration latency) {}
}
