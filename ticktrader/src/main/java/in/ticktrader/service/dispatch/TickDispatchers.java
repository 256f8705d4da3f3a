package in.ticktrader.service.dispatch;

import in.ticktrader.config.FeedConfig;
import in.ticktrader.domain.feed.ConsumptionMode;
import in.ticktrader.infrastructure.feed.metrics.FeedMetrics;
import in.ticktrader.service.feed.FeedAdapter;
import in.ticktrader.service.feed.TickHandler;

import java.time.Clock;

/**
 * Picks the dispatch strategy for a session.
 */
public final class TickDispatchers {

    public static TickDispatcher forMode(ConsumptionMode mode, FeedAdapter feed, TickHandler handler,
                                         String instrumentId, FeedConfig config,
                                         FeedMetrics metrics, Clock clock) {
        return switch (mode) {
            case POLL -> new PollingTickDispatcher(feed, handler, instrumentId,
                config.pollInterval(), config.heartbeatInterval(), metrics, clock);
            case CALLBACK -> new CallbackTickDispatcher(feed, handler,
                config.pollInterval(), config.heartbeatInterval(), clock);
        };
    }

    private TickDispatchers() {}
}
