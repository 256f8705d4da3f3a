package in.ticktrader.service.dispatch;

import in.ticktrader.service.core.RateLimiter;
import in.ticktrader.service.core.TimeWindowRateLimiter;
import in.ticktrader.service.feed.FeedAdapter;
import in.ticktrader.service.feed.TickHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Shared loop timing and heartbeat for both dispatch strategies.
 *
 * The heartbeat is gated by wall-clock time only, so it fires once per
 * window whether ticks are flooding in or the feed is silent.
 */
abstract class AbstractTickDispatcher implements TickDispatcher {
    private static final Logger log = LoggerFactory.getLogger(AbstractTickDispatcher.class);

    private static final String HEARTBEAT = "heartbeat";

    protected final FeedAdapter feed;
    protected final TickHandler handler;
    protected final Duration loopInterval;
    protected final AtomicLong dispatched = new AtomicLong();

    private final RateLimiter heartbeatLimiter;
    private final AtomicLong heartbeats = new AtomicLong();

    AbstractTickDispatcher(FeedAdapter feed, TickHandler handler, Duration loopInterval,
                           Duration heartbeatInterval, Clock clock) {
        this.feed = feed;
        this.handler = handler;
        this.loopInterval = loopInterval;
        this.heartbeatLimiter = new TimeWindowRateLimiter(heartbeatInterval, clock);
    }

    @Override
    public long dispatched() {
        return dispatched.get();
    }

    long heartbeats() {
        return heartbeats.get();
    }

    protected void heartbeat() {
        if (heartbeatLimiter.allow(HEARTBEAT)) {
            heartbeats.incrementAndGet();
            log.info("[DISPATCH] {} heartbeat: lastPrice={}, dispatched={}, queued={}, feed={}",
                mode(),
                feed.lastPrice().map(p -> p.toPlainString()).orElse("-"),
                dispatched.get(),
                feed.queuedTicks(),
                feed.status());
        }
    }

    protected void pause() throws InterruptedException {
        Thread.sleep(loopInterval.toMillis());
    }
}
