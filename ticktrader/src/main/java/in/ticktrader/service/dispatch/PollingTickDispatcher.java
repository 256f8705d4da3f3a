package in.ticktrader.service.dispatch;

import in.ticktrader.domain.data.Tick;
import in.ticktrader.domain.feed.ConsumptionMode;
import in.ticktrader.infrastructure.feed.metrics.FeedMetrics;
import in.ticktrader.service.feed.CallbackBinding;
import in.ticktrader.service.feed.FeedAdapter;
import in.ticktrader.service.feed.TickHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * POLL mode: the orchestration thread drains the adapter's queue, then sleeps
 * for the poll interval when it finds nothing. An empty poll is not an error.
 * The heartbeat is offered on every pass, busy or idle.
 */
public final class PollingTickDispatcher extends AbstractTickDispatcher {
    private static final Logger log = LoggerFactory.getLogger(PollingTickDispatcher.class);

    private final FeedMetrics metrics;
    private final String instrumentId;

    public PollingTickDispatcher(FeedAdapter feed, TickHandler handler, String instrumentId,
                                 Duration pollInterval, Duration heartbeatInterval,
                                 FeedMetrics metrics, Clock clock) {
        super(feed, handler, pollInterval, heartbeatInterval, clock);
        this.metrics = metrics;
        this.instrumentId = instrumentId;
    }

    @Override
    public ConsumptionMode mode() {
        return ConsumptionMode.POLL;
    }

    @Override
    public CallbackBinding binding() {
        return CallbackBinding.none();
    }

    @Override
    public void run(BooleanSupplier keepRunning) throws InterruptedException {
        log.info("[DISPATCH] Poll loop started (interval {}ms)", loopInterval.toMillis());
        while (keepRunning.getAsBoolean()) {
            heartbeat();
            Optional<Tick> next = feed.nextTick();
            if (next.isPresent()) {
                dispatch(next.get());
            } else if (isComplete()) {
                break;
            } else {
                pause();
            }
        }
        log.info("[DISPATCH] Poll loop stopped after {} ticks", dispatched.get());
    }

    @Override
    public boolean isComplete() {
        // Exhaustion is set after the last enqueue, so checking it first is safe.
        return feed.isSourceExhausted() && feed.queuedTicks() == 0;
    }

    private void dispatch(Tick tick) {
        long started = System.nanoTime();
        dispatched.incrementAndGet();
        try {
            handler.onTick(tick);
        } catch (RuntimeException e) {
            log.error("[DISPATCH] Tick handler failed for {}", tick, e);
        }
        metrics.recordDecisionLatency(instrumentId, Duration.ofNanos(System.nanoTime() - started));
    }
}
