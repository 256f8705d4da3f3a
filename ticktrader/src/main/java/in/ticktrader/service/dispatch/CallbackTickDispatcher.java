package in.ticktrader.service.dispatch;

import in.ticktrader.domain.feed.ConsumptionMode;
import in.ticktrader.service.feed.CallbackBinding;
import in.ticktrader.service.feed.FeedAdapter;
import in.ticktrader.service.feed.TickHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.function.BooleanSupplier;

/**
 * CALLBACK mode: the tick handler runs inline on the feed's receive thread.
 *
 * The orchestration loop only logs heartbeats and checks for cancellation;
 * it never touches the tick path. The adapter still fills its queue, which
 * nobody drains here, so it just holds the most recent ticks.
 */
public final class CallbackTickDispatcher extends AbstractTickDispatcher {
    private static final Logger log = LoggerFactory.getLogger(CallbackTickDispatcher.class);

    private final CallbackBinding binding;
    private volatile boolean stopped = false;

    public CallbackTickDispatcher(FeedAdapter feed, TickHandler handler,
                                  Duration checkInterval, Duration heartbeatInterval, Clock clock) {
        super(feed, handler, checkInterval, heartbeatInterval, clock);
        this.binding = CallbackBinding.of(tick -> {
            if (stopped) {
                return;
            }
            dispatched.incrementAndGet();
            this.handler.onTick(tick);
        });
    }

    @Override
    public ConsumptionMode mode() {
        return ConsumptionMode.CALLBACK;
    }

    @Override
    public CallbackBinding binding() {
        return binding;
    }

    @Override
    public void run(BooleanSupplier keepRunning) throws InterruptedException {
        log.info("[DISPATCH] Callback mode active, orchestration loop is heartbeat-only");
        try {
            while (keepRunning.getAsBoolean() && !isComplete()) {
                heartbeat();
                pause();
            }
        } finally {
            stopped = true;
        }
        log.info("[DISPATCH] Callback loop stopped after {} ticks", dispatched.get());
    }

    @Override
    public boolean isComplete() {
        return feed.isSourceExhausted();
    }
}
