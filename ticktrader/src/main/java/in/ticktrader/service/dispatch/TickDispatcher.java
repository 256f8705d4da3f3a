package in.ticktrader.service.dispatch;

import in.ticktrader.domain.feed.ConsumptionMode;
import in.ticktrader.service.feed.CallbackBinding;

import java.util.function.BooleanSupplier;

/**
 * Moves ticks from the feed adapter to the session's single tick handler.
 *
 * Exactly one strategy is active per session. Both deliver every tick once,
 * in arrival order, to the same handler; they differ only in which thread
 * runs it.
 */
public interface TickDispatcher {

    ConsumptionMode mode();

    /**
     * Binding to pass to {@code FeedAdapter.connect}.
     */
    CallbackBinding binding();

    /**
     * Orchestration loop. Returns when {@code keepRunning} turns false or
     * {@link #isComplete()} turns true. A tick in flight is always finished.
     */
    void run(BooleanSupplier keepRunning) throws InterruptedException;

    /**
     * True once a finite feed is exhausted and every tick has been handled.
     */
    boolean isComplete();

    long dispatched();
}
