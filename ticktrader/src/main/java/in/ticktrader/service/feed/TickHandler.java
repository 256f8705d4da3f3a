package in.ticktrader.service.feed;

import in.ticktrader.domain.data.Tick;

/**
 * Receives ticks synchronously on the feed's receive thread.
 */
@FunctionalInterface
public interface TickHandler {

    void onTick(Tick tick);
}
