package in.ticktrader.service.feed;

import java.time.Duration;

/**
 * Connection lifecycle notifications from {@link FeedAdapter}.
 *
 * Invoked on the adapter's liveness thread or receive thread; implementations
 * must return quickly.
 */
public interface FeedEventListener {

    default void onReconnectScheduled(int attempt, Duration delay, String cause) {}

    default void onReconnected(int attempts) {}

    default void onFeedUnrecoverable(int attempts) {}

    default void onFeedExhausted() {}
}
