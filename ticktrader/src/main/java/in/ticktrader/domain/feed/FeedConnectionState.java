package in.ticktrader.domain.feed;

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time view of the feed connection, for observability only.
 *
 * @param status current status
 * @param lastTickAt arrival time of the most recent tick, null if none yet
 * @param consecutiveFailures reconnect attempts since the last successful tick
 * @param backoff delay that will be applied before the next reconnect attempt
 * @param terminal true once reconnects have been exhausted
 */
public record FeedConnectionState(
    FeedStatus status,
    Instant lastTickAt,
    int consecutiveFailures,
    Duration backoff,
    boolean terminal
) {
    public static FeedConnectionState initial(Duration initialBackoff) {
        return new FeedConnectionState(FeedStatus.DISCONNECTED, null, 0, initialBackoff, false);
    }
}
