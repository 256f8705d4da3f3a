package in.ticktrader.infrastructure.feed.common;

import in.ticktrader.config.FeedConfig;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Reconnection policy with capped exponential backoff for the tick feed.
 *
 * Features:
 * - Delay starts at the initial value and is multiplied after each failure
 * - Delay never exceeds the configured maximum
 * - Circuit opens after the maximum number of failed attempts
 * - A success resets delay, attempt count and circuit
 *
 * Usage:
 * <pre>
 * ReconnectionPolicy policy = ReconnectionPolicy.fromConfig(feedConfig, clock);
 *
 * if (policy.shouldRetry()) {
 *     scheduler.schedule(this::attempt, policy.getNextDelay().toMillis(), MILLISECONDS);
 * }
 * // attempt failed:  policy.recordFailure();
 * // first tick back: policy.recordSuccess();
 * </pre>
 */
public class ReconnectionPolicy {

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final int maxAttempts;
    private final Clock clock;

    private int attemptCount = 0;
    private Duration currentDelay;
    private Instant lastFailureTime;
    private boolean circuitOpen = false;

    private ReconnectionPolicy(Duration initialDelay, Duration maxDelay,
                               double multiplier, int maxAttempts, Clock clock) {
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
        this.maxAttempts = maxAttempts;
        this.clock = clock;
        this.currentDelay = initialDelay;
    }

    /**
     * @return true if another attempt is allowed, false once the circuit is open
     */
    public synchronized boolean shouldRetry() {
        return !circuitOpen && attemptCount < maxAttempts;
    }

    /**
     * Delay to wait before the next attempt. Equals the initial delay until
     * the first failure is recorded.
     */
    public synchronized Duration getNextDelay() {
        return currentDelay;
    }

    /**
     * Record a failed attempt: bump the count, grow the delay up to the cap,
     * open the circuit when the cap on attempts is reached.
     */
    public synchronized void recordFailure() {
        attemptCount++;
        lastFailureTime = clock.instant();

        long grown = (long) (currentDelay.toMillis() * multiplier);
        currentDelay = Duration.ofMillis(Math.min(grown, maxDelay.toMillis()));

        if (attemptCount >= maxAttempts) {
            circuitOpen = true;
        }
    }

    /**
     * Record a confirmed recovery. For the feed this is the first tick after a
     * reconnect, not the socket handshake.
     */
    public synchronized void recordSuccess() {
        attemptCount = 0;
        currentDelay = initialDelay;
        lastFailureTime = null;
        circuitOpen = false;
    }

    public synchronized boolean isCircuitOpen() {
        return circuitOpen;
    }

    /**
     * @return failed attempts since the last success
     */
    public synchronized int getAttemptCount() {
        return attemptCount;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getInitialDelay() {
        return initialDelay;
    }

    /**
     * @return time of the last recorded failure, null if none since the last success
     */
    public synchronized Instant getLastFailureTime() {
        return lastFailureTime;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Build the policy from the feed section of the session config.
     */
    public static ReconnectionPolicy fromConfig(FeedConfig feed, Clock clock) {
        return builder()
            .initialDelay(feed.reconnectInitialDelay())
            .maxDelay(feed.reconnectMaxDelay())
            .multiplier(feed.reconnectMultiplier())
            .maxAttempts(feed.reconnectMaxAttempts())
            .clock(clock)
            .build();
    }

    /**
     * Builder for ReconnectionPolicy. Every value must be supplied.
     */
    public static class Builder {
        private Duration initialDelay;
        private Duration maxDelay;
        private Double multiplier;
        private Integer maxAttempts;
        private Clock clock = Clock.systemUTC();

        public Builder initialDelay(Duration initialDelay) {
            if (initialDelay.isNegative() || initialDelay.isZero()) {
                throw new IllegalArgumentException("Initial delay must be positive");
            }
            this.initialDelay = initialDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            if (maxDelay.isNegative() || maxDelay.isZero()) {
                throw new IllegalArgumentException("Max delay must be positive");
            }
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder multiplier(double multiplier) {
            if (multiplier <= 1.0) {
                throw new IllegalArgumentException("Multiplier must be greater than 1.0");
            }
            this.multiplier = multiplier;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts <= 0) {
                throw new IllegalArgumentException("Max attempts must be positive");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public ReconnectionPolicy build() {
            if (initialDelay == null || maxDelay == null || multiplier == null || maxAttempts == null) {
                throw new IllegalStateException("initialDelay, maxDelay, multiplier and maxAttempts are required");
            }
            if (initialDelay.compareTo(maxDelay) > 0) {
                throw new IllegalArgumentException("Initial delay cannot exceed max delay");
            }
            return new ReconnectionPolicy(initialDelay, maxDelay, multiplier, maxAttempts, clock);
        }
    }
}
