package in.ticktrader.service.core;

import in.ticktrader.config.DiagnosticsConfig;

import java.time.Clock;
import java.time.Duration;

/**
 * Decides whether a repeated, keyed log line or event may be emitted now.
 *
 * Each implementation is driven by exactly one clock: {@link CountRateLimiter}
 * by calls to {@link #allow(String)} on the path that produces the events,
 * {@link TimeWindowRateLimiter} by wall-clock time. They are never combined.
 */
public interface RateLimiter {

    /**
     * Register one occurrence of {@code key}.
     *
     * @return true if this occurrence should be emitted
     */
    boolean allow(String key);

    /**
     * Occurrences of {@code key} suppressed since the last emitted one.
     * Resets the count.
     */
    long drainSuppressed(String key);

    static RateLimiter fromConfig(DiagnosticsConfig config, Clock clock) {
        return switch (config.rateLimitMode()) {
            case COUNT -> new CountRateLimiter(config.everyNEvents());
            case TIME -> new TimeWindowRateLimiter(Duration.ofMillis(config.minIntervalMs()), clock);
        };
    }
}
