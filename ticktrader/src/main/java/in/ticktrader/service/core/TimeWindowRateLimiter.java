package in.ticktrader.service.core;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Emits at most one occurrence of each key per wall-clock window, regardless
 * of how many occurrences arrive or how irregularly.
 */
public final class TimeWindowRateLimiter implements RateLimiter {

    private final Duration window;
    private final Clock clock;
    private final Map<String, Instant> lastEmitted = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> suppressed = new ConcurrentHashMap<>();

    public TimeWindowRateLimiter(Duration window, Clock clock) {
        if (window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be positive: " + window);
        }
        this.window = window;
        this.clock = clock;
    }

    @Override
    public boolean allow(String key) {
        Instant now = clock.instant();
        AtomicBoolean granted = new AtomicBoolean(false);
        lastEmitted.compute(key, (k, last) -> {
            if (last == null || !now.isBefore(last.plus(window))) {
                granted.set(true);
                return now;
            }
            return last;
        });
        if (!granted.get()) {
            suppressed.computeIfAbsent(key, k -> new AtomicLong()).incrementAndGet();
        }
        return granted.get();
    }

    @Override
    public long drainSuppressed(String key) {
        AtomicLong count = suppressed.get(key);
        return count == null ? 0 : count.getAndSet(0);
    }
}
