package in.ticktrader.service.core;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Emits the first occurrence of each key, then every Nth.
 *
 * The counter advances only inside {@link #allow(String)}, i.e. on the path
 * that produces the events; nothing else touches it.
 */
public final class CountRateLimiter implements RateLimiter {

    private final int everyN;
    private final Map<String, AtomicLong> counters = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> suppressed = new ConcurrentHashMap<>();

    public CountRateLimiter(int everyN) {
        if (everyN <= 0) {
            throw new IllegalArgumentException("everyN must be positive: " + everyN);
        }
        this.everyN = everyN;
    }

    @Override
    public boolean allow(String key) {
        long n = counters.computeIfAbsent(key, k -> new AtomicLong()).getAndIncrement();
        if (n % everyN == 0) {
            return true;
        }
        suppressed.computeIfAbsent(key, k -> new AtomicLong()).incrementAndGet();
        return false;
    }

    @Override
    public long drainSuppressed(String key) {
        AtomicLong count = suppressed.get(key);
        return count == null ? 0 : count.getAndSet(0);
    }
}
