package in.ticktrader.service.core;

import in.ticktrader.MutableClock;
import in.ticktrader.TestConfigs;
import in.ticktrader.config.DiagnosticsConfig;
import in.ticktrader.config.DiagnosticsConfig.RateLimitMode;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RateLimiterTest {

    @Test
    void testCountLimiterEmitsFirstThenEveryNth() {
        CountRateLimiter limiter = new CountRateLimiter(3);

        assertTrue(limiter.allow("a"));
        assertFalse(limiter.allow("a"));
        assertFalse(limiter.allow("a"));
        assertTrue(limiter.allow("a"));
        assertEquals(2, limiter.drainSuppressed("a"));
        assertEquals(0, limiter.drainSuppressed("a"), "drain resets the count");
    }

    @Test
    void testCountLimiterKeysAreIndependent() {
        CountRateLimiter limiter = new CountRateLimiter(10);

        assertTrue(limiter.allow("a"));
        assertTrue(limiter.allow("b"));
        assertFalse(limiter.allow("a"));
        assertEquals(0, limiter.drainSuppressed("b"));
    }

    @Test
    void testTimeWindowLimiterIgnoresCallCount() {
        MutableClock clock = new MutableClock(TestConfigs.T0);
        TimeWindowRateLimiter limiter = new TimeWindowRateLimiter(Duration.ofSeconds(5), clock);

        assertTrue(limiter.allow("heartbeat"));
        for (int i = 0; i < 100; i++) {
            assertFalse(limiter.allow("heartbeat"));
        }
        clock.advance(Duration.ofMillis(4999));
        assertFalse(limiter.allow("heartbeat"));

        clock.advance(Duration.ofMillis(1));
        assertTrue(limiter.allow("heartbeat"), "window elapsed");
        assertEquals(101, limiter.drainSuppressed("heartbeat"));
    }

    @Test
    void testTimeWindowLimiterEmitsAfterIrregularGap() {
        MutableClock clock = new MutableClock(TestConfigs.T0);
        TimeWindowRateLimiter limiter = new TimeWindowRateLimiter(Duration.ofSeconds(1), clock);

        assertTrue(limiter.allow("k"));
        clock.advance(Duration.ofMinutes(10));
        assertTrue(limiter.allow("k"));
    }

    @Test
    void testFromConfigPicksOneClock() {
        MutableClock clock = new MutableClock(TestConfigs.T0);

        assertInstanceOf(CountRateLimiter.class,
            RateLimiter.fromConfig(new DiagnosticsConfig(RateLimitMode.COUNT, 5, null), clock));
        assertInstanceOf(TimeWindowRateLimiter.class,
            RateLimiter.fromConfig(new DiagnosticsConfig(RateLimitMode.TIME, null, 1000L), clock));
    }

    @Test
    void testInvalidParametersRejected() {
        assertThrows(IllegalArgumentException.class, () -> new CountRateLimiter(0));
        assertThrows(IllegalArgumentException.class,
            () -> new TimeWindowRateLimiter(Duration.ZERO, new MutableClock(TestConfigs.T0)));
    }
}
