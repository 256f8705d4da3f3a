package in.ticktrader.service.signal;

import in.ticktrader.config.SessionWindowConfig;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;

import static org.junit.jupiter.api.Assertions.*;

class SessionClockTest {

    // 09:15-15:30 IST, 5 min start buffer, 10 min no-trade after open,
    // 10 min end buffer, 15 min no-trade before flatten
    private final SessionClock clock = SessionClock.fromConfig(
        new SessionWindowConfig("Asia/Kolkata", "09:15", "15:30", 5, 10, 10, 15, 3));

    private static Instant ist(String localTime) {
        return OffsetDateTime.parse("2024-01-02T" + localTime + ":00+05:30").toInstant();
    }

    @Test
    void testWindowBoundaries() {
        LocalDate date = LocalDate.of(2024, 1, 2);

        assertEquals(ist("09:15"), clock.sessionStart(date));
        assertEquals(ist("09:25"), clock.entryWindowOpen(date), "larger of start buffer and no-trade period");
        assertEquals(ist("15:20"), clock.flattenAt(date));
        assertEquals(ist("15:05"), clock.entryWindowClose(date));
    }

    @Test
    void testEntryAllowed() {
        assertFalse(clock.isEntryAllowed(ist("09:20")));
        assertTrue(clock.isEntryAllowed(ist("09:25")));
        assertTrue(clock.isEntryAllowed(ist("12:00")));
        assertFalse(clock.isEntryAllowed(ist("15:05")));
    }

    @Test
    void testFlatten() {
        assertFalse(clock.isPastFlatten(ist("15:19")));
        assertTrue(clock.isPastFlatten(ist("15:20")));
        assertTrue(clock.isWithinSession(ist("10:00")));
        assertFalse(clock.isWithinSession(ist("16:00")));
    }

    @Test
    void testTradingDateIsLocal() {
        // 20:00Z on Jan 1 is 01:30 IST on Jan 2
        assertEquals(LocalDate.of(2024, 1, 2), clock.tradingDate(Instant.parse("2024-01-01T20:00:00Z")));
    }
}
