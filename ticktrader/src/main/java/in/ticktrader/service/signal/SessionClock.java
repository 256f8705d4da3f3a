package in.ticktrader.service.signal;

import in.ticktrader.config.SessionWindowConfig;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Session Clock - trading window boundaries for one configured session.
 *
 * Session:      start ............................................ end
 * Entries:          |start + max(startBuffer, noTradeStart)
 *                                     flatten - noTradeEnd|
 * Flatten:                                        end - endBuffer|
 *
 * All boundaries are computed for the tick's local date in the session zone.
 */
public final class SessionClock {

    private final ZoneId zone;
    private final LocalTime start;
    private final LocalTime end;
    private final Duration entryDelay;
    private final Duration endBuffer;
    private final Duration noTradeEnd;

    public SessionClock(ZoneId zone, LocalTime start, LocalTime end,
                        Duration startBuffer, Duration endBuffer,
                        Duration noTradeStart, Duration noTradeEnd) {
        this.zone = zone;
        this.start = start;
        this.end = end;
        this.entryDelay = startBuffer.compareTo(noTradeStart) >= 0 ? startBuffer : noTradeStart;
        this.endBuffer = endBuffer;
        this.noTradeEnd = noTradeEnd;
    }

    public static SessionClock fromConfig(SessionWindowConfig c) {
        return new SessionClock(
            c.zone(), c.start(), c.end(),
            Duration.ofMinutes(c.startBufferMinutes()),
            Duration.ofMinutes(c.endBufferMinutes()),
            Duration.ofMinutes(c.noTradeStartMinutes()),
            Duration.ofMinutes(c.noTradeEndMinutes()));
    }

    public ZoneId zone() {
        return zone;
    }

    /**
     * Local trading date of a timestamp.
     */
    public LocalDate tradingDate(Instant timestamp) {
        return timestamp.atZone(zone).toLocalDate();
    }

    public Instant sessionStart(LocalDate date) {
        return ZonedDateTime.of(date, start, zone).toInstant();
    }

    public Instant sessionEnd(LocalDate date) {
        return ZonedDateTime.of(date, end, zone).toInstant();
    }

    /**
     * Time from which open positions must be closed.
     */
    public Instant flattenAt(LocalDate date) {
        return sessionEnd(date).minus(endBuffer);
    }

    public Instant entryWindowOpen(LocalDate date) {
        return sessionStart(date).plus(entryDelay);
    }

    public Instant entryWindowClose(LocalDate date) {
        return flattenAt(date).minus(noTradeEnd);
    }

    public boolean isWithinSession(Instant timestamp) {
        LocalDate date = tradingDate(timestamp);
        return !timestamp.isBefore(sessionStart(date)) && !timestamp.isAfter(sessionEnd(date));
    }

    /**
     * True when a new position may be opened at this time.
     */
    public boolean isEntryAllowed(Instant timestamp) {
        LocalDate date = tradingDate(timestamp);
        return !timestamp.isBefore(entryWindowOpen(date)) && timestamp.isBefore(entryWindowClose(date));
    }

    /**
     * True at or after the flatten time of the timestamp's date.
     */
    public boolean isPastFlatten(Instant timestamp) {
        return !timestamp.isBefore(flattenAt(tradingDate(timestamp)));
    }

    /**
     * Format timestamp in the session zone for logging.
     */
    public String format(Instant timestamp) {
        return timestamp.atZone(zone).toString();
    }
}
