package in.ticktrader.domain.signal;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Decision produced for a single tick. Transient, never stored.
 */
public record Signal(
    SignalAction action,
    BigDecimal price,
    String reason,
    Instant timestamp
) {
    public static Signal enterLong(BigDecimal price, String reason, Instant timestamp) {
        return new Signal(SignalAction.ENTER_LONG, price, reason, timestamp);
    }

    public static Signal enterShort(BigDecimal price, String reason, Instant timestamp) {
        return new Signal(SignalAction.ENTER_SHORT, price, reason, timestamp);
    }

    public static Signal close(BigDecimal price, String reason, Instant timestamp) {
        return new Signal(SignalAction.CLOSE, price, reason, timestamp);
    }
}
