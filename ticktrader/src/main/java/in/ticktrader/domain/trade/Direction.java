package in.ticktrader.domain.trade;

import java.math.BigDecimal;

/**
 * Position side.
 */
public enum Direction {
    LONG,
    SHORT;

    /**
     * +1 for LONG, -1 for SHORT. Multiply a raw price move by this to get the
     * move in the position's favor.
     */
    public BigDecimal sign() {
        return this == LONG ? BigDecimal.ONE : BigDecimal.ONE.negate();
    }

    /**
     * Price moved {@code offset} points in this side's favor from {@code from}.
     */
    public BigDecimal favorable(BigDecimal from, BigDecimal offset) {
        return this == LONG ? from.add(offset) : from.subtract(offset);
    }

    /**
     * Price moved {@code offset} points against this side from {@code from}.
     */
    public BigDecimal adverse(BigDecimal from, BigDecimal offset) {
        return this == LONG ? from.subtract(offset) : from.add(offset);
    }

    /**
     * True when {@code price} is at or beyond {@code level} in the position's favor.
     */
    public boolean reached(BigDecimal price, BigDecimal level) {
        int cmp = price.compareTo(level);
        return this == LONG ? cmp >= 0 : cmp <= 0;
    }

    /**
     * True when {@code price} is at or beyond {@code stop} against the position.
     */
    public boolean breached(BigDecimal price, BigDecimal stop) {
        int cmp = price.compareTo(stop);
        return this == LONG ? cmp <= 0 : cmp >= 0;
    }
}
