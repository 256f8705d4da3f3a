package in.ticktrader.service.signal.indicator;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Counts consecutive rising and falling ticks.
 *
 * With the noise filter on, a move counts only if it exceeds
 * {@code max(tickSize * minTicks, previous * percentage)}; a move inside that
 * band leaves both counters as they are. A counted move in one direction
 * resets the other counter.
 */
public final class ConsecutiveTickCounter {

    private final boolean noiseFilter;
    private final BigDecimal minTicksThreshold;
    private final BigDecimal percentage;

    private BigDecimal previous;
    private int rising = 0;
    private int falling = 0;

    public ConsecutiveTickCounter(boolean noiseFilter, BigDecimal tickSize, double minTicks, double percentage) {
        this.noiseFilter = noiseFilter;
        this.minTicksThreshold = noiseFilter ? tickSize.multiply(BigDecimal.valueOf(minTicks)) : BigDecimal.ZERO;
        this.percentage = noiseFilter ? BigDecimal.valueOf(percentage) : BigDecimal.ZERO;
    }

    public static ConsecutiveTickCounter unfiltered() {
        return new ConsecutiveTickCounter(false, BigDecimal.ZERO, 0, 0);
    }

    public void update(BigDecimal price) {
        if (previous != null) {
            BigDecimal move = price.subtract(previous);
            BigDecimal threshold = threshold(previous);
            if (move.signum() > 0 && move.compareTo(threshold) > 0) {
                rising++;
                falling = 0;
            } else if (move.signum() < 0 && move.negate().compareTo(threshold) > 0) {
                falling++;
                rising = 0;
            } else if (!noiseFilter) {
                // Unchanged price breaks a run when there is no noise band.
                rising = 0;
                falling = 0;
            }
        }
        previous = price;
    }

    public void reset() {
        rising = 0;
        falling = 0;
    }

    public int rising() {
        return rising;
    }

    public int falling() {
        return falling;
    }

    private BigDecimal threshold(BigDecimal prev) {
        if (!noiseFilter) {
            return BigDecimal.ZERO;
        }
        BigDecimal relative = prev.multiply(percentage, MathContext.DECIMAL64);
        return relative.max(minTicksThreshold);
    }
}
