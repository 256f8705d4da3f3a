package in.ticktrader.service.signal.indicator;

/**
 * Exponential moving average updated one value at a time.
 *
 * Seeded with the simple average of the first {@code period} values, then
 * smoothed with {@code alpha = 2 / (period + 1)}. Not ready until seeded.
 */
public final class IncrementalEma {

    private final int period;
    private final double alpha;

    private int count = 0;
    private double seedSum = 0.0;
    private double value = Double.NaN;

    public IncrementalEma(int period) {
        if (period <= 0) {
            throw new IllegalArgumentException("EMA period must be positive: " + period);
        }
        this.period = period;
        this.alpha = 2.0 / (period + 1);
    }

    public double update(double x) {
        count++;
        if (count < period) {
            seedSum += x;
        } else if (count == period) {
            seedSum += x;
            value = seedSum / period;
        } else {
            value = value + alpha * (x - value);
        }
        return value;
    }

    public boolean isReady() {
        return count >= period;
    }

    /**
     * @return current value, NaN until ready
     */
    public double value() {
        return value;
    }

    public int period() {
        return period;
    }
}
