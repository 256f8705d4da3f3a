package in.ticktrader.service.signal.indicator;

/**
 * Average tick range: Wilder-smoothed absolute change between consecutive
 * ticks. The tick-level stand-in for a candle ATR.
 */
public final class TickAtr {

    private final int length;

    private double previous = Double.NaN;
    private int samples = 0;
    private double value = 0.0;

    public TickAtr(int length) {
        if (length <= 0) {
            throw new IllegalArgumentException("ATR length must be positive: " + length);
        }
        this.length = length;
    }

    public double update(double price) {
        if (!Double.isNaN(previous)) {
            double range = Math.abs(price - previous);
            samples++;
            if (samples <= length) {
                value += range / length;
            } else {
                value = (value * (length - 1) + range) / length;
            }
        }
        previous = price;
        return value();
    }

    public boolean isReady() {
        return samples >= length;
    }

    public double value() {
        return isReady() ? value : Double.NaN;
    }
}
