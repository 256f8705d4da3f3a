package in.ticktrader.service.signal.indicator;

/**
 * Relative strength index with Wilder smoothing, tick to tick.
 *
 * The first {@code length} changes seed simple averages of gains and losses;
 * after that: avg = (avg * (n - 1) + current) / n.
 */
public final class WilderRsi {

    private final int length;

    private double previous = Double.NaN;
    private int changes = 0;
    private double avgGain = 0.0;
    private double avgLoss = 0.0;

    public WilderRsi(int length) {
        if (length <= 0) {
            throw new IllegalArgumentException("RSI length must be positive: " + length);
        }
        this.length = length;
    }

    public double update(double price) {
        if (!Double.isNaN(previous)) {
            double change = price - previous;
            double gain = Math.max(change, 0.0);
            double loss = Math.max(-change, 0.0);
            changes++;
            if (changes <= length) {
                avgGain += gain / length;
                avgLoss += loss / length;
            } else {
                avgGain = (avgGain * (length - 1) + gain) / length;
                avgLoss = (avgLoss * (length - 1) + loss) / length;
            }
        }
        previous = price;
        return value();
    }

    public boolean isReady() {
        return changes >= length;
    }

    /**
     * @return RSI in 0..100, NaN until ready
     */
    public double value() {
        if (!isReady()) {
            return Double.NaN;
        }
        if (avgLoss == 0.0) {
            return avgGain == 0.0 ? 50.0 : 100.0;
        }
        double rs = avgGain / avgLoss;
        return 100.0 - 100.0 / (1.0 + rs);
    }
}
