package in.ticktrader.service.signal.indicator;

/**
 * MACD line (fast EMA - slow EMA), its signal EMA and the histogram.
 */
public final class Macd {

    private final IncrementalEma fast;
    private final IncrementalEma slow;
    private final IncrementalEma signal;

    public Macd(int fastPeriod, int slowPeriod, int signalPeriod) {
        this.fast = new IncrementalEma(fastPeriod);
        this.slow = new IncrementalEma(slowPeriod);
        this.signal = new IncrementalEma(signalPeriod);
    }

    public void update(double price) {
        fast.update(price);
        slow.update(price);
        if (fast.isReady() && slow.isReady()) {
            signal.update(line());
        }
    }

    public boolean isReady() {
        return signal.isReady();
    }

    public double line() {
        return fast.value() - slow.value();
    }

    public double signal() {
        return signal.value();
    }

    public double histogram() {
        return isReady() ? line() - signal.value() : Double.NaN;
    }
}
