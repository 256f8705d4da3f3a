package in.ticktrader.service.signal.indicator;

/**
 * Volume-weighted average price since the last reset.
 *
 * Ticks without volume are weighted 1 so a volume-less feed degrades to a
 * plain running mean instead of stalling.
 */
public final class SessionVwap {

    private double priceVolume = 0.0;
    private double volume = 0.0;

    public double update(double price, Long tickVolume) {
        double weight = tickVolume == null || tickVolume <= 0 ? 1.0 : tickVolume;
        priceVolume += price * weight;
        volume += weight;
        return value();
    }

    public void reset() {
        priceVolume = 0.0;
        volume = 0.0;
    }

    public boolean isReady() {
        return volume > 0;
    }

    public double value() {
        return volume > 0 ? priceVolume / volume : Double.NaN;
    }
}
