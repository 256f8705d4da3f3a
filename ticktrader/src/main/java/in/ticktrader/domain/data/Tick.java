package in.ticktrader.domain.data;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * A single normalized price observation for one instrument.
 *
 * Immutable. Price and timestamp are optional on purpose: a live feed
 * occasionally delivers payloads without them, and those ticks must reach the
 * decision path so they can be skipped (and counted) there instead of being
 * defaulted to zero or to "now". Accessors return {@link Optional#empty()} for
 * an absent field, never a substitute value.
 */
public final class Tick {

    private final String instrumentId;
    private final BigDecimal price;
    private final Instant timestamp;
    private final Long volume;
    private final Long sequenceHint;

    private Tick(String instrumentId, BigDecimal price, Instant timestamp, Long volume, Long sequenceHint) {
        this.instrumentId = Objects.requireNonNull(instrumentId, "instrumentId");
        this.price = price;
        this.timestamp = timestamp;
        this.volume = volume;
        this.sequenceHint = sequenceHint;
    }

    public static Tick of(String instrumentId, BigDecimal price, Instant timestamp) {
        return new Tick(instrumentId, price, timestamp, null, null);
    }

    public static Tick of(String instrumentId, BigDecimal price, Instant timestamp, Long volume, Long sequenceHint) {
        return new Tick(instrumentId, price, timestamp, volume, sequenceHint);
    }

    public String instrumentId() {
        return instrumentId;
    }

    public Optional<BigDecimal> price() {
        return Optional.ofNullable(price);
    }

    public Optional<Instant> timestamp() {
        return Optional.ofNullable(timestamp);
    }

    public Optional<Long> volume() {
        return Optional.ofNullable(volume);
    }

    public Optional<Long> sequenceHint() {
        return Optional.ofNullable(sequenceHint);
    }

    /**
     * True when both required fields (price, timestamp) are present and the
     * price is strictly positive.
     */
    public boolean isProcessable() {
        return price != null && timestamp != null && price.signum() > 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Tick)) return false;
        Tick other = (Tick) o;
        return instrumentId.equals(other.instrumentId)
            && samePrice(price, other.price)
            && Objects.equals(timestamp, other.timestamp)
            && Objects.equals(volume, other.volume)
            && Objects.equals(sequenceHint, other.sequenceHint);
    }

    @Override
    public int hashCode() {
        return Objects.hash(instrumentId, price == null ? null : price.stripTrailingZeros(),
            timestamp, volume, sequenceHint);
    }

    // 100 and 100.00 are the same price
    private static boolean samePrice(BigDecimal a, BigDecimal b) {
        return a == null ? b == null : b != null && a.compareTo(b) == 0;
    }

    @Override
    public String toString() {
        return "Tick[" + instrumentId
            + ", price=" + (price == null ? "-" : price.toPlainString())
            + ", ts=" + (timestamp == null ? "-" : timestamp)
            + (volume == null ? "" : ", vol=" + volume)
            + (sequenceHint == null ? "" : ", seq=" + sequenceHint)
            + "]";
    }
}
