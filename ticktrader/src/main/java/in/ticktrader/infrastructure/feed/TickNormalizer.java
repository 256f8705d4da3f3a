package in.ticktrader.infrastructure.feed;

import in.ticktrader.config.FieldMappingConfig;
import in.ticktrader.config.FieldMappingConfig.TimestampFormat;
import in.ticktrader.domain.data.RawMessage;
import in.ticktrader.domain.data.Tick;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

/**
 * Translates feed-specific raw messages into {@link Tick}s.
 *
 * Absent fields stay absent: a message without the price field becomes a tick
 * with no price, which the decision path skips and counts. A field that is
 * present but unparseable is a {@link FeedFormatException}.
 */
public final class TickNormalizer {

    private final FieldMappingConfig mapping;
    private final String defaultInstrumentId;

    public TickNormalizer(FieldMappingConfig mapping, String defaultInstrumentId) {
        this.mapping = mapping;
        this.defaultInstrumentId = defaultInstrumentId;
    }

    public Tick normalize(RawMessage raw) {
        String instrument = mapping.instrumentField() == null ? null : raw.field(mapping.instrumentField());
        if (instrument == null || instrument.isBlank()) {
            instrument = defaultInstrumentId;
        }
        return Tick.of(instrument, price(raw), timestamp(raw), volume(raw), sequence(raw));
    }

    private BigDecimal price(RawMessage raw) {
        String value = raw.field(mapping.priceField());
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            BigDecimal scaled = new BigDecimal(value.trim());
            if (mapping.priceScale().compareTo(BigDecimal.ONE) != 0) {
                scaled = scaled.divide(mapping.priceScale(), MathContext.DECIMAL64);
            }
            return scaled.stripTrailingZeros();
        } catch (NumberFormatException e) {
            throw new FeedFormatException("bad " + mapping.priceField() + " value '" + value + "'", e);
        }
    }

    private Instant timestamp(RawMessage raw) {
        if (mapping.timestampField() == null) {
            return raw.receivedAt();
        }
        String value = raw.field(mapping.timestampField());
        if (value == null || value.isBlank()) {
            return null;
        }
        String v = value.trim();
        try {
            if (mapping.timestampFormat() == TimestampFormat.EPOCH_MILLIS) {
                return Instant.ofEpochMilli(new BigDecimal(v).longValue());
            }
            try {
                return Instant.parse(v);
            } catch (DateTimeParseException e) {
                return OffsetDateTime.parse(v).toInstant();
            }
        } catch (NumberFormatException | DateTimeParseException e) {
            throw new FeedFormatException("bad " + mapping.timestampField() + " value '" + value + "'", e);
        }
    }

    private Long volume(RawMessage raw) {
        return optionalLong(raw, mapping.volumeField());
    }

    private Long sequence(RawMessage raw) {
        return optionalLong(raw, mapping.sequenceField());
    }

    private static Long optionalLong(RawMessage raw, String field) {
        if (field == null) {
            return null;
        }
        String value = raw.field(field);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return new BigDecimal(value.trim()).longValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw new FeedFormatException("bad " + field + " value '" + value + "'", e);
        }
    }
}
