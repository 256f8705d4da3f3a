package in.ticktrader.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * Feed-specific field names and units.
 *
 * {@code timestampField} may be null for feeds that carry no exchange time;
 * arrival time is used then. When it is set, a message without that field
 * yields a tick with no timestamp (skipped downstream).
 */
public record FieldMappingConfig(
    @JsonProperty("priceField")
    String priceField,           // "ltp", "price", "lastPrice"

    @JsonProperty("priceScale")
    BigDecimal priceScale,       // divisor, 100 for paise -> rupees, 1 for none

    @JsonProperty("timestampField")
    String timestampField,

    @JsonProperty("timestampFormat")
    TimestampFormat timestampFormat,

    @JsonProperty("volumeField")
    String volumeField,

    @JsonProperty("instrumentField")
    String instrumentField,

    @JsonProperty("sequenceField")
    String sequenceField
) {
    public enum TimestampFormat {
        EPOCH_MILLIS,
        ISO_8601
    }
}
