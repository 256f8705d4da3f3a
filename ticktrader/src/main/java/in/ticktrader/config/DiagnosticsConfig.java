package in.ticktrader.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Rate limiting of high-frequency diagnostic events.
 *
 * COUNT emits every Nth event of a type; TIME emits at most one event of a
 * type per interval. The two are never combined.
 */
public record DiagnosticsConfig(
    @JsonProperty("rateLimitMode")
    RateLimitMode rateLimitMode,

    @JsonProperty("everyNEvents")
    Integer everyNEvents,

    @JsonProperty("minIntervalMs")
    Long minIntervalMs
) {
    public enum RateLimitMode {
        COUNT,
        TIME
    }
}
