package in.ticktrader.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Where ticks come from.
 */
public record FeedSourceConfig(
    @JsonProperty("type")
    FeedSourceType type,

    @JsonProperty("relayUrl")
    String relayUrl,             // ws://host:port/ticks?token=...

    @JsonProperty("filePath")
    String filePath,             // CSV replay file

    @JsonProperty("replaySpeed")
    ReplaySpeed replaySpeed,

    @JsonProperty("mapping")
    FieldMappingConfig mapping
) {
    public enum FeedSourceType {
        RELAY,
        FILE
    }

    /**
     * Replay pacing, delay between consecutive file ticks.
     */
    public enum ReplaySpeed {
        REALTIME(50),   // ~20 ticks/s
        FAST(10),       // ~100 ticks/s
        TURBO(2),       // ~500 ticks/s
        MAX(0, 100),    // ~10000 ticks/s
        INSTANT(0);

        private final long delayMillis;
        private final int delayMicros;

        ReplaySpeed(long delayMillis) {
            this(delayMillis, 0);
        }

        ReplaySpeed(long delayMillis, int delayMicros) {
            this.delayMillis = delayMillis;
            this.delayMicros = delayMicros;
        }

        public long delayNanos() {
            return delayMillis * 1_000_000L + delayMicros * 1_000L;
        }
    }
}
