package in.ticktrader.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

/**
 * Feed adapter, liveness and dispatch timing.
 */
public record FeedConfig(
    @JsonProperty("source")
    FeedSourceConfig source,

    @JsonProperty("queueCapacity")
    Integer queueCapacity,

    @JsonProperty("silenceThresholdMs")
    Long silenceThresholdMs,

    @JsonProperty("livenessCheckIntervalMs")
    Long livenessCheckIntervalMs,

    @JsonProperty("connectTimeoutMs")
    Long connectTimeoutMs,

    @JsonProperty("reconnectInitialDelayMs")
    Long reconnectInitialDelayMs,

    @JsonProperty("reconnectMaxDelayMs")
    Long reconnectMaxDelayMs,

    @JsonProperty("reconnectMultiplier")
    Double reconnectMultiplier,

    @JsonProperty("reconnectMaxAttempts")
    Integer reconnectMaxAttempts,

    @JsonProperty("pollIntervalMs")
    Long pollIntervalMs,

    @JsonProperty("heartbeatIntervalMs")
    Long heartbeatIntervalMs
) {
    public Duration silenceThreshold() {
        return Duration.ofMillis(silenceThresholdMs);
    }

    public Duration livenessCheckInterval() {
        return Duration.ofMillis(livenessCheckIntervalMs);
    }

    public Duration connectTimeout() {
        return Duration.ofMillis(connectTimeoutMs);
    }

    public Duration reconnectInitialDelay() {
        return Duration.ofMillis(reconnectInitialDelayMs);
    }

    public Duration reconnectMaxDelay() {
        return Duration.ofMillis(reconnectMaxDelayMs);
    }

    public Duration pollInterval() {
        return Duration.ofMillis(pollIntervalMs);
    }

    public Duration heartbeatInterval() {
        return Duration.ofMillis(heartbeatIntervalMs);
    }
}
