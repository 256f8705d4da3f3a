package in.ticktrader.domain.common;

import java.time.Instant;
import java.util.Map;

/**
 * Structured diagnostic event. Payload keys are stable per type.
 */
public record DiagnosticEvent(
    EventType type,
    String instrumentId,
    Instant timestamp,
    String source,
    Map<String, Object> payload
) {
    public DiagnosticEvent {
        payload = Map.copyOf(payload);
    }
}
