package in.ticktrader.domain.data;

import java.time.Instant;
import java.util.Map;

/**
 * One undecoded message as delivered by a feed source.
 *
 * Fields are the transport-level key/value pairs (JSON object members, CSV
 * columns). Their names and units are feed specific; translation into a
 * {@link Tick} happens in the normalizer.
 */
public record RawMessage(
    Map<String, String> fields,
    Instant receivedAt
) {
    public RawMessage {
        fields = Map.copyOf(fields);
    }

    public String field(String name) {
        return name == null ? null : fields.get(name);
    }
}
