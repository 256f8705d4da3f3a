package in.ticktrader.service.core;

import in.ticktrader.domain.common.DiagnosticEvent;
import in.ticktrader.domain.common.EventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Front door for diagnostic events.
 *
 * High-frequency types (see {@link EventType#isRateLimited()}) pass through
 * the session's {@link RateLimiter}; an emitted event carries the number of
 * events of its type suppressed since the previous one under
 * {@code "suppressed"}. Every other type is always emitted.
 *
 * A failing sink is logged and otherwise ignored: diagnostics never affect
 * control flow.
 */
public final class DiagnosticEmitter {
    private static final Logger log = LoggerFactory.getLogger(DiagnosticEmitter.class);

    private final DiagnosticEventSink sink;
    private final RateLimiter limiter;

    public DiagnosticEmitter(DiagnosticEventSink sink, RateLimiter limiter) {
        this.sink = sink;
        this.limiter = limiter;
    }

    /**
     * @return true if the event reached the sink
     */
    public boolean emit(EventType type, String instrumentId, Instant timestamp, String source,
                        Map<String, Object> payload) {
        Map<String, Object> body = new LinkedHashMap<>();
        payload.forEach((k, v) -> {
            if (v != null) {
                body.put(k, v);
            }
        });
        if (type.isRateLimited()) {
            if (!limiter.allow(type.name())) {
                return false;
            }
            long dropped = limiter.drainSuppressed(type.name());
            if (dropped > 0) {
                body.put("suppressed", dropped);
            }
        }
        try {
            sink.publish(new DiagnosticEvent(type, instrumentId, timestamp, source, body));
            return true;
        } catch (RuntimeException e) {
            log.warn("Diagnostic sink failed for {}: {}", type, e.getMessage(), e);
            return false;
        }
    }
}
