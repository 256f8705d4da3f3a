package in.ticktrader.service.core;

import in.ticktrader.domain.common.DiagnosticEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes diagnostic events to the {@code in.ticktrader.diagnostics} logger.
 */
public final class LoggingDiagnosticEventSink implements DiagnosticEventSink {
    private static final Logger log = LoggerFactory.getLogger("in.ticktrader.diagnostics");

    @Override
    public void publish(DiagnosticEvent event) {
        switch (event.type()) {
            case FEED_UNRECOVERABLE, SESSION_STOPPED, POSITION_OPEN_FAILED ->
                log.warn("[{}] {} {} {}", event.source(), event.type(), event.instrumentId(), event.payload());
            default ->
                log.info("[{}] {} {} {}", event.source(), event.type(), event.instrumentId(), event.payload());
        }
    }
}
