package in.ticktrader.service.core;

import in.ticktrader.domain.common.DiagnosticEvent;

/**
 * External consumer of diagnostic events (log shipper, dashboard, test probe).
 */
public interface DiagnosticEventSink {

    void publish(DiagnosticEvent event);
}
