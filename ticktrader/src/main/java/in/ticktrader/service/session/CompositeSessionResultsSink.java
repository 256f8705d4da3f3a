package in.ticktrader.service.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Publishes to several sinks; one failing sink does not stop the others.
 */
public final class CompositeSessionResultsSink implements SessionResultsSink {
    private static final Logger log = LoggerFactory.getLogger(CompositeSessionResultsSink.class);

    private final List<SessionResultsSink> sinks;

    public CompositeSessionResultsSink(List<SessionResultsSink> sinks) {
        this.sinks = List.copyOf(sinks);
    }

    @Override
    public void publish(SessionReport report) {
        for (SessionResultsSink sink : sinks) {
            try {
                sink.publish(report);
            } catch (RuntimeException e) {
                log.error("[SESSION] Results sink {} failed", sink.getClass().getSimpleName(), e);
            }
        }
    }
}
