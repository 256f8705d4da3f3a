package in.ticktrader.service.session;

/**
 * External consumer of the final session report (file export, dashboard).
 */
public interface SessionResultsSink {

    void publish(SessionReport report);
}
