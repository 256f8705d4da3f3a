package in.ticktrader.infrastructure.feed.metrics;

import in.ticktrader.domain.feed.FeedStatus;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import io.prometheus.client.exporter.common.TextFormat;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.time.Duration;

/**
 * Prometheus implementation of FeedMetrics.
 *
 * Key Metrics:
 * - feed_ticks_received_total{instrument}
 * - feed_ticks_evicted_total{instrument} - queue overflow evictions
 * - feed_format_errors_total{feed}
 * - feed_callback_faults_total{instrument}
 * - feed_reconnect_attempts_total{feed, result}
 * - feed_status{feed} - ordinal of FeedStatus
 * - feed_decision_latency_seconds{instrument} - arrival to decision
 */
public class PrometheusFeedMetrics implements FeedMetrics {

    private final CollectorRegistry registry;

    private final Counter ticksReceived;
    private final Counter ticksEvicted;
    private final Counter formatErrors;
    private final Counter callbackFaults;
    private final Counter reconnectAttempts;
    private final Gauge status;
    private final Histogram decisionLatency;

    public PrometheusFeedMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusFeedMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.ticksReceived = Counter.build()
            .name("feed_ticks_received_total")
            .help("Ticks received from the feed source")
            .labelNames("instrument")
            .register(registry);

        this.ticksEvicted = Counter.build()
            .name("feed_ticks_evicted_total")
            .help("Ticks evicted from the bounded queue on overflow")
            .labelNames("instrument")
            .register(registry);

        this.formatErrors = Counter.build()
            .name("feed_format_errors_total")
            .help("Raw messages that could not be normalized")
            .labelNames("feed")
            .register(registry);

        this.callbackFaults = Counter.build()
            .name("feed_callback_faults_total")
            .help("Exceptions thrown by the registered tick callback")
            .labelNames("instrument")
            .register(registry);

        this.reconnectAttempts = Counter.build()
            .name("feed_reconnect_attempts_total")
            .help("Reconnect attempts by result")
            .labelNames("feed", "result")
            .register(registry);

        this.status = Gauge.build()
            .name("feed_status")
            .help("Feed status (0=DISCONNECTED, 1=CONNECTING, 2=STREAMING, 3=SILENT, 4=RECONNECTING)")
            .labelNames("feed")
            .register(registry);

        this.decisionLatency = Histogram.build()
            .name("feed_decision_latency_seconds")
            .help("Tick arrival to end of decision")
            .labelNames("instrument")
            .buckets(0.0005, 0.001, 0.005, 0.01, 0.025, 0.05, 0.1, 0.25, 1.0)
            .register(registry);
    }

    @Override
    public void recordTickReceived(String instrumentId) {
        ticksReceived.labels(instrumentId).inc();
    }

    @Override
    public void recordTickEvicted(String instrumentId) {
        ticksEvicted.labels(instrumentId).inc();
    }

    @Override
    public void recordFormatError(String feedId) {
        formatErrors.labels(feedId).inc();
    }

    @Override
    public void recordCallbackFault(String instrumentId) {
        callbackFaults.labels(instrumentId).inc();
    }

    @Override
    public void recordReconnectAttempt(String feedId, boolean success) {
        reconnectAttempts.labels(feedId, success ? "success" : "failure").inc();
    }

    @Override
    public void recordStatus(String feedId, FeedStatus feedStatus) {
        status.labels(feedId).set(feedStatus.ordinal());
    }

    @Override
    public void recordDecisionLatency(String instrumentId, Duration latency) {
        decisionLatency.labels(instrumentId).observe(latency.toNanos() / 1_000_000_000.0);
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }

    /**
     * Current values in the Prometheus text exposition format.
     */
    public String scrape() {
        StringWriter writer = new StringWriter();
        try {
            TextFormat.write004(writer, registry.metricFamilySamples());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return writer.toString();
    }
}
