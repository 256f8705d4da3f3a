package in.ticktrader.bootstrap;

import in.ticktrader.config.SessionConfig;
import in.ticktrader.config.SessionConfigLoader;
import in.ticktrader.config.SessionConfigValidator;
import in.ticktrader.infrastructure.feed.FeedSource;
import in.ticktrader.infrastructure.feed.FeedSources;
import in.ticktrader.infrastructure.feed.TickNormalizer;
import in.ticktrader.infrastructure.feed.common.ReconnectionPolicy;
import in.ticktrader.infrastructure.feed.metrics.PrometheusFeedMetrics;
import in.ticktrader.service.core.DiagnosticEmitter;
import in.ticktrader.service.core.LoggingDiagnosticEventSink;
import in.ticktrader.service.core.RateLimiter;
import in.ticktrader.service.feed.FeedAdapter;
import in.ticktrader.service.risk.RiskManager;
import in.ticktrader.service.session.CompositeSessionResultsSink;
import in.ticktrader.service.session.JsonFileSessionResultsSink;
import in.ticktrader.service.session.LoggingSessionResultsSink;
import in.ticktrader.service.session.SessionController;
import in.ticktrader.service.session.SessionReport;
import in.ticktrader.service.session.SessionResultsSink;
import in.ticktrader.service.signal.IndicatorDecisionEngine;
import in.ticktrader.util.Env;
import io.prometheus.client.CollectorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Entry point: one session per process.
 *
 * Usage: {@code java -jar ticktrader.jar [config.json]}. Without an argument
 * the path comes from {@code TICKTRADER_CONFIG} (default {@code ticktrader.json}).
 * {@code TICKTRADER_REPORT_DIR} enables the JSON report file.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    static final String REPORT_DIR_KEY = "TICKTRADER_REPORT_DIR";

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== TickTrader Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        // ═══════════════════════════════════════════════════════════════
        // ✅ STARTUP VALIDATION GATE
        // ═══════════════════════════════════════════════════════════════
        SessionConfig config;
        try {
            SessionConfigLoader loader = new SessionConfigLoader();
            config = args.length > 0 ? loader.load(Path.of(args[0])) : loader.loadDefault();
            SessionConfigValidator.validate(config);
        } catch (IllegalStateException e) {
            log.error("❌ STARTUP VALIDATION FAILED", e);
            System.err.println("\n" + e.getMessage() + "\n");
            System.exit(1);
            return;
        }

        SessionController session = wire(config, Clock.systemUTC());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("[SESSION] Shutdown signal received");
            try {
                session.stop().get(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (ExecutionException | TimeoutException e) {
                log.error("❌ Session did not stop cleanly: {}", e.getMessage());
            }
        }, "shutdown-hook"));

        try {
            SessionReport report = session.start().get();
            log.info("=== TickTrader Stopped: {} ===", report.terminalMessage());
            System.exit(report.stopReason().isFault() ? 2 : 0);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            session.stop();
        } catch (ExecutionException e) {
            log.error("❌ Session failed", e.getCause());
            System.exit(3);
        }
    }

    static SessionController wire(SessionConfig config, Clock clock) {
        return wire(config, clock, CollectorRegistry.defaultRegistry);
    }

    /**
     * Build every collaborator for one session. Only the metrics registry is shared.
     */
    static SessionController wire(SessionConfig config, Clock clock, CollectorRegistry registry) {
        String instrumentId = config.instrument().instrumentId();

        // ═══════════════════════════════════════════════════════════════
        // Prometheus Metrics
        // ═══════════════════════════════════════════════════════════════
        PrometheusFeedMetrics metrics = new PrometheusFeedMetrics(registry);
        log.info("✓ Prometheus metrics initialized");

        // ═══════════════════════════════════════════════════════════════
        // Diagnostics
        // ═══════════════════════════════════════════════════════════════
        DiagnosticEmitter diagnostics = new DiagnosticEmitter(
            new LoggingDiagnosticEventSink(), RateLimiter.fromConfig(config.diagnostics(), clock));

        // ═══════════════════════════════════════════════════════════════
        // Feed
        // ═══════════════════════════════════════════════════════════════
        FeedSource source = FeedSources.create(config.feed(), clock);
        FeedAdapter feed = new FeedAdapter(
            source,
            new TickNormalizer(config.feed().source().mapping(), instrumentId),
            instrumentId,
            FeedAdapter.Settings.fromConfig(config.feed()),
            ReconnectionPolicy.fromConfig(config.feed(), clock),
            metrics,
            clock);
        log.info("✓ Feed adapter ready: {} ({})", source.id(), config.consumptionMode());

        // ═══════════════════════════════════════════════════════════════
        // Decision + risk
        // ═══════════════════════════════════════════════════════════════
        IndicatorDecisionEngine engine = IndicatorDecisionEngine.fromConfig(config, diagnostics);
        RiskManager risk = RiskManager.fromConfig(config, diagnostics, clock);

        // ═══════════════════════════════════════════════════════════════
        // Results
        // ═══════════════════════════════════════════════════════════════
        List<SessionResultsSink> sinks = new ArrayList<>();
        sinks.add(new LoggingSessionResultsSink());
        Env.path(REPORT_DIR_KEY).ifPresent(dir -> {
            sinks.add(new JsonFileSessionResultsSink(dir));
            log.info("✓ Session report directory: {}", dir);
        });

        return new SessionController(config, feed, engine, risk, metrics,
            new CompositeSessionResultsSink(sinks), diagnostics, clock);
    }

    private App() {}
}
