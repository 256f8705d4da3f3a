package in.ticktrader.service.session;

import in.ticktrader.config.SessionConfig;
import in.ticktrader.config.SessionConfigValidator;
import in.ticktrader.domain.common.EventType;
import in.ticktrader.domain.data.Tick;
import in.ticktrader.domain.feed.ConsumptionMode;
import in.ticktrader.domain.feed.FeedConnectionState;
import in.ticktrader.domain.signal.Signal;
import in.ticktrader.domain.signal.SignalAction;
import in.ticktrader.domain.trade.ExitReason;
import in.ticktrader.domain.trade.OpenResult;
import in.ticktrader.domain.trade.PositionSnapshot;
import in.ticktrader.infrastructure.feed.metrics.FeedMetrics;
import in.ticktrader.service.core.DiagnosticEmitter;
import in.ticktrader.service.dispatch.TickDispatcher;
import in.ticktrader.service.dispatch.TickDispatchers;
import in.ticktrader.service.feed.ConnectResult;
import in.ticktrader.service.feed.FeedAdapter;
import in.ticktrader.service.feed.FeedEventListener;
import in.ticktrader.service.risk.PositionListener;
import in.ticktrader.service.risk.RiskManager;
import in.ticktrader.service.risk.SizingInputs;
import in.ticktrader.service.signal.DecisionEngine;
import in.ticktrader.service.signal.SessionClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns one trading session: connects the feed, runs the dispatcher, routes
 * every tick through the decision engine and the risk manager, and shuts the
 * whole thing down in order.
 *
 * <p>Tick processing is serialized by {@code tickLock}, so the engine and the
 * risk manager see one tick at a time in either consumption mode. A stop
 * request only raises a flag; the orchestration thread performs the stop once
 * the dispatcher has returned, and waits for any tick in flight.
 *
 * <p>Stop sequence: refuse new entries, close an open position with
 * {@link ExitReason#SESSION_STOP}, disconnect the feed, publish the
 * {@link SessionReport}, emit {@link EventType#SESSION_STOPPED}. The first
 * stop reason wins; later requests are ignored.
 *
 * <p>The config is validated on construction; an invalid one throws
 * {@link IllegalStateException} before anything is wired.
 */
public final class SessionController implements FeedEventListener, PositionListener {
    private static final Logger log = LoggerFactory.getLogger(SessionController.class);

    private record StopRequest(StopReason reason, String detail) {}

    private final String instrumentId;
    private final ConsumptionMode mode;
    private final BigDecimal initialCapital;
    private final SizingInputs sizing;
    private final SessionClock sessionClock;
    private final FeedAdapter feed;
    private final DecisionEngine engine;
    private final RiskManager risk;
    private final TickDispatcher dispatcher;
    private final SessionResultsSink resultsSink;
    private final DiagnosticEmitter diagnostics;
    private final Clock clock;

    private final ReentrantLock tickLock = new ReentrantLock();
    private final ErrorStreakTracker errorStreak;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean finished = new AtomicBoolean(false);
    private final AtomicReference<StopRequest> stopRequest = new AtomicReference<>();
    private final CompletableFuture<SessionReport> completion = new CompletableFuture<>();

    private volatile boolean stopRequested = false;
    private volatile Instant startedAt;
    private volatile String sessionId;

    // Guarded by tickLock
    private boolean stopped = false;
    private long ticksProcessed = 0;
    private long malformedTicks = 0;
    private long processingErrors = 0;

    public SessionController(SessionConfig config, FeedAdapter feed, DecisionEngine engine, RiskManager risk,
                             FeedMetrics metrics, SessionResultsSink resultsSink,
                             DiagnosticEmitter diagnostics, Clock clock) {
        SessionConfigValidator.validate(config);
        this.instrumentId = config.instrument().instrumentId();
        this.mode = config.consumptionMode();
        this.initialCapital = config.capital().initialCapital();
        this.sizing = SizingInputs.fromConfig(config.instrument());
        this.sessionClock = SessionClock.fromConfig(config.session());
        this.feed = feed;
        this.engine = engine;
        this.risk = risk;
        this.resultsSink = resultsSink;
        this.diagnostics = diagnostics;
        this.clock = clock;
        this.errorStreak = new ErrorStreakTracker(config.strategy().errorStreakThreshold());
        this.dispatcher = TickDispatchers.forMode(mode, feed, this::processTick, instrumentId,
            config.feed(), metrics, clock);

        feed.addListener(this);
        risk.addListener(this);
    }

    // ═══════════════════════════════════════════════════════════════
    // LIFECYCLE
    // ═══════════════════════════════════════════════════════════════

    /**
     * Start the session on its own orchestration thread.
     *
     * @return completes with the report once the session has stopped
     * @throws IllegalStateException if the session was already started
     */
    public CompletableFuture<SessionReport> start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Session for " + instrumentId + " already started");
        }
        markStarted();
        Thread t = new Thread(this::runSession, "session-" + instrumentId);
        t.start();
        return completion;
    }

    /**
     * Operator stop. Idempotent.
     */
    public CompletableFuture<SessionReport> stop() {
        return stop(StopReason.OPERATOR_STOP, null);
    }

    /**
     * Request a stop. A session that was never started is finalized on the
     * calling thread; otherwise the orchestration thread finalizes it.
     */
    public CompletableFuture<SessionReport> stop(StopReason reason, String detail) {
        requestStop(reason, detail);
        if (started.compareAndSet(false, true)) {
            markStarted();
            finish();
        }
        return completion;
    }

    public CompletableFuture<SessionReport> completion() {
        return completion;
    }

    public boolean isStopRequested() {
        return stopRequested;
    }

    /**
     * Current consecutive-failure count on the tick path.
     */
    public int currentErrorStreak() {
        tickLock.lock();
        try {
            return errorStreak.streak();
        } finally {
            tickLock.unlock();
        }
    }

    private void markStarted() {
        startedAt = clock.instant();
        sessionId = instrumentId + "-" + startedAt.toEpochMilli();
    }

    private void runSession() {
        try {
            log.info("[SESSION] ✅ Starting session {} ({} mode, capital {})",
                sessionId, mode, initialCapital.toPlainString());
            if (!stopRequested) {
                ConnectResult connect = feed.connect(dispatcher.binding());
                if (!connect.success()) {
                    requestStop(StopReason.FEED_CONNECT_FAILED, connect.message());
                } else {
                    dispatcher.run(() -> !stopRequested);
                    if (dispatcher.isComplete()) {
                        requestStop(StopReason.FEED_COMPLETED, null);
                    }
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            requestStop(StopReason.INTERRUPTED, null);
        } catch (RuntimeException e) {
            log.error("[SESSION] ❌ Orchestration failed", e);
            requestStop(StopReason.INTERNAL_ERROR, e.getMessage());
        } finally {
            finish();
        }
    }

    private void requestStop(StopReason reason, String detail) {
        if (stopRequest.compareAndSet(null, new StopRequest(reason, detail))) {
            log.info("[SESSION] Stop requested: {}", reason.terminalMessage(detail));
        }
        stopRequested = true;
    }

    private void finish() {
        if (!finished.compareAndSet(false, true)) {
            return;
        }
        try {
            tickLock.lock();
            try {
                stopped = true;
            } finally {
                tickLock.unlock();
            }

            StopRequest request = stopRequest.get();
            if (request == null) {
                request = new StopRequest(StopReason.OPERATOR_STOP, null);
            }
            String message = request.reason().terminalMessage(request.detail());

            risk.halt();
            risk.activePosition().ifPresent(p -> {
                if (risk.close(p.id(), ExitReason.SESSION_STOP)) {
                    log.info("[SESSION] Closed open position {} on stop", p.id());
                }
            });

            FeedConnectionState finalState = feed.connectionState();
            feed.disconnect();

            SessionReport report = buildReport(request.reason(), message, finalState);
            try {
                resultsSink.publish(report);
            } catch (RuntimeException e) {
                log.error("[SESSION] ❌ Results sink failed", e);
            }

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("reason", request.reason().name());
            payload.put("message", message);
            payload.put("trades", report.closedPositions().size());
            payload.put("realizedPnl", report.realizedPnl());
            diagnostics.emit(EventType.SESSION_STOPPED, instrumentId, report.stoppedAt(), "SESSION", payload);

            if (request.reason().isFault()) {
                log.error("[SESSION] ❌ {} ({})", message, sessionId);
            } else {
                log.info("[SESSION] ✅ {} ({})", message, sessionId);
            }
            completion.complete(report);
        } catch (RuntimeException e) {
            log.error("[SESSION] ❌ Stop sequence failed", e);
            completion.completeExceptionally(e);
        }
    }

    private SessionReport buildReport(StopReason reason, String message, FeedConnectionState finalState) {
        long processed;
        long malformed;
        long errors;
        tickLock.lock();
        try {
            processed = ticksProcessed;
            malformed = malformedTicks;
            errors = processingErrors;
        } finally {
            tickLock.unlock();
        }
        BigDecimal pnl = risk.realizedPnl();
        return new SessionReport(
            sessionId, instrumentId, mode, startedAt, clock.instant(),
            reason, message, risk.closedPositions(), finalState,
            initialCapital, pnl, initialCapital.add(pnl),
            feed.ticksReceived(), feed.ticksEvicted(),
            processed, malformed, errors, errorStreak.maxStreak(),
            feed.formatErrors(), feed.callbackFaults());
    }

    // ═══════════════════════════════════════════════════════════════
    // TICK PATH
    // ═══════════════════════════════════════════════════════════════

    /**
     * Single tick handler for both consumption modes.
     */
    void processTick(Tick tick) {
        tickLock.lock();
        try {
            if (stopped || stopRequested) {
                return;
            }
            if (!tick.isProcessable()) {
                malformedTicks++;
                log.debug("[SESSION] Malformed tick {} (streak {})", tick, errorStreak.streak() + 1);
                failure();
                return;
            }
            try {
                handle(tick);
                ticksProcessed++;
                errorStreak.recordSuccess();
            } catch (RuntimeException e) {
                processingErrors++;
                log.error("[SESSION] ❌ Tick processing failed for {} (streak {})",
                    tick, errorStreak.streak() + 1, e);
                failure();
            }
        } finally {
            tickLock.unlock();
        }
    }

    private void failure() {
        if (errorStreak.recordFailure()) {
            requestStop(StopReason.ERROR_STREAK_EXCEEDED,
                "(" + errorStreak.streak() + " consecutive failures)");
        }
    }

    private void handle(Tick tick) {
        BigDecimal price = tick.price().get();
        Instant at = tick.timestamp().get();

        if (sessionClock.isPastFlatten(at)) {
            risk.activePosition().ifPresent(p -> risk.close(p.id(), ExitReason.SESSION_END, price, at));
            requestStop(StopReason.SESSION_WINDOW_ENDED, "at " + sessionClock.format(at));
            return;
        }

        Optional<Signal> signal = engine.onTick(tick);

        if (risk.hasOpenPosition()) {
            risk.onTick(tick, signal.filter(s -> s.action() == SignalAction.CLOSE));
            return;
        }
        if (signal.isPresent() && signal.get().action().isEntry()) {
            OpenResult result = risk.open(signal.get(), sizing);
            if (!result.success() && result.failure().isFatal()) {
                requestStop(StopReason.INVALID_INSTRUMENT_PARAMS, "(" + result.message() + ")");
            }
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // FEED EVENTS
    // ═══════════════════════════════════════════════════════════════

    @Override
    public void onReconnectScheduled(int attempt, Duration delay, String cause) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("attempt", attempt);
        payload.put("delayMs", delay.toMillis());
        payload.put("cause", cause);
        diagnostics.emit(EventType.FEED_RECONNECTING, instrumentId, clock.instant(), "FEED", payload);
    }

    @Override
    public void onReconnected(int attempts) {
        diagnostics.emit(EventType.FEED_RECONNECTED, instrumentId, clock.instant(), "FEED",
            Map.of("attempts", attempts));
    }

    @Override
    public void onFeedUnrecoverable(int attempts) {
        diagnostics.emit(EventType.FEED_UNRECOVERABLE, instrumentId, clock.instant(), "FEED",
            Map.of("attempts", attempts));
        requestStop(StopReason.FEED_UNRECOVERABLE, "after " + attempts + " attempts");
    }

    // ═══════════════════════════════════════════════════════════════
    // POSITION EVENTS
    // ═══════════════════════════════════════════════════════════════

    @Override
    public void onPositionOpened(PositionSnapshot position) {
        engine.onPositionOpened(position.side(), position.openedAt());
    }

    @Override
    public void onPositionClosed(PositionSnapshot position) {
        engine.onPositionClosed(position.closeReason(), position.closedAt());
    }
}
