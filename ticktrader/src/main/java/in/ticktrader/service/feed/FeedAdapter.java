package in.ticktrader.service.feed;

import in.ticktrader.config.FeedConfig;
import in.ticktrader.domain.data.RawMessage;
import in.ticktrader.domain.data.Tick;
import in.ticktrader.domain.feed.FeedConnectionState;
import in.ticktrader.domain.feed.FeedStatus;
import in.ticktrader.infrastructure.feed.FeedConnectionException;
import in.ticktrader.infrastructure.feed.FeedFormatException;
import in.ticktrader.infrastructure.feed.FeedSource;
import in.ticktrader.infrastructure.feed.TickNormalizer;
import in.ticktrader.infrastructure.feed.common.ReconnectionPolicy;
import in.ticktrader.infrastructure.feed.metrics.FeedMetrics;
import in.ticktrader.service.core.RateLimiter;
import in.ticktrader.service.core.TimeWindowRateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the feed source connection, the bounded tick queue and reconnection.
 *
 * Threads:
 * - Receive thread: pulls raw messages, normalizes them, updates last price,
 *   appends to the queue and invokes the bound callback (if any).
 * - Liveness thread: checks for silence or a dropped source and drives
 *   reconnect-with-backoff. Never touches the tick path.
 *
 * Every tick is always enqueued, whether or not a callback is bound. On
 * overflow the oldest queued tick is evicted so the newest is admitted; the
 * producer never blocks.
 *
 * Reconnect is idempotent: while one is scheduled or running, further
 * liveness breaches are ignored. Backoff resets only when a tick arrives after
 * a reconnect, not when the handshake succeeds. When the attempt cap is
 * exhausted the adapter goes terminal DISCONNECTED and notifies listeners.
 *
 * Usage:
 * <pre>
 * FeedAdapter feed = new FeedAdapter(source, normalizer, "NIFTY", Settings.fromConfig(cfg),
 *     ReconnectionPolicy.fromConfig(cfg, clock), metrics, clock);
 * feed.addListener(listener);
 * feed.connect(CallbackBinding.none());
 * feed.nextTick().ifPresent(engine::onTick);
 * feed.disconnect();
 * </pre>
 */
public final class FeedAdapter {
    private static final Logger log = LoggerFactory.getLogger(FeedAdapter.class);

    private static final Duration IDLE_BACKOFF = Duration.ofMillis(10);
    private static final Duration WARN_WINDOW = Duration.ofSeconds(10);

    /**
     * Queue and liveness settings.
     */
    public record Settings(int queueCapacity, Duration silenceThreshold, Duration livenessCheckInterval) {
        public Settings {
            if (queueCapacity <= 0) {
                throw new IllegalArgumentException("queueCapacity must be positive: " + queueCapacity);
            }
        }

        public static Settings fromConfig(FeedConfig feed) {
            return new Settings(feed.queueCapacity(), feed.silenceThreshold(), feed.livenessCheckInterval());
        }
    }

    private final FeedSource source;
    private final TickNormalizer normalizer;
    private final String instrumentId;
    private final Settings settings;
    private final ReconnectionPolicy policy;
    private final FeedMetrics metrics;
    private final Clock clock;
    private final RateLimiter warnLimiter;

    private final BlockingQueue<Tick> queue;
    private final List<FeedEventListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicReference<CallbackBinding> binding = new AtomicReference<>(null);

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean reconnecting = new AtomicBoolean(false);
    private final AtomicBoolean awaitingRecovery = new AtomicBoolean(false);
    private final AtomicLong ticksReceived = new AtomicLong();
    private final AtomicLong ticksEvicted = new AtomicLong();
    private final AtomicLong formatErrors = new AtomicLong();
    private final AtomicLong callbackFaults = new AtomicLong();

    private volatile FeedStatus status = FeedStatus.DISCONNECTED;
    private volatile boolean terminal = false;
    private volatile boolean sourceExhausted = false;
    private volatile BigDecimal lastPrice;
    private volatile Instant lastTickAt;
    private volatile Instant silenceBaseline;

    private volatile Thread receiveThread;
    private volatile ScheduledExecutorService scheduler;

    public FeedAdapter(FeedSource source, TickNormalizer normalizer, String instrumentId,
                       Settings settings, ReconnectionPolicy policy, FeedMetrics metrics, Clock clock) {
        this.source = source;
        this.normalizer = normalizer;
        this.instrumentId = instrumentId;
        this.settings = settings;
        this.policy = policy;
        this.metrics = metrics;
        this.clock = clock;
        this.warnLimiter = new TimeWindowRateLimiter(WARN_WINDOW, clock);
        this.queue = new ArrayBlockingQueue<>(settings.queueCapacity());
    }

    public void addListener(FeedEventListener listener) {
        listeners.add(listener);
    }

    // ═══════════════════════════════════════════════════════════════
    // LIFECYCLE
    // ═══════════════════════════════════════════════════════════════

    /**
     * Connect the source and start the receive and liveness threads.
     *
     * The binding is fixed by the first call; a later call must pass the same
     * binding (retrying a failed connect) or it is rejected.
     *
     * @throws IllegalStateException if a different binding was already fixed,
     *                               or the adapter is already running
     */
    public ConnectResult connect(CallbackBinding callback) {
        if (!binding.compareAndSet(null, callback) && binding.get() != callback) {
            throw new IllegalStateException("Feed callback already bound to " + binding.get() + ", cannot rebind");
        }
        if (running.get()) {
            throw new IllegalStateException("Feed adapter already connected");
        }

        setStatus(FeedStatus.CONNECTING);
        log.info("[FEED] Connecting {} source for {} (callback: {}, queue: {})",
            source.id(), instrumentId, callback.isBound() ? "bound" : "none", settings.queueCapacity());
        try {
            source.connect();
        } catch (FeedConnectionException e) {
            setStatus(FeedStatus.DISCONNECTED);
            log.error("[FEED] ❌ Connect failed: {}", e.getMessage());
            return ConnectResult.failure(e.getMessage(), e);
        }

        silenceBaseline = clock.instant();
        running.set(true);
        startThreads();
        log.info("[FEED] ✅ Connected {} source for {}", source.id(), instrumentId);
        return ConnectResult.success("connected");
    }

    /**
     * Stop both threads and release the source. Idempotent.
     */
    public void disconnect() {
        if (!running.getAndSet(false)) {
            return;
        }
        ScheduledExecutorService s = scheduler;
        if (s != null) {
            s.shutdownNow();
        }
        Thread t = receiveThread;
        if (t != null && t != Thread.currentThread()) {
            t.interrupt();
            try {
                t.join(1000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        try {
            source.disconnect();
        } catch (RuntimeException e) {
            log.warn("[FEED] Source disconnect failed: {}", e.getMessage());
        }
        setStatus(FeedStatus.DISCONNECTED);
        log.info("[FEED] Disconnected (received={}, evicted={}, formatErrors={}, callbackFaults={})",
            ticksReceived.get(), ticksEvicted.get(), formatErrors.get(), callbackFaults.get());
    }

    private void startThreads() {
        Thread t = new Thread(this::receiveLoop, "feed-receive-" + instrumentId);
        t.setDaemon(true);
        receiveThread = t;

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread th = new Thread(r, "feed-liveness-" + instrumentId);
            th.setDaemon(true);
            return th;
        });
        long interval = settings.livenessCheckInterval().toMillis();
        scheduler.scheduleAtFixedRate(this::checkLiveness, interval, interval, TimeUnit.MILLISECONDS);
        t.start();
    }

    // ═══════════════════════════════════════════════════════════════
    // CONSUMER SIDE
    // ═══════════════════════════════════════════════════════════════

    /**
     * Non-blocking dequeue. Empty means nothing is queued right now, not that
     * the feed is down.
     */
    public Optional<Tick> nextTick() {
        return Optional.ofNullable(queue.poll());
    }

    /**
     * Latest observed price, independent of the queue and of the mode.
     */
    public Optional<BigDecimal> lastPrice() {
        return Optional.ofNullable(lastPrice);
    }

    public FeedConnectionState connectionState() {
        return new FeedConnectionState(status, lastTickAt, policy.getAttemptCount(), policy.getNextDelay(), terminal);
    }

    public FeedStatus status() {
        return status;
    }

    public boolean isTerminal() {
        return terminal;
    }

    /**
     * True once a finite source has delivered its last message and every
     * callback for it has returned.
     */
    public boolean isSourceExhausted() {
        return sourceExhausted;
    }

    public int queuedTicks() {
        return queue.size();
    }

    public long ticksReceived() {
        return ticksReceived.get();
    }

    public long ticksEvicted() {
        return ticksEvicted.get();
    }

    public long formatErrors() {
        return formatErrors.get();
    }

    public long callbackFaults() {
        return callbackFaults.get();
    }

    // ═══════════════════════════════════════════════════════════════
    // RECEIVE THREAD
    // ═══════════════════════════════════════════════════════════════

    private void receiveLoop() {
        log.debug("[FEED] Receive loop started");
        while (running.get()) {
            try {
                if (reconnecting.get() || terminal || !source.isConnected() || sourceExhausted) {
                    idle();
                    continue;
                }
                Optional<RawMessage> raw = source.nextRawMessage();
                if (raw.isPresent()) {
                    onRawMessage(raw.get());
                } else if (source.isExhausted()) {
                    sourceExhausted = true;
                    log.info("[FEED] Source exhausted after {} ticks", ticksReceived.get());
                    listeners.forEach(FeedEventListener::onFeedExhausted);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (FeedConnectionException e) {
                // Liveness thread sees the dropped source and schedules the reconnect.
                log.warn("[FEED] Source read failed: {}", e.getMessage());
            } catch (RuntimeException e) {
                if (warnLimiter.allow("receive")) {
                    log.error("[FEED] Unexpected error in receive loop (+{} suppressed)",
                        warnLimiter.drainSuppressed("receive"), e);
                }
            }
        }
        log.debug("[FEED] Receive loop stopped");
    }

    private void idle() throws InterruptedException {
        Thread.sleep(IDLE_BACKOFF.toMillis());
    }

    private void onRawMessage(RawMessage raw) {
        Tick tick;
        try {
            tick = normalizer.normalize(raw);
        } catch (FeedFormatException e) {
            formatErrors.incrementAndGet();
            metrics.recordFormatError(source.id());
            if (warnLimiter.allow("format")) {
                log.warn("[FEED] Dropping malformed message: {} (+{} suppressed)",
                    e.getMessage(), warnLimiter.drainSuppressed("format"));
            }
            return;
        }
        if (!instrumentId.equals(tick.instrumentId())) {
            log.trace("[FEED] Ignoring tick for {}", tick.instrumentId());
            return;
        }
        accept(tick);
    }

    /**
     * Record, enqueue, then hand to the callback. Runs on the receive thread.
     */
    void accept(Tick tick) {
        Instant now = clock.instant();
        lastTickAt = now;
        silenceBaseline = now;
        tick.price().ifPresent(p -> lastPrice = p);
        ticksReceived.incrementAndGet();
        metrics.recordTickReceived(instrumentId);

        if (awaitingRecovery.compareAndSet(true, false)) {
            int attempts = policy.getAttemptCount();
            policy.recordSuccess();
            log.info("[FEED] ✅ Feed recovered, first tick after reconnect; backoff reset");
            listeners.forEach(l -> l.onReconnected(attempts));
        }
        if (status != FeedStatus.STREAMING) {
            setStatus(FeedStatus.STREAMING);
        }

        enqueue(tick);

        CallbackBinding b = binding.get();
        if (b != null && b.isBound()) {
            long started = System.nanoTime();
            try {
                b.handler().get().onTick(tick);
                metrics.recordDecisionLatency(instrumentId, Duration.ofNanos(System.nanoTime() - started));
            } catch (RuntimeException e) {
                callbackFaults.incrementAndGet();
                metrics.recordCallbackFault(instrumentId);
                if (warnLimiter.allow("callback")) {
                    log.error("[FEED] Tick callback failed for {} (+{} suppressed)",
                        tick, warnLimiter.drainSuppressed("callback"), e);
                }
            }
        }
    }

    private void enqueue(Tick tick) {
        while (!queue.offer(tick)) {
            Tick evicted = queue.poll();
            if (evicted != null) {
                ticksEvicted.incrementAndGet();
                metrics.recordTickEvicted(instrumentId);
                log.trace("[FEED] Queue full, evicted {}", evicted);
            }
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // LIVENESS / RECONNECT (liveness thread)
    // ═══════════════════════════════════════════════════════════════

    void checkLiveness() {
        try {
            if (!running.get() || terminal || sourceExhausted || reconnecting.get()) {
                return;
            }
            Duration silence = Duration.between(silenceBaseline, clock.instant());
            boolean silent = silence.compareTo(settings.silenceThreshold()) > 0;
            boolean dropped = !source.isConnected();
            if (!silent && !dropped) {
                return;
            }
            if (awaitingRecovery.getAndSet(false)) {
                // Previous reconnect handshake succeeded but no tick followed.
                policy.recordFailure();
            }
            if (silent) {
                setStatus(FeedStatus.SILENT);
            }
            scheduleReconnect(silent
                ? "no tick for " + silence.toMillis() + "ms"
                : "source disconnected");
        } catch (RuntimeException e) {
            log.error("[FEED] Liveness check failed", e);
        }
    }

    private void scheduleReconnect(String cause) {
        if (!reconnecting.compareAndSet(false, true)) {
            return;
        }
        if (!policy.shouldRetry()) {
            markTerminal();
            return;
        }
        int attempt = policy.getAttemptCount() + 1;
        Duration delay = policy.getNextDelay();
        setStatus(FeedStatus.RECONNECTING);
        log.warn("[FEED] ⚠️ {} - reconnect attempt {}/{} in {}ms",
            cause, attempt, policy.getMaxAttempts(), delay.toMillis());
        listeners.forEach(l -> l.onReconnectScheduled(attempt, delay, cause));
        scheduler.schedule(this::attemptReconnect, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void attemptReconnect() {
        if (!running.get()) {
            reconnecting.set(false);
            return;
        }
        try {
            try {
                source.disconnect();
            } catch (RuntimeException e) {
                log.debug("[FEED] Disconnect before reconnect failed: {}", e.getMessage());
            }
            source.connect();
            metrics.recordReconnectAttempt(source.id(), true);
            silenceBaseline = clock.instant();
            awaitingRecovery.set(true);
            setStatus(FeedStatus.CONNECTING);
            log.info("[FEED] Reconnected {} source, waiting for first tick", source.id());
            reconnecting.set(false);
        } catch (RuntimeException e) {
            metrics.recordReconnectAttempt(source.id(), false);
            policy.recordFailure();
            log.warn("[FEED] Reconnect attempt {} failed: {}", policy.getAttemptCount(), e.getMessage());
            reconnecting.set(false);
            scheduleReconnect("reconnect failed");
        }
    }

    private void markTerminal() {
        terminal = true;
        setStatus(FeedStatus.DISCONNECTED);
        int attempts = policy.getAttemptCount();
        log.error("[FEED] ❌ Feed unrecoverable after {} attempts", attempts);
        ScheduledExecutorService s = scheduler;
        if (s != null) {
            s.shutdown();
        }
        listeners.forEach(l -> l.onFeedUnrecoverable(attempts));
    }

    private void setStatus(FeedStatus next) {
        FeedStatus prev = status;
        status = next;
        if (prev != next) {
            metrics.recordStatus(source.id(), next);
            log.debug("[FEED] Status {} -> {}", prev, next);
        }
    }
}
