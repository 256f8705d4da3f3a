package in.ticktrader.service.risk;

import in.ticktrader.config.RiskConfig;
import in.ticktrader.config.SessionConfig;
import in.ticktrader.config.TakeProfitConfig;
import in.ticktrader.domain.common.EventType;
import in.ticktrader.domain.data.Tick;
import in.ticktrader.domain.signal.Signal;
import in.ticktrader.domain.signal.SignalAction;
import in.ticktrader.domain.trade.Direction;
import in.ticktrader.domain.trade.ExitReason;
import in.ticktrader.domain.trade.ExitTrigger;
import in.ticktrader.domain.trade.OpenFailure;
import in.ticktrader.domain.trade.OpenResult;
import in.ticktrader.domain.trade.PartialExit;
import in.ticktrader.domain.trade.PositionSnapshot;
import in.ticktrader.domain.trade.PositionStatus;
import in.ticktrader.domain.trade.TakeProfitLevel;
import in.ticktrader.service.core.DiagnosticEmitter;
import in.ticktrader.service.risk.PositionSizer.PositionSize;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Risk Manager - sole owner and writer of the session's position.
 *
 * Lifecycle: NONE -> OPEN -> CLOSING -> CLOSED (-> NONE).
 *
 * At most one position is not CLOSED at any time. Every path that opens or
 * closes runs under one lock, so the "slot is free" check and the open are a
 * single atomic step with respect to any close.
 *
 * Per tick, the configured exit precedence is walked and the first trigger
 * that matches handles the tick:
 * - STOP_LOSS: price at or through the stop, close everything
 * - TRAILING_STOP: armed trail breached, close everything
 * - TAKE_PROFIT: every reached, unfired level in ascending order, each
 *   closing its share; a level fires at most once
 * - STRATEGY_SIGNAL: CLOSE requested by the decision engine
 *
 * Readers on other threads use {@link #activePosition()}, a lock-free
 * snapshot republished after every mutation.
 */
public final class RiskManager {
    private static final Logger log = LoggerFactory.getLogger(RiskManager.class);

    private static final String SOURCE = "RISK";

    private final String instrumentId;
    private final RiskConfig risk;
    private final BigDecimal initialCapital;
    private final PositionSizer sizer;
    private final DiagnosticEmitter diagnostics;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicInteger sequence = new AtomicInteger();
    private final AtomicReference<PositionSnapshot> activeSnapshot = new AtomicReference<>(null);
    private final List<PositionSnapshot> closedLedger = new CopyOnWriteArrayList<>();
    private final List<PositionListener> listeners = new CopyOnWriteArrayList<>();

    // Guarded by lock
    private Position active;
    private BigDecimal realizedPnl = BigDecimal.ZERO;
    private BigDecimal lastMark;
    private boolean halted = false;

    public RiskManager(String instrumentId, RiskConfig risk, BigDecimal initialCapital,
                       DiagnosticEmitter diagnostics, Clock clock) {
        this.instrumentId = instrumentId;
        this.risk = risk;
        this.initialCapital = initialCapital;
        this.sizer = new PositionSizer(risk.riskPerTradePercent(), risk.maxPositionValuePercent());
        this.diagnostics = diagnostics;
        this.clock = clock;
    }

    public static RiskManager fromConfig(SessionConfig config, DiagnosticEmitter diagnostics, Clock clock) {
        return new RiskManager(config.instrument().instrumentId(), config.risk(),
            config.capital().initialCapital(), diagnostics, clock);
    }

    public void addListener(PositionListener listener) {
        listeners.add(listener);
    }

    // ═══════════════════════════════════════════════════════════════
    // OPEN
    // ═══════════════════════════════════════════════════════════════

    /**
     * Open a position for an ENTER signal.
     *
     * Fails fast, creating nothing, when lot size or tick size is missing;
     * no default is ever substituted.
     */
    public OpenResult open(Signal signal, SizingInputs sizing) {
        if (!signal.action().isEntry()) {
            throw new IllegalArgumentException("Not an entry signal: " + signal.action());
        }
        if (sizing == null || !sizing.isComplete()) {
            String message = "Instrument sizing parameters missing or invalid: lotSize="
                + (sizing == null ? null : sizing.lotSize())
                + ", tickSize=" + (sizing == null ? null : sizing.tickSize());
            log.error("[RISK] ❌ {}", message);
            return failed(OpenFailure.INVALID_INSTRUMENT_PARAMS, message, signal);
        }

        Direction side = signal.action() == SignalAction.ENTER_LONG ? Direction.LONG : Direction.SHORT;
        PositionSnapshot opened;
        lock.lock();
        try {
            if (halted) {
                return failed(OpenFailure.SESSION_STOPPED, "Session stopped, no new positions", signal);
            }
            if (active != null && active.status != PositionStatus.CLOSED) {
                return failed(OpenFailure.POSITION_ALREADY_OPEN, "Position " + active.id + " still " + active.status, signal);
            }

            BigDecimal available = availableCapitalLocked();
            PositionSize size = sizer.size(signal.price(), risk.stopLossPoints(), sizing.lotSize(), available);
            if (!size.isTradable()) {
                return failed(OpenFailure.INSUFFICIENT_CAPITAL,
                    "Available capital " + available.toPlainString() + " cannot carry one lot of "
                        + sizing.lotSize() + " at " + signal.price().toPlainString(), signal);
            }

            BigDecimal entry = signal.price();
            String id = instrumentId + "-" + sequence.incrementAndGet();
            active = new Position(id, instrumentId, side, entry, sizing.lotSize(), size.quantity(),
                signal.timestamp(), side.adverse(entry, risk.stopLossPoints()), ladder(side, entry));
            lastMark = entry;
            opened = publishLocked();

            log.info("[RISK] ✅ OPEN {} {} {} x{} @ {} (SL {}, TP {})",
                id, side, instrumentId, size.quantity(), entry.toPlainString(),
                opened.stopLoss().toPlainString(), opened.takeProfitLevels().size());
        } finally {
            lock.unlock();
        }

        diagnostics.emit(EventType.POSITION_OPENED, instrumentId, opened.openedAt(), SOURCE, Map.of(
            "positionId", opened.id(),
            "side", side.name(),
            "entryPrice", opened.entryPrice(),
            "quantity", opened.quantity(),
            "stopLoss", opened.stopLoss()));
        listeners.forEach(l -> l.onPositionOpened(opened));
        return OpenResult.success(opened.id());
    }

    private List<TakeProfitLevel> ladder(Direction side, BigDecimal entry) {
        List<TakeProfitLevel> levels = new ArrayList<>();
        for (TakeProfitConfig tp : risk.takeProfitLevels()) {
            levels.add(new TakeProfitLevel(side.favorable(entry, tp.points()), tp.fraction(), false));
        }
        return levels;
    }

    private OpenResult failed(OpenFailure failure, String message, Signal signal) {
        if (!failure.isFatal()) {
            log.warn("[RISK] Open refused ({}): {}", failure, message);
        }
        diagnostics.emit(EventType.POSITION_OPEN_FAILED, instrumentId, signal.timestamp(), SOURCE, Map.of(
            "failure", failure.name(),
            "message", message));
        return OpenResult.failure(failure, message);
    }

    // ═══════════════════════════════════════════════════════════════
    // PER TICK
    // ═══════════════════════════════════════════════════════════════

    /**
     * Evaluate risk exits for the open position against one tick.
     *
     * @param closeRequest CLOSE signal from the decision engine for this tick, if any
     * @return exit legs executed on this tick, empty if none
     */
    public List<PartialExit> onTick(Tick tick, Optional<Signal> closeRequest) {
        if (!tick.isProcessable()) {
            return List.of();
        }
        BigDecimal price = tick.price().get();
        Instant at = tick.timestamp().get();

        List<PartialExit> legs = List.of();
        PositionSnapshot after = null;
        lock.lock();
        try {
            lastMark = price;
            Position p = active;
            if (p == null || !p.isOpen()) {
                return List.of();
            }
            if (Boolean.TRUE.equals(risk.useTrailingStop())) {
                p.updateTrailing(price, risk.trailActivationPoints(), risk.trailDistancePoints());
            }

            for (ExitTrigger trigger : risk.exitPrecedence()) {
                legs = evaluate(trigger, p, price, at, closeRequest);
                if (!legs.isEmpty()) {
                    break;
                }
            }
            after = publishLocked();
        } finally {
            lock.unlock();
        }
        afterExit(after, legs);
        return legs;
    }

    private List<PartialExit> evaluate(ExitTrigger trigger, Position p, BigDecimal price, Instant at,
                                       Optional<Signal> closeRequest) {
        switch (trigger) {
            case STOP_LOSS:
                if (p.side.breached(price, p.stopLoss)) {
                    return List.of(exitLocked(p, p.quantity, price, ExitReason.STOP_LOSS, at));
                }
                return List.of();
            case TRAILING_STOP:
                if (p.trailingArmed && p.trailingStop != null && p.side.breached(price, p.trailingStop)) {
                    return List.of(exitLocked(p, p.quantity, price, ExitReason.TRAILING_STOP, at));
                }
                return List.of();
            case TAKE_PROFIT:
                return fireTakeProfits(p, price, at);
            case STRATEGY_SIGNAL:
                if (closeRequest.isPresent() && closeRequest.get().action() == SignalAction.CLOSE) {
                    return List.of(exitLocked(p, p.quantity, price, ExitReason.STRATEGY_SIGNAL, at));
                }
                return List.of();
            default:
                throw new IllegalStateException("Unhandled exit trigger " + trigger);
        }
    }

    private List<PartialExit> fireTakeProfits(Position p, BigDecimal price, Instant at) {
        List<PartialExit> legs = new ArrayList<>();
        int last = p.levels.size() - 1;
        boolean sweepLast = laddersWholePosition(p);
        for (int i = 0; i <= last && p.isOpen(); i++) {
            TakeProfitLevel level = p.levels.get(i);
            if (level.fired() || !p.side.reached(price, level.triggerPrice())) {
                continue;
            }
            p.levels.set(i, level.markFired());
            int qty = i == last && sweepLast ? p.quantity : ladderQuantity(p, level.fraction());
            legs.add(exitLocked(p, qty, price, ExitReason.TAKE_PROFIT, at));
        }
        return legs;
    }

    /**
     * True when the ladder fractions add up to exactly one, so the last level
     * takes whatever lot rounding left behind.
     */
    private static boolean laddersWholePosition(Position p) {
        BigDecimal total = BigDecimal.ZERO;
        for (TakeProfitLevel level : p.levels) {
            total = total.add(level.fraction());
        }
        return total.compareTo(BigDecimal.ONE) == 0;
    }

    /**
     * Share of the opening quantity, rounded down to whole lots, at least one
     * lot, never more than what remains.
     */
    private static int ladderQuantity(Position p, BigDecimal fraction) {
        int lots = BigDecimal.valueOf(p.initialQuantity).multiply(fraction)
            .divide(BigDecimal.valueOf(p.lotSize), 0, RoundingMode.DOWN).intValue();
        int qty = Math.max(lots, 1) * p.lotSize;
        return Math.min(qty, p.quantity);
    }

    // ═══════════════════════════════════════════════════════════════
    // CLOSE
    // ═══════════════════════════════════════════════════════════════

    /**
     * Close the position at the last observed price. Idempotent: closing an
     * unknown or already closed position is a no-op.
     *
     * @return true if this call closed the position
     */
    public boolean close(String positionId, ExitReason reason) {
        return close(positionId, reason, null, clock.instant());
    }

    /**
     * Close the position at {@code price}, or at the last observed price when null.
     */
    public boolean close(String positionId, ExitReason reason, BigDecimal price, Instant at) {
        PositionSnapshot after;
        List<PartialExit> legs;
        lock.lock();
        try {
            Position p = active;
            if (p == null || !p.id.equals(positionId) || !p.isOpen()) {
                return false;
            }
            BigDecimal exitAt = price != null ? price : (lastMark != null ? lastMark : p.entryPrice);
            legs = List.of(exitLocked(p, p.quantity, exitAt, reason, at));
            after = publishLocked();
        } finally {
            lock.unlock();
        }
        afterExit(after, legs);
        return true;
    }

    /**
     * Refuse all further opens. Used when the session is stopping.
     */
    public void halt() {
        lock.lock();
        try {
            halted = true;
        } finally {
            lock.unlock();
        }
    }

    private PartialExit exitLocked(Position p, int qty, BigDecimal price, ExitReason reason, Instant at) {
        if (qty == p.quantity) {
            p.status = PositionStatus.CLOSING;
        }
        PartialExit leg = p.exit(qty, price, reason, at, risk.commissionPercent());
        realizedPnl = realizedPnl.add(leg.realizedPnl());
        log.info("[RISK] EXIT {} {} x{} @ {} ({}), pnl {}, remaining {}",
            p.id, reason, qty, price.toPlainString(), p.side, leg.realizedPnl().toPlainString(), p.quantity);
        return leg;
    }

    private void afterExit(PositionSnapshot after, List<PartialExit> legs) {
        if (after == null || legs.isEmpty()) {
            return;
        }
        for (PartialExit leg : legs) {
            diagnostics.emit(EventType.EXIT_TRIGGERED, instrumentId, leg.exitedAt(), SOURCE, Map.of(
                "positionId", after.id(),
                "reason", leg.reason().name(),
                "price", leg.price(),
                "quantity", leg.quantity(),
                "remaining", after.quantity()));
        }
        if (!after.isOpen()) {
            log.info("[RISK] CLOSED {} ({}), realized {}", after.id(), after.closeReason(),
                after.realizedPnl().toPlainString());
            listeners.forEach(l -> l.onPositionClosed(after));
        }
    }

    private PositionSnapshot publishLocked() {
        PositionSnapshot snap = active.snapshot();
        if (snap.isOpen()) {
            activeSnapshot.set(snap);
        } else {
            activeSnapshot.set(null);
            closedLedger.add(snap);
            active = null;
        }
        return snap;
    }

    // ═══════════════════════════════════════════════════════════════
    // READ SIDE (any thread)
    // ═══════════════════════════════════════════════════════════════

    public Optional<PositionSnapshot> activePosition() {
        return Optional.ofNullable(activeSnapshot.get());
    }

    public boolean hasOpenPosition() {
        return activeSnapshot.get() != null;
    }

    /**
     * Closed positions in the order they closed.
     */
    public List<PositionSnapshot> closedPositions() {
        return List.copyOf(closedLedger);
    }

    public BigDecimal realizedPnl() {
        lock.lock();
        try {
            return realizedPnl;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Initial capital plus realized P&L of every exit leg so far.
     */
    public BigDecimal availableCapital() {
        lock.lock();
        try {
            return availableCapitalLocked();
        } finally {
            lock.unlock();
        }
    }

    private BigDecimal availableCapitalLocked() {
        return initialCapital.add(realizedPnl);
    }
}
