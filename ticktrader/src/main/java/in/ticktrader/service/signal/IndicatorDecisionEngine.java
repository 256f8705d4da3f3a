package in.ticktrader.service.signal;

import in.ticktrader.config.SessionConfig;
import in.ticktrader.config.StrategyConfig;
import in.ticktrader.domain.common.EventType;
import in.ticktrader.domain.data.Tick;
import in.ticktrader.domain.signal.Signal;
import in.ticktrader.domain.trade.Direction;
import in.ticktrader.domain.trade.ExitReason;
import in.ticktrader.service.core.DiagnosticEmitter;
import in.ticktrader.service.signal.indicator.ConsecutiveTickCounter;
import in.ticktrader.service.signal.indicator.IncrementalEma;
import in.ticktrader.service.signal.indicator.Macd;
import in.ticktrader.service.signal.indicator.SessionVwap;
import in.ticktrader.service.signal.indicator.TickAtr;
import in.ticktrader.service.signal.indicator.WilderRsi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Decision engine built from toggleable incremental indicators.
 *
 * Per tick: RECEIVE -> UPDATE_INDICATORS -> EVALUATE_ENTRY (flat) or
 * EVALUATE_EXIT (in a position). Every indicator update is O(1).
 *
 * Entry: gates first (session window, daily cap, consecutive ticks), then the
 * enabled indicator rules. All checks are evaluated so each failure is
 * reported, and all must pass. Long is tried first; short only when allowed.
 *
 * Exit: strategy-driven CLOSE only (adverse tick, opposite EMA crossover).
 * Stop-loss, trailing stop and take-profit belong to the risk manager.
 */
public final class IndicatorDecisionEngine implements DecisionEngine {
    private static final Logger log = LoggerFactory.getLogger(IndicatorDecisionEngine.class);

    private static final String SOURCE = "ENGINE";

    private final String instrumentId;
    private final StrategyConfig cfg;
    private final int maxTradesPerDay;
    private final SessionClock sessionClock;
    private final DiagnosticEmitter diagnostics;

    // Indicator state, null when the indicator is not in use
    private final ConsecutiveTickCounter consecutive;
    private final IncrementalEma fastEma;
    private final IncrementalEma slowEma;
    private final Macd macd;
    private final SessionVwap vwap;
    private final WilderRsi rsi;
    private final IncrementalEma htfEma;
    private final TickAtr atr;

    private long ticksProcessed = 0;
    private BigDecimal lastPrice;
    private Instant lastTickAt;
    private LocalDate tradingDate;
    private int tradesToday = 0;
    private Direction openSide;

    private volatile IndicatorSnapshot snapshot = IndicatorSnapshot.empty();
    private volatile List<EntryEvaluation> lastEvaluations = List.of();

    public IndicatorDecisionEngine(String instrumentId, StrategyConfig cfg, int maxTradesPerDay,
                                   BigDecimal tickSize, SessionClock sessionClock,
                                   DiagnosticEmitter diagnostics) {
        this.instrumentId = instrumentId;
        this.cfg = cfg;
        this.maxTradesPerDay = maxTradesPerDay;
        this.sessionClock = sessionClock;
        this.diagnostics = diagnostics;

        this.consecutive = on(cfg.useConsecutiveTicks())
            ? new ConsecutiveTickCounter(on(cfg.noiseFilterEnabled()), tickSize,
                on(cfg.noiseFilterEnabled()) ? cfg.noiseFilterMinTicks() : 0,
                on(cfg.noiseFilterEnabled()) ? cfg.noiseFilterPercentage() : 0)
            : null;
        boolean emaInUse = on(cfg.useEmaCrossover()) || on(cfg.exitOnOppositeCrossover());
        this.fastEma = emaInUse ? new IncrementalEma(cfg.fastEma()) : null;
        this.slowEma = emaInUse ? new IncrementalEma(cfg.slowEma()) : null;
        this.macd = on(cfg.useMacd()) ? new Macd(cfg.macdFast(), cfg.macdSlow(), cfg.macdSignal()) : null;
        this.vwap = on(cfg.useVwap()) ? new SessionVwap() : null;
        this.rsi = on(cfg.useRsiFilter()) ? new WilderRsi(cfg.rsiLength()) : null;
        this.htfEma = on(cfg.useHtfTrend()) ? new IncrementalEma(cfg.htfPeriod()) : null;
        this.atr = on(cfg.useAtrFilter()) ? new TickAtr(cfg.atrLength()) : null;
    }

    public static IndicatorDecisionEngine fromConfig(SessionConfig config, DiagnosticEmitter diagnostics) {
        return new IndicatorDecisionEngine(
            config.instrument().instrumentId(),
            config.strategy(),
            config.session().maxTradesPerDay(),
            config.instrument().tickSize(),
            SessionClock.fromConfig(config.session()),
            diagnostics);
    }

    // ═══════════════════════════════════════════════════════════════
    // TICK PATH
    // ═══════════════════════════════════════════════════════════════

    @Override
    public Optional<Signal> onTick(Tick tick) {
        if (!tick.isProcessable()) {
            log.debug("[ENGINE] Skipping malformed tick {}", tick);
            return Optional.empty();
        }
        BigDecimal price = tick.price().get();
        Instant at = tick.timestamp().get();
        BigDecimal previous = lastPrice;

        updateIndicators(price, at, tick.volume().orElse(null));

        Optional<Signal> signal = openSide == null
            ? evaluateEntry(tick, price, at)
            : evaluateExit(price, previous, at);

        publishSnapshot();
        return signal;
    }

    private void updateIndicators(BigDecimal price, Instant at, Long volume) {
        LocalDate date = sessionClock.tradingDate(at);
        if (!date.equals(tradingDate)) {
            if (tradingDate != null) {
                log.info("[ENGINE] New trading day {} (trades on {}: {})", date, tradingDate, tradesToday);
            }
            tradingDate = date;
            tradesToday = 0;
            if (vwap != null) {
                vwap.reset();
            }
        }

        double p = price.doubleValue();
        if (consecutive != null) consecutive.update(price);
        if (fastEma != null) fastEma.update(p);
        if (slowEma != null) slowEma.update(p);
        if (macd != null) macd.update(p);
        if (vwap != null) vwap.update(p, volume);
        if (rsi != null) rsi.update(p);
        if (htfEma != null) htfEma.update(p);
        if (atr != null) atr.update(p);

        ticksProcessed++;
        lastPrice = price;
        lastTickAt = at;
    }

    // ═══════════════════════════════════════════════════════════════
    // ENTRY
    // ═══════════════════════════════════════════════════════════════

    private Optional<Signal> evaluateEntry(Tick tick, BigDecimal price, Instant at) {
        List<EntryEvaluation> evaluations = new ArrayList<>(2);
        EntryEvaluation longEval = evaluate(Direction.LONG, tick, at);
        evaluations.add(longEval);
        EntryEvaluation accepted = longEval.isAccepted() ? longEval : null;

        if (accepted == null && on(cfg.allowShort())) {
            EntryEvaluation shortEval = evaluate(Direction.SHORT, tick, at);
            evaluations.add(shortEval);
            if (shortEval.isAccepted()) {
                accepted = shortEval;
            }
        }
        lastEvaluations = List.copyOf(evaluations);

        if (accepted != null) {
            String reason = "entry " + accepted.direction() + " " + accepted.passed();
            log.info("[ENGINE] ✅ ENTER {} at {} ({})", accepted.direction(), price.toPlainString(), accepted.passed());
            diagnostics.emit(EventType.ENTRY_ACCEPTED, instrumentId, at, SOURCE, Map.of(
                "direction", accepted.direction().name(),
                "price", price,
                "checks", names(accepted.passed())));
            return Optional.of(accepted.direction() == Direction.LONG
                ? Signal.enterLong(price, reason, at)
                : Signal.enterShort(price, reason, at));
        }

        boolean blocked = evaluations.stream().allMatch(EntryEvaluation::isBlocked);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("price", price);
        for (EntryEvaluation e : evaluations) {
            payload.put(e.direction().name(), names(e.failed()));
        }
        diagnostics.emit(blocked ? EventType.ENTRY_BLOCKED : EventType.ENTRY_REJECTED,
            instrumentId, at, SOURCE, payload);
        return Optional.empty();
    }

    private EntryEvaluation evaluate(Direction side, Tick tick, Instant at) {
        List<EntryCheck> passed = new ArrayList<>();
        List<EntryCheck> failed = new ArrayList<>();
        boolean isLong = side == Direction.LONG;
        double p = lastPrice.doubleValue();

        check(EntryCheck.SESSION_WINDOW, sessionClock.isEntryAllowed(at), passed, failed);
        check(EntryCheck.DAILY_TRADE_CAP, tradesToday < maxTradesPerDay, passed, failed);
        if (consecutive != null) {
            int run = isLong ? consecutive.rising() : consecutive.falling();
            check(EntryCheck.CONSECUTIVE_TICKS, run >= cfg.consecutiveTicksRequired(), passed, failed);
        }

        if (on(cfg.useEmaCrossover())) {
            boolean ok = fastEma.isReady() && slowEma.isReady()
                && (isLong ? fastEma.value() > slowEma.value() : fastEma.value() < slowEma.value());
            check(EntryCheck.EMA_CROSSOVER, ok, passed, failed);
        }
        if (macd != null) {
            boolean ok = macd.isReady()
                && (isLong ? macd.line() > macd.signal() && macd.histogram() > 0
                           : macd.line() < macd.signal() && macd.histogram() < 0);
            check(EntryCheck.MACD, ok, passed, failed);
        }
        if (vwap != null) {
            boolean ok = vwap.isReady() && (isLong ? p > vwap.value() : p < vwap.value());
            check(EntryCheck.VWAP, ok, passed, failed);
        }
        if (rsi != null) {
            boolean ok = rsi.isReady()
                && (isLong ? rsi.value() < cfg.rsiOverbought() : rsi.value() > cfg.rsiOversold());
            check(EntryCheck.RSI, ok, passed, failed);
        }
        if (htfEma != null) {
            boolean ok = htfEma.isReady() && (isLong ? p > htfEma.value() : p < htfEma.value());
            check(EntryCheck.HTF_TREND, ok, passed, failed);
        }
        if (atr != null) {
            check(EntryCheck.ATR, atr.isReady() && atr.value() >= cfg.minAtr(), passed, failed);
        }
        if (on(cfg.useVolumeFilter())) {
            boolean ok = tick.volume().map(v -> v >= cfg.minTickVolume()).orElse(false);
            check(EntryCheck.VOLUME, ok, passed, failed);
        }
        return new EntryEvaluation(side, passed, failed);
    }

    private static void check(EntryCheck check, boolean ok, List<EntryCheck> passed, List<EntryCheck> failed) {
        (ok ? passed : failed).add(check);
    }

    // ═══════════════════════════════════════════════════════════════
    // EXIT
    // ═══════════════════════════════════════════════════════════════

    private Optional<Signal> evaluateExit(BigDecimal price, BigDecimal previous, Instant at) {
        boolean isLong = openSide == Direction.LONG;

        if (on(cfg.exitOnAdverseTick()) && previous != null) {
            int cmp = price.compareTo(previous);
            if (isLong ? cmp < 0 : cmp > 0) {
                log.debug("[ENGINE] Adverse tick {} -> {}", previous.toPlainString(), price.toPlainString());
                return Optional.of(Signal.close(price, "adverse tick", at));
            }
        }
        if (on(cfg.exitOnOppositeCrossover()) && fastEma.isReady() && slowEma.isReady()) {
            boolean opposite = isLong ? fastEma.value() < slowEma.value() : fastEma.value() > slowEma.value();
            if (opposite) {
                return Optional.of(Signal.close(price, "opposite EMA crossover", at));
            }
        }
        return Optional.empty();
    }

    // ═══════════════════════════════════════════════════════════════
    // POSITION NOTIFICATIONS
    // ═══════════════════════════════════════════════════════════════

    @Override
    public void onPositionOpened(Direction side, Instant openedAt) {
        openSide = side;
        tradesToday++;
        if (consecutive != null) {
            consecutive.reset();
        }
        publishSnapshot();
        log.debug("[ENGINE] Position opened {} (trades today: {}/{})", side, tradesToday, maxTradesPerDay);
    }

    @Override
    public void onPositionClosed(ExitReason reason, Instant closedAt) {
        openSide = null;
        log.debug("[ENGINE] Position closed ({}), entry evaluation resumes", reason);
    }

    @Override
    public IndicatorSnapshot snapshot() {
        return snapshot;
    }

    @Override
    public List<EntryEvaluation> lastEntryEvaluations() {
        return lastEvaluations;
    }

    private void publishSnapshot() {
        snapshot = new IndicatorSnapshot(
            ticksProcessed, lastPrice, lastTickAt, tradingDate, tradesToday,
            consecutive == null ? 0 : consecutive.rising(),
            consecutive == null ? 0 : consecutive.falling(),
            fastEma == null ? Double.NaN : fastEma.value(),
            slowEma == null ? Double.NaN : slowEma.value(),
            macd == null || !macd.isReady() ? Double.NaN : macd.line(),
            macd == null ? Double.NaN : macd.signal(),
            macd == null ? Double.NaN : macd.histogram(),
            vwap == null ? Double.NaN : vwap.value(),
            rsi == null ? Double.NaN : rsi.value(),
            htfEma == null ? Double.NaN : htfEma.value(),
            atr == null ? Double.NaN : atr.value());
    }

    private static List<String> names(List<EntryCheck> checks) {
        return checks.stream().map(Enum::name).toList();
    }

    private static boolean on(Boolean toggle) {
        return Boolean.TRUE.equals(toggle);
    }
}
