package in.ticktrader.config;

import in.ticktrader.config.DiagnosticsConfig.RateLimitMode;
import in.ticktrader.config.FeedSourceConfig.FeedSourceType;
import in.ticktrader.domain.trade.ExitTrigger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Startup configuration validator.
 *
 * Runs before anything is wired. Every sizing, risk, strategy, session and feed
 * parameter is mandatory; nothing is defaulted. All problems are collected and
 * reported in one {@link IllegalStateException} so an operator fixes the file
 * in one pass.
 */
public final class SessionConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(SessionConfigValidator.class);

    /**
     * @throws IllegalStateException listing every problem found
     */
    public static void validate(SessionConfig config) {
        List<String> problems = check(config);
        if (!problems.isEmpty()) {
            StringBuilder sb = new StringBuilder("❌ INVALID CONFIG: session refuses to start\n");
            for (String p : problems) {
                sb.append("  - ").append(p).append('\n');
            }
            throw new IllegalStateException(sb.toString().trim());
        }
        log.info("[CONFIG] ✅ Session config valid for {} ({} mode)",
            config.instrument().instrumentId(), config.consumptionMode());
    }

    /**
     * Collect problems without throwing.
     */
    public static List<String> check(SessionConfig config) {
        List<String> problems = new ArrayList<>();
        if (config == null) {
            problems.add("config is missing");
            return problems;
        }
        checkInstrument(config.instrument(), problems);
        require(config.consumptionMode(), "consumptionMode", problems);
        checkCapital(config.capital(), problems);
        checkRisk(config.risk(), problems);
        checkStrategy(config.strategy(), problems);
        checkSession(config.session(), problems);
        checkFeed(config.feed(), problems);
        checkDiagnostics(config.diagnostics(), problems);
        return problems;
    }

    private static void checkInstrument(InstrumentConfig c, List<String> problems) {
        if (c == null) {
            problems.add("instrument section is missing");
            return;
        }
        if (c.instrumentId() == null || c.instrumentId().isBlank()) {
            problems.add("instrument.instrumentId is missing");
        }
        positive(c.lotSize(), "instrument.lotSize", problems);
        positive(c.tickSize(), "instrument.tickSize", problems);
    }

    private static void checkCapital(CapitalConfig c, List<String> problems) {
        if (c == null) {
            problems.add("capital section is missing");
            return;
        }
        positive(c.initialCapital(), "capital.initialCapital", problems);
    }

    private static void checkRisk(RiskConfig c, List<String> problems) {
        if (c == null) {
            problems.add("risk section is missing");
            return;
        }
        positive(c.stopLossPoints(), "risk.stopLossPoints", problems);
        positive(c.riskPerTradePercent(), "risk.riskPerTradePercent", problems);
        positive(c.maxPositionValuePercent(), "risk.maxPositionValuePercent", problems);
        nonNegative(c.commissionPercent(), "risk.commissionPercent", problems);

        if (require(c.useTrailingStop(), "risk.useTrailingStop", problems) && c.useTrailingStop()) {
            nonNegative(c.trailActivationPoints(), "risk.trailActivationPoints", problems);
            positive(c.trailDistancePoints(), "risk.trailDistancePoints", problems);
        }

        if (require(c.takeProfitLevels(), "risk.takeProfitLevels", problems)) {
            BigDecimal total = BigDecimal.ZERO;
            BigDecimal previous = null;
            for (int i = 0; i < c.takeProfitLevels().size(); i++) {
                TakeProfitConfig level = c.takeProfitLevels().get(i);
                String name = "risk.takeProfitLevels[" + i + "]";
                if (level == null) {
                    problems.add(name + " is missing");
                    continue;
                }
                if (positive(level.points(), name + ".points", problems)) {
                    if (previous != null && level.points().compareTo(previous) <= 0) {
                        problems.add(name + ".points must be above the previous level");
                    }
                    previous = level.points();
                }
                if (positive(level.fraction(), name + ".fraction", problems)) {
                    total = total.add(level.fraction());
                }
            }
            if (total.compareTo(BigDecimal.ONE) > 0) {
                problems.add("risk.takeProfitLevels fractions sum to " + total.toPlainString() + " (max 1)");
            }
        }

        if (require(c.exitPrecedence(), "risk.exitPrecedence", problems)) {
            Set<ExitTrigger> seen = EnumSet.noneOf(ExitTrigger.class);
            for (ExitTrigger t : c.exitPrecedence()) {
                if (t == null || !seen.add(t)) {
                    problems.add("risk.exitPrecedence contains an empty or duplicate entry: " + t);
                }
            }
            if (seen.size() != ExitTrigger.values().length) {
                Set<ExitTrigger> missing = EnumSet.allOf(ExitTrigger.class);
                missing.removeAll(seen);
                problems.add("risk.exitPrecedence must list every trigger once, missing " + missing);
            }
        }
    }

    private static void checkStrategy(StrategyConfig c, List<String> problems) {
        if (c == null) {
            problems.add("strategy section is missing");
            return;
        }
        require(c.allowShort(), "strategy.allowShort", problems);
        positive(c.errorStreakThreshold(), "strategy.errorStreakThreshold", problems);
        require(c.exitOnOppositeCrossover(), "strategy.exitOnOppositeCrossover", problems);
        require(c.exitOnAdverseTick(), "strategy.exitOnAdverseTick", problems);

        if (enabled(c.useConsecutiveTicks(), "strategy.useConsecutiveTicks", problems)) {
            positive(c.consecutiveTicksRequired(), "strategy.consecutiveTicksRequired", problems);
            if (enabled(c.noiseFilterEnabled(), "strategy.noiseFilterEnabled", problems)) {
                nonNegative(c.noiseFilterPercentage(), "strategy.noiseFilterPercentage", problems);
                nonNegative(c.noiseFilterMinTicks(), "strategy.noiseFilterMinTicks", problems);
            }
        }
        if (enabled(c.useEmaCrossover(), "strategy.useEmaCrossover", problems)
            || Boolean.TRUE.equals(c.exitOnOppositeCrossover())) {
            boolean fast = positive(c.fastEma(), "strategy.fastEma", problems);
            boolean slow = positive(c.slowEma(), "strategy.slowEma", problems);
            if (fast && slow && c.fastEma() >= c.slowEma()) {
                problems.add("strategy.fastEma must be shorter than strategy.slowEma");
            }
        }
        if (enabled(c.useMacd(), "strategy.useMacd", problems)) {
            boolean fast = positive(c.macdFast(), "strategy.macdFast", problems);
            boolean slow = positive(c.macdSlow(), "strategy.macdSlow", problems);
            positive(c.macdSignal(), "strategy.macdSignal", problems);
            if (fast && slow && c.macdFast() >= c.macdSlow()) {
                problems.add("strategy.macdFast must be shorter than strategy.macdSlow");
            }
        }
        require(c.useVwap(), "strategy.useVwap", problems);
        if (enabled(c.useRsiFilter(), "strategy.useRsiFilter", problems)) {
            positive(c.rsiLength(), "strategy.rsiLength", problems);
            boolean lo = inRange(c.rsiOversold(), "strategy.rsiOversold", problems);
            boolean hi = inRange(c.rsiOverbought(), "strategy.rsiOverbought", problems);
            if (lo && hi && c.rsiOversold() >= c.rsiOverbought()) {
                problems.add("strategy.rsiOversold must be below strategy.rsiOverbought");
            }
        }
        if (enabled(c.useHtfTrend(), "strategy.useHtfTrend", problems)) {
            positive(c.htfPeriod(), "strategy.htfPeriod", problems);
        }
        if (enabled(c.useAtrFilter(), "strategy.useAtrFilter", problems)) {
            positive(c.atrLength(), "strategy.atrLength", problems);
            nonNegative(c.minAtr(), "strategy.minAtr", problems);
        }
        if (enabled(c.useVolumeFilter(), "strategy.useVolumeFilter", problems)) {
            nonNegative(c.minTickVolume(), "strategy.minTickVolume", problems);
        }

        boolean anyEntryRule = Boolean.TRUE.equals(c.useConsecutiveTicks())
            || Boolean.TRUE.equals(c.useEmaCrossover())
            || Boolean.TRUE.equals(c.useMacd())
            || Boolean.TRUE.equals(c.useVwap())
            || Boolean.TRUE.equals(c.useHtfTrend());
        if (!anyEntryRule) {
            problems.add("strategy must enable at least one directional entry rule "
                + "(useConsecutiveTicks, useEmaCrossover, useMacd, useVwap, useHtfTrend)");
        }
    }

    private static void checkSession(SessionWindowConfig c, List<String> problems) {
        if (c == null) {
            problems.add("session section is missing");
            return;
        }
        if (require(c.timezone(), "session.timezone", problems)) {
            try {
                ZoneId.of(c.timezone());
            } catch (DateTimeException e) {
                problems.add("session.timezone is not a valid zone: " + c.timezone());
            }
        }
        LocalTime start = time(c.startTime(), "session.startTime", problems);
        LocalTime end = time(c.endTime(), "session.endTime", problems);
        if (start != null && end != null && !start.isBefore(end)) {
            problems.add("session.startTime must be before session.endTime");
        }
        nonNegative(c.startBufferMinutes(), "session.startBufferMinutes", problems);
        nonNegative(c.endBufferMinutes(), "session.endBufferMinutes", problems);
        nonNegative(c.noTradeStartMinutes(), "session.noTradeStartMinutes", problems);
        nonNegative(c.noTradeEndMinutes(), "session.noTradeEndMinutes", problems);
        positive(c.maxTradesPerDay(), "session.maxTradesPerDay", problems);
    }

    private static void checkFeed(FeedConfig c, List<String> problems) {
        if (c == null) {
            problems.add("feed section is missing");
            return;
        }
        positive(c.queueCapacity(), "feed.queueCapacity", problems);
        positive(c.silenceThresholdMs(), "feed.silenceThresholdMs", problems);
        positive(c.livenessCheckIntervalMs(), "feed.livenessCheckIntervalMs", problems);
        positive(c.connectTimeoutMs(), "feed.connectTimeoutMs", problems);
        boolean initial = positive(c.reconnectInitialDelayMs(), "feed.reconnectInitialDelayMs", problems);
        boolean max = positive(c.reconnectMaxDelayMs(), "feed.reconnectMaxDelayMs", problems);
        if (initial && max && c.reconnectInitialDelayMs() > c.reconnectMaxDelayMs()) {
            problems.add("feed.reconnectInitialDelayMs cannot exceed feed.reconnectMaxDelayMs");
        }
        if (require(c.reconnectMultiplier(), "feed.reconnectMultiplier", problems) && c.reconnectMultiplier() <= 1.0) {
            problems.add("feed.reconnectMultiplier must be greater than 1.0");
        }
        positive(c.reconnectMaxAttempts(), "feed.reconnectMaxAttempts", problems);
        positive(c.pollIntervalMs(), "feed.pollIntervalMs", problems);
        positive(c.heartbeatIntervalMs(), "feed.heartbeatIntervalMs", problems);

        FeedSourceConfig source = c.source();
        if (source == null) {
            problems.add("feed.source section is missing");
            return;
        }
        if (require(source.type(), "feed.source.type", problems)) {
            if (source.type() == FeedSourceType.RELAY) {
                require(source.relayUrl(), "feed.source.relayUrl", problems);
            } else {
                require(source.filePath(), "feed.source.filePath", problems);
                require(source.replaySpeed(), "feed.source.replaySpeed", problems);
            }
        }
        FieldMappingConfig mapping = source.mapping();
        if (mapping == null) {
            problems.add("feed.source.mapping section is missing");
            return;
        }
        require(mapping.priceField(), "feed.source.mapping.priceField", problems);
        positive(mapping.priceScale(), "feed.source.mapping.priceScale", problems);
        if (mapping.timestampField() != null) {
            require(mapping.timestampFormat(), "feed.source.mapping.timestampFormat", problems);
        }
    }

    private static void checkDiagnostics(DiagnosticsConfig c, List<String> problems) {
        if (c == null) {
            problems.add("diagnostics section is missing");
            return;
        }
        if (require(c.rateLimitMode(), "diagnostics.rateLimitMode", problems)) {
            if (c.rateLimitMode() == RateLimitMode.COUNT) {
                positive(c.everyNEvents(), "diagnostics.everyNEvents", problems);
            } else {
                positive(c.minIntervalMs(), "diagnostics.minIntervalMs", problems);
            }
        }
    }

    // ---------------------------------------------------------------

    private static boolean require(Object value, String name, List<String> problems) {
        if (value == null || (value instanceof String && ((String) value).isBlank())) {
            problems.add(name + " is missing");
            return false;
        }
        return true;
    }

    private static boolean enabled(Boolean toggle, String name, List<String> problems) {
        return require(toggle, name, problems) && toggle;
    }

    private static boolean positive(Number value, String name, List<String> problems) {
        if (!require(value, name, problems)) {
            return false;
        }
        if (signum(value) <= 0) {
            problems.add(name + " must be positive, got " + value);
            return false;
        }
        return true;
    }

    private static boolean nonNegative(Number value, String name, List<String> problems) {
        if (!require(value, name, problems)) {
            return false;
        }
        if (signum(value) < 0) {
            problems.add(name + " must not be negative, got " + value);
            return false;
        }
        return true;
    }

    private static boolean inRange(Double value, String name, List<String> problems) {
        if (!require(value, name, problems)) {
            return false;
        }
        if (value < 0 || value > 100) {
            problems.add(name + " must be within 0..100, got " + value);
            return false;
        }
        return true;
    }

    private static LocalTime time(String value, String name, List<String> problems) {
        if (!require(value, name, problems)) {
            return null;
        }
        try {
            return LocalTime.parse(value);
        } catch (DateTimeParseException e) {
            problems.add(name + " is not HH:mm: " + value);
            return null;
        }
    }

    private static int signum(Number value) {
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).signum();
        }
        return Double.compare(value.doubleValue(), 0.0);
    }

    private SessionConfigValidator() {}
}
