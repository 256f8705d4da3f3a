package in.ticktrader.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Entry / exit rule parameters for the decision engine.
 *
 * Each indicator has an on/off toggle; the toggle is always required, the
 * indicator's own parameters are required when it is on.
 */
public record StrategyConfig(
    @JsonProperty("allowShort")
    Boolean allowShort,

    // Consecutive-tick gate
    @JsonProperty("useConsecutiveTicks")
    Boolean useConsecutiveTicks,
    @JsonProperty("consecutiveTicksRequired")
    Integer consecutiveTicksRequired,
    @JsonProperty("noiseFilterEnabled")
    Boolean noiseFilterEnabled,
    @JsonProperty("noiseFilterPercentage")
    Double noiseFilterPercentage,       // 0.0001 = 0.01% of previous price
    @JsonProperty("noiseFilterMinTicks")
    Double noiseFilterMinTicks,         // multiples of tick size

    // EMA crossover
    @JsonProperty("useEmaCrossover")
    Boolean useEmaCrossover,
    @JsonProperty("fastEma")
    Integer fastEma,
    @JsonProperty("slowEma")
    Integer slowEma,

    // MACD
    @JsonProperty("useMacd")
    Boolean useMacd,
    @JsonProperty("macdFast")
    Integer macdFast,
    @JsonProperty("macdSlow")
    Integer macdSlow,
    @JsonProperty("macdSignal")
    Integer macdSignal,

    // VWAP
    @JsonProperty("useVwap")
    Boolean useVwap,

    // RSI band
    @JsonProperty("useRsiFilter")
    Boolean useRsiFilter,
    @JsonProperty("rsiLength")
    Integer rsiLength,
    @JsonProperty("rsiOversold")
    Double rsiOversold,
    @JsonProperty("rsiOverbought")
    Double rsiOverbought,

    // Higher-timeframe trend
    @JsonProperty("useHtfTrend")
    Boolean useHtfTrend,
    @JsonProperty("htfPeriod")
    Integer htfPeriod,

    // Volatility / volume confirmation
    @JsonProperty("useAtrFilter")
    Boolean useAtrFilter,
    @JsonProperty("atrLength")
    Integer atrLength,
    @JsonProperty("minAtr")
    Double minAtr,
    @JsonProperty("useVolumeFilter")
    Boolean useVolumeFilter,
    @JsonProperty("minTickVolume")
    Long minTickVolume,

    // Strategy exits
    @JsonProperty("exitOnOppositeCrossover")
    Boolean exitOnOppositeCrossover,
    @JsonProperty("exitOnAdverseTick")
    Boolean exitOnAdverseTick,

    // Consecutive failed ticks before the session is forced to stop
    @JsonProperty("errorStreakThreshold")
    Integer errorStreakThreshold
) {}
