package in.ticktrader.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import in.ticktrader.domain.trade.ExitTrigger;

import java.math.BigDecimal;
import java.util.List;

/**
 * Position risk parameters. All offsets are in price points.
 */
public record RiskConfig(
    @JsonProperty("stopLossPoints")
    BigDecimal stopLossPoints,

    @JsonProperty("takeProfitLevels")
    List<TakeProfitConfig> takeProfitLevels,

    @JsonProperty("useTrailingStop")
    Boolean useTrailingStop,

    @JsonProperty("trailActivationPoints")
    BigDecimal trailActivationPoints,   // favorable move before the trail arms

    @JsonProperty("trailDistancePoints")
    BigDecimal trailDistancePoints,     // distance of the trail from the best price

    @JsonProperty("riskPerTradePercent")
    BigDecimal riskPerTradePercent,     // capital at risk per trade (stop distance x qty)

    @JsonProperty("maxPositionValuePercent")
    BigDecimal maxPositionValuePercent, // cap on notional as % of available capital

    @JsonProperty("commissionPercent")
    BigDecimal commissionPercent,       // per leg, on notional

    @JsonProperty("exitPrecedence")
    List<ExitTrigger> exitPrecedence    // order of evaluation when several triggers match one tick
) {}
