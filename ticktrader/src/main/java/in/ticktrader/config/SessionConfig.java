package in.ticktrader.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import in.ticktrader.domain.feed.ConsumptionMode;

/**
 * Complete configuration of one trading session.
 *
 * Bound from JSON by {@link SessionConfigLoader} and checked by
 * {@link SessionConfigValidator} before anything is wired. Fields are boxed so
 * that an absent value stays null and is reported, never defaulted.
 */
public record SessionConfig(
    @JsonProperty("instrument")
    InstrumentConfig instrument,

    @JsonProperty("consumptionMode")
    ConsumptionMode consumptionMode,

    @JsonProperty("capital")
    CapitalConfig capital,

    @JsonProperty("risk")
    RiskConfig risk,

    @JsonProperty("strategy")
    StrategyConfig strategy,

    @JsonProperty("session")
    SessionWindowConfig session,

    @JsonProperty("feed")
    FeedConfig feed,

    @JsonProperty("diagnostics")
    DiagnosticsConfig diagnostics
) {}
