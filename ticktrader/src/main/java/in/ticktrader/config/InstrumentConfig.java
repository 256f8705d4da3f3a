package in.ticktrader.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * Instrument identity and contract parameters.
 */
public record InstrumentConfig(
    @JsonProperty("instrumentId")
    String instrumentId,     // e.g. "NIFTY24DEC24000CE"

    @JsonProperty("exchange")
    String exchange,         // NFO, NSE, BFO

    @JsonProperty("lotSize")
    Integer lotSize,         // contracts per lot

    @JsonProperty("tickSize")
    BigDecimal tickSize      // minimum price increment
) {}
