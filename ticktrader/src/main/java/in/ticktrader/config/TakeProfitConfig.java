package in.ticktrader.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * One configured take-profit rung, relative to the entry price.
 */
public record TakeProfitConfig(
    @JsonProperty("points")
    BigDecimal points,       // favorable distance from entry

    @JsonProperty("fraction")
    BigDecimal fraction      // share of the opening quantity, (0, 1]
) {}
