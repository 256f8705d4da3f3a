package in.ticktrader.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

public record CapitalConfig(
    @JsonProperty("initialCapital")
    BigDecimal initialCapital
) {}
