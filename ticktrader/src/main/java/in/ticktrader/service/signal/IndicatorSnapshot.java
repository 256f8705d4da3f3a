package in.ticktrader.service.signal;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Immutable view of the engine's indicator state after a tick.
 *
 * Indicator values are NaN until warmed up. Safe to read from any thread.
 */
public record IndicatorSnapshot(
    long ticksProcessed,
    BigDecimal lastPrice,
    Instant lastTickAt,
    LocalDate tradingDate,
    int tradesToday,
    int risingTicks,
    int fallingTicks,
    double fastEma,
    double slowEma,
    double macd,
    double macdSignal,
    double macdHistogram,
    double vwap,
    double rsi,
    double htfEma,
    double atr
) {
    public static IndicatorSnapshot empty() {
        return new IndicatorSnapshot(0, null, null, null, 0, 0, 0,
            Double.NaN, Double.NaN, Double.NaN, Double.NaN, Double.NaN,
            Double.NaN, Double.NaN, Double.NaN, Double.NaN);
    }
}
