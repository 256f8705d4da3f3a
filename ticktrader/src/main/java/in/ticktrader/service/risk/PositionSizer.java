package in.ticktrader.service.risk;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Position Sizer - whole-lot quantity from capital, risk and value limits.
 *
 * Sizing:
 * 1. Risk budget:  capital x riskPerTrade% / (stop distance x lot size)
 * 2. Value budget: capital x maxPositionValue% / (entry x lot size)
 * 3. Lots = min(1, 2), rounded down
 *
 * Zero lots means the capital cannot carry even one lot within the limits.
 */
public final class PositionSizer {
    private static final Logger log = LoggerFactory.getLogger(PositionSizer.class);

    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private final BigDecimal riskPerTradePercent;
    private final BigDecimal maxPositionValuePercent;

    public PositionSizer(BigDecimal riskPerTradePercent, BigDecimal maxPositionValuePercent) {
        this.riskPerTradePercent = riskPerTradePercent;
        this.maxPositionValuePercent = maxPositionValuePercent;
    }

    /**
     * @param entryPrice expected fill price
     * @param stopDistance distance from entry to stop-loss, in points
     * @param lotSize contracts per lot
     * @param availableCapital capital currently available
     */
    public PositionSize size(BigDecimal entryPrice, BigDecimal stopDistance, int lotSize, BigDecimal availableCapital) {
        if (availableCapital.signum() <= 0 || entryPrice.signum() <= 0) {
            return PositionSize.none(BigDecimal.ZERO, BigDecimal.ZERO);
        }
        BigDecimal lot = BigDecimal.valueOf(lotSize);

        BigDecimal riskBudget = availableCapital.multiply(riskPerTradePercent).divide(HUNDRED, 8, RoundingMode.HALF_UP);
        long riskLots = stopDistance.signum() > 0
            ? riskBudget.divide(stopDistance.multiply(lot), 0, RoundingMode.DOWN).longValue()
            : Long.MAX_VALUE;

        BigDecimal valueBudget = availableCapital.multiply(maxPositionValuePercent).divide(HUNDRED, 8, RoundingMode.HALF_UP);
        long valueLots = valueBudget.divide(entryPrice.multiply(lot), 0, RoundingMode.DOWN).longValue();

        long lots = Math.min(riskLots, valueLots);
        if (lots <= 0) {
            log.debug("[RISK] Sizing yields 0 lots (risk lots={}, value lots={})", riskLots, valueLots);
            return PositionSize.none(riskBudget, valueBudget);
        }
        int capped = (int) Math.min(lots, Integer.MAX_VALUE / lotSize);
        return new PositionSize(capped, capped * lotSize, riskBudget, valueBudget);
    }

    public record PositionSize(
        int lots,
        int quantity,
        BigDecimal riskBudget,
        BigDecimal valueBudget
    ) {
        static PositionSize none(BigDecimal riskBudget, BigDecimal valueBudget) {
            return new PositionSize(0, 0, riskBudget, valueBudget);
        }

        public boolean isTradable() {
            return lots > 0;
        }
    }
}
