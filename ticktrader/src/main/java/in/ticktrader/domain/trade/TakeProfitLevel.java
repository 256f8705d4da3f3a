package in.ticktrader.domain.trade;

import java.math.BigDecimal;

/**
 * One rung of the take-profit ladder.
 *
 * @param triggerPrice absolute price that fires the level
 * @param fraction share of the opening quantity closed by this level (0, 1]
 * @param fired true once the level has executed; a level fires at most once
 */
public record TakeProfitLevel(
    BigDecimal triggerPrice,
    BigDecimal fraction,
    boolean fired
) {
    public TakeProfitLevel markFired() {
        return new TakeProfitLevel(triggerPrice, fraction, true);
    }
}
