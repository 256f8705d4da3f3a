package in.ticktrader.domain.trade;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One executed exit leg of a position.
 */
public record PartialExit(
    BigDecimal price,
    int quantity,
    ExitReason reason,
    Instant exitedAt,
    BigDecimal realizedPnl
) {}
