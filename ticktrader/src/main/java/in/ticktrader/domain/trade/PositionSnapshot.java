package in.ticktrader.domain.trade;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Immutable copy of a position's full lifecycle state.
 *
 * Published by the risk manager after every mutation so that a second thread
 * (heartbeat, UI refresh, report) reads a consistent view without touching the
 * live position.
 */
public record PositionSnapshot(
    String id,
    String instrumentId,
    Direction side,
    BigDecimal entryPrice,
    int initialQuantity,
    int quantity,
    BigDecimal stopLoss,
    BigDecimal trailingStopPrice,
    boolean trailingArmed,
    List<TakeProfitLevel> takeProfitLevels,
    Instant openedAt,
    PositionStatus status,
    ExitReason closeReason,
    Instant closedAt,
    BigDecimal exitPrice,
    BigDecimal realizedPnl,
    List<PartialExit> exits
) {
    public PositionSnapshot {
        takeProfitLevels = List.copyOf(takeProfitLevels);
        exits = List.copyOf(exits);
    }

    public boolean isOpen() {
        return status != PositionStatus.CLOSED;
    }
}
