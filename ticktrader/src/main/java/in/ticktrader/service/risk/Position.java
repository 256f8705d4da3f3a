package in.ticktrader.service.risk;

import in.ticktrader.domain.trade.Direction;
import in.ticktrader.domain.trade.ExitReason;
import in.ticktrader.domain.trade.PartialExit;
import in.ticktrader.domain.trade.PositionSnapshot;
import in.ticktrader.domain.trade.PositionStatus;
import in.ticktrader.domain.trade.TakeProfitLevel;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Live, mutable position. Only {@link RiskManager} holds a reference and only
 * while holding its lock; everyone else sees {@link PositionSnapshot}s.
 */
final class Position {

    private static final BigDecimal HUNDRED = new BigDecimal("100");

    final String id;
    final String instrumentId;
    final Direction side;
    final BigDecimal entryPrice;
    final int lotSize;
    final int initialQuantity;
    final Instant openedAt;
    final BigDecimal stopLoss;
    final List<TakeProfitLevel> levels;

    int quantity;
    BigDecimal bestPrice;
    BigDecimal trailingStop;
    boolean trailingArmed;
    PositionStatus status = PositionStatus.OPEN;
    ExitReason closeReason;
    Instant closedAt;
    BigDecimal exitPrice;
    BigDecimal realizedPnl = BigDecimal.ZERO;
    final List<PartialExit> exits = new ArrayList<>();

    Position(String id, String instrumentId, Direction side, BigDecimal entryPrice, int lotSize,
             int quantity, Instant openedAt, BigDecimal stopLoss, List<TakeProfitLevel> levels) {
        this.id = id;
        this.instrumentId = instrumentId;
        this.side = side;
        this.entryPrice = entryPrice;
        this.lotSize = lotSize;
        this.initialQuantity = quantity;
        this.quantity = quantity;
        this.openedAt = openedAt;
        this.stopLoss = stopLoss;
        this.levels = new ArrayList<>(levels);
        this.bestPrice = entryPrice;
    }

    boolean isOpen() {
        return status == PositionStatus.OPEN;
    }

    /**
     * Track the best price seen, arm the trail past the activation offset and
     * ratchet it. The trail never moves against the position.
     */
    void updateTrailing(BigDecimal price, BigDecimal activation, BigDecimal distance) {
        if (side.reached(price, bestPrice) && price.compareTo(bestPrice) != 0) {
            bestPrice = price;
        }
        if (!trailingArmed && side.reached(bestPrice, side.favorable(entryPrice, activation))) {
            trailingArmed = true;
        }
        if (trailingArmed) {
            BigDecimal candidate = side.adverse(bestPrice, distance);
            if (trailingStop == null || side.reached(candidate, trailingStop)) {
                trailingStop = candidate;
            }
        }
    }

    /**
     * Close {@code qty} at {@code price}; the position closes when nothing remains.
     */
    PartialExit exit(int qty, BigDecimal price, ExitReason reason, Instant at, BigDecimal commissionPercent) {
        BigDecimal q = BigDecimal.valueOf(qty);
        BigDecimal gross = price.subtract(entryPrice).multiply(side.sign()).multiply(q);
        BigDecimal turnover = entryPrice.multiply(q).add(price.multiply(q));
        BigDecimal commission = turnover.multiply(commissionPercent).divide(HUNDRED, 8, RoundingMode.HALF_UP);
        BigDecimal net = gross.subtract(commission);

        PartialExit leg = new PartialExit(price, qty, reason, at, net);
        exits.add(leg);
        quantity -= qty;
        realizedPnl = realizedPnl.add(net);
        exitPrice = price;
        if (quantity == 0) {
            status = PositionStatus.CLOSED;
            closeReason = reason;
            closedAt = at;
        }
        return leg;
    }

    PositionSnapshot snapshot() {
        return new PositionSnapshot(
            id, instrumentId, side, entryPrice, initialQuantity, quantity,
            stopLoss, trailingStop, trailingArmed, levels, openedAt,
            status, closeReason, closedAt, exitPrice, realizedPnl, exits);
    }
}
