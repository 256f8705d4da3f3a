package in.ticktrader.service.session;

import in.ticktrader.domain.feed.ConsumptionMode;
import in.ticktrader.domain.feed.FeedConnectionState;
import in.ticktrader.domain.trade.PositionSnapshot;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Final result of one session, handed to the results sink on stop.
 *
 * {@code closedPositions} is ordered by close time and carries every exit leg.
 */
public record SessionReport(
    String sessionId,
    String instrumentId,
    ConsumptionMode consumptionMode,
    Instant startedAt,
    Instant stoppedAt,
    StopReason stopReason,
    String terminalMessage,
    List<PositionSnapshot> closedPositions,
    FeedConnectionState finalFeedState,
    BigDecimal initialCapital,
    BigDecimal realizedPnl,
    BigDecimal finalCapital,
    long ticksReceived,
    long ticksEvicted,
    long ticksProcessed,
    long malformedTicks,
    long processingErrors,
    int maxErrorStreak,
    long formatErrors,
    long callbackFaults
) {
    public SessionReport {
        closedPositions = List.copyOf(closedPositions);
    }
}
