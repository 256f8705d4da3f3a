package in.ticktrader.service.session;

import in.ticktrader.domain.trade.PartialExit;
import in.ticktrader.domain.trade.PositionSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the session summary and trade ledger to the log.
 */
public final class LoggingSessionResultsSink implements SessionResultsSink {
    private static final Logger log = LoggerFactory.getLogger(LoggingSessionResultsSink.class);

    @Override
    public void publish(SessionReport r) {
        log.info("════════════════════════════════════════════════════════");
        log.info("[SESSION] {} {} ({}): {}", r.sessionId(), r.instrumentId(), r.consumptionMode(), r.terminalMessage());
        log.info("[SESSION] Capital {} -> {} (realized {})",
            r.initialCapital().toPlainString(), r.finalCapital().toPlainString(), r.realizedPnl().toPlainString());
        log.info("[SESSION] Ticks received={}, processed={}, malformed={}, errors={}, evicted={}, max streak={}",
            r.ticksReceived(), r.ticksProcessed(), r.malformedTicks(), r.processingErrors(),
            r.ticksEvicted(), r.maxErrorStreak());
        log.info("[SESSION] Trades: {}", r.closedPositions().size());
        for (PositionSnapshot p : r.closedPositions()) {
            log.info("[SESSION]   {} {} x{} @ {} -> {} ({}) pnl {}",
                p.id(), p.side(), p.initialQuantity(), p.entryPrice().toPlainString(),
                p.exitPrice() == null ? "-" : p.exitPrice().toPlainString(),
                p.closeReason(), p.realizedPnl().toPlainString());
            if (p.exits().size() > 1) {
                for (PartialExit leg : p.exits()) {
                    log.info("[SESSION]     leg {} x{} @ {} pnl {}",
                        leg.reason(), leg.quantity(), leg.price().toPlainString(), leg.realizedPnl().toPlainString());
                }
            }
        }
        log.info("════════════════════════════════════════════════════════");
    }
}
