package in.ticktrader.domain.trade;

/**
 * Per-tick exit triggers evaluated by the risk manager, in the order given by
 * the configured precedence. The first trigger that matches handles the tick.
 */
public enum ExitTrigger {
    STOP_LOSS(ExitReason.STOP_LOSS),
    TRAILING_STOP(ExitReason.TRAILING_STOP),
    TAKE_PROFIT(ExitReason.TAKE_PROFIT),
    STRATEGY_SIGNAL(ExitReason.STRATEGY_SIGNAL);

    private final ExitReason reason;

    ExitTrigger(ExitReason reason) {
        this.reason = reason;
    }

    public ExitReason reason() {
        return reason;
    }
}
