package in.ticktrader.domain.trade;

/**
 * Why (part of) a position was closed.
 */
public enum ExitReason {
    STOP_LOSS,        // hard stop breached
    TRAILING_STOP,    // armed trailing stop breached
    TAKE_PROFIT,      // one ladder level reached (partial or final)
    STRATEGY_SIGNAL,  // CLOSE signal from the decision engine
    SESSION_END,      // buffered session end reached
    SESSION_STOP      // session stopped (operator, error streak, feed failure)
}
