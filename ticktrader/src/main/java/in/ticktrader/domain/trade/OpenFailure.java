package in.ticktrader.domain.trade;

/**
 * Reasons a position request can be refused.
 */
public enum OpenFailure {
    INSUFFICIENT_CAPITAL(false),        // available capital cannot fund one lot within risk limits
    INVALID_INSTRUMENT_PARAMS(true),    // lot size / tick size absent or non-positive
    POSITION_ALREADY_OPEN(false),       // exclusivity check lost
    SESSION_STOPPED(false);             // risk manager no longer accepts entries

    private final boolean fatal;

    OpenFailure(boolean fatal) {
        this.fatal = fatal;
    }

    /**
     * Fatal failures indicate a configuration fault; the session must stop.
     */
    public boolean isFatal() {
        return fatal;
    }
}
