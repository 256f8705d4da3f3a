package in.ticktrader.service.signal;

/**
 * Individually attributable entry checks.
 *
 * Gates are cheap preconditions; a gate failure "blocks" entry. Rules are
 * indicator conditions evaluated after the gates; a rule failure "rejects" it.
 */
public enum EntryCheck {
    SESSION_WINDOW(true),       // inside the entry window of the session
    DAILY_TRADE_CAP(true),      // trades today below the cap
    CONSECUTIVE_TICKS(true),    // N consecutive moves in the entry direction

    EMA_CROSSOVER(false),       // fast EMA on the right side of slow EMA
    MACD(false),                // MACD above/below signal with matching histogram
    VWAP(false),                // price on the right side of session VWAP
    RSI(false),                 // RSI not overbought (long) / oversold (short)
    HTF_TREND(false),           // price on the right side of the higher-timeframe EMA
    ATR(false),                 // tick ATR at or above the floor
    VOLUME(false);              // tick volume at or above the floor

    private final boolean gate;

    EntryCheck(boolean gate) {
        this.gate = gate;
    }

    public boolean isGate() {
        return gate;
    }
}
