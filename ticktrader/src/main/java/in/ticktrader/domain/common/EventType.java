package in.ticktrader.domain.common;

/**
 * Diagnostic event types produced by the trading pipeline for an external
 * logging / observability collaborator.
 */
public enum EventType {
    // ═══════════════════════════════════════════════════════════════
    // ENTRY EVALUATION (decision engine)
    // ═══════════════════════════════════════════════════════════════
    ENTRY_BLOCKED,      // a gating filter failed (session, cap, consecutive ticks)
    ENTRY_REJECTED,     // gating passed, an indicator rule failed
    ENTRY_ACCEPTED,     // every enabled check passed, ENTER emitted

    // ═══════════════════════════════════════════════════════════════
    // POSITION LIFECYCLE (risk manager)
    // ═══════════════════════════════════════════════════════════════
    POSITION_OPENED,
    POSITION_OPEN_FAILED,
    EXIT_TRIGGERED,

    // ═══════════════════════════════════════════════════════════════
    // FEED / SESSION
    // ═══════════════════════════════════════════════════════════════
    FEED_RECONNECTING,
    FEED_RECONNECTED,
    FEED_UNRECOVERABLE,
    SESSION_STOPPED;

    /**
     * High-frequency types that are subject to rate limiting.
     */
    public boolean isRateLimited() {
        return this == ENTRY_BLOCKED || this == ENTRY_REJECTED;
    }
}
