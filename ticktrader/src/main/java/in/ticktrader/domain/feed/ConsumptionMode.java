package in.ticktrader.domain.feed;

/**
 * How ticks move from the feed to the decision path. Fixed for a session.
 */
public enum ConsumptionMode {
    /** Orchestration loop drains the bounded queue on a short fixed interval. */
    POLL,
    /** Feed thread invokes the tick handler inline; no queue wait. */
    CALLBACK
}
