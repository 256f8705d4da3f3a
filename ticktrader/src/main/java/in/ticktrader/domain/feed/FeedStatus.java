package in.ticktrader.domain.feed;

/**
 * Connectivity status of the upstream feed.
 */
public enum FeedStatus {
    DISCONNECTED,   // not connected (initial, after disconnect, or terminal after retries exhausted)
    CONNECTING,     // connect issued, waiting for the first tick
    STREAMING,      // ticks arriving within the silence threshold
    SILENT,         // connected but no tick for longer than the silence threshold
    RECONNECTING    // reconnect with backoff in progress
}
