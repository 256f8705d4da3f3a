package in.ticktrader.infrastructure.feed;

import in.ticktrader.domain.data.RawMessage;

import java.util.Optional;

/**
 * Where raw tick messages come from: a live socket or a deterministic replay.
 *
 * Implementations are driven by a single receive thread owned by the feed
 * adapter. {@link #connect()} may be called again after a disconnect.
 */
public interface FeedSource {

    /**
     * Short identifier for logs and metrics ("RELAY", "FILE").
     */
    String id();

    /**
     * Establish the upstream connection.
     *
     * @throws FeedConnectionException if the connection cannot be established
     */
    void connect();

    /**
     * Next raw message, waiting at most briefly. Empty when nothing arrived
     * in that window; empty does not imply disconnection.
     */
    Optional<RawMessage> nextRawMessage() throws InterruptedException;

    void disconnect();

    boolean isConnected();

    /**
     * True once a finite source has delivered its last message.
     * Live sources never exhaust.
     */
    default boolean isExhausted() {
        return false;
    }
}
