package in.ticktrader.infrastructure.feed;

/**
 * Connecting (or reconnecting) to a feed source failed.
 */
public class FeedConnectionException extends RuntimeException {

    private final String feedId;

    public FeedConnectionException(String feedId, String message) {
        super("[" + feedId + "] " + message);
        this.feedId = feedId;
    }

    public FeedConnectionException(String feedId, String message, Throwable cause) {
        super("[" + feedId + "] " + message, cause);
        this.feedId = feedId;
    }

    public String getFeedId() {
        return feedId;
    }
}
