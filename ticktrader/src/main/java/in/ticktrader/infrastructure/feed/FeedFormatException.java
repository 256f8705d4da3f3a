package in.ticktrader.infrastructure.feed;

/**
 * A raw feed message could not be turned into a tick at all (bad number,
 * bad timestamp, unparseable frame).
 */
public class FeedFormatException extends RuntimeException {

    public FeedFormatException(String message) {
        super(message);
    }

    public FeedFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
