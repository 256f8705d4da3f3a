package in.ticktrader.service.feed;

/**
 * Outcome of {@link FeedAdapter#connect(CallbackBinding)}.
 */
public record ConnectResult(
    boolean success,
    String message,
    Throwable cause
) {
    public static ConnectResult success(String message) {
        return new ConnectResult(true, message, null);
    }

    public static ConnectResult failure(String message, Throwable cause) {
        return new ConnectResult(false, message, cause);
    }
}
