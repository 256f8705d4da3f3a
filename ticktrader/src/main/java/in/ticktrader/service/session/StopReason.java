package in.ticktrader.service.session;

/**
 * Why a session ended. Each maps to the terminal message shown to the operator.
 */
public enum StopReason {
    OPERATOR_STOP("stopped: operator request"),
    ERROR_STREAK_EXCEEDED("stopped: error streak exceeded"),
    FEED_UNRECOVERABLE("stopped: feed unrecoverable"),
    FEED_CONNECT_FAILED("stopped: feed connect failed"),
    FEED_COMPLETED("stopped: feed completed"),
    SESSION_WINDOW_ENDED("stopped: session window ended"),
    INVALID_INSTRUMENT_PARAMS("stopped: invalid instrument parameters"),
    INTERRUPTED("stopped: interrupted"),
    INTERNAL_ERROR("stopped: internal error");

    private final String message;

    StopReason(String message) {
        this.message = message;
    }

    /**
     * Stops that indicate a fault rather than a normal end of session.
     */
    public boolean isFault() {
        return this != OPERATOR_STOP && this != FEED_COMPLETED && this != SESSION_WINDOW_ENDED;
    }

    /**
     * Terminal message, optionally with detail: "stopped: feed unrecoverable after 5 attempts".
     */
    public String terminalMessage(String detail) {
        return detail == null || detail.isBlank() ? message : message + " " + detail;
    }
}
