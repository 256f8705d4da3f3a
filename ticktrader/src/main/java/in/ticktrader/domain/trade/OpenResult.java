package in.ticktrader.domain.trade;

/**
 * Outcome of a position open request.
 */
public record OpenResult(
    boolean success,
    String positionId,
    OpenFailure failure,
    String message
) {
    public static OpenResult success(String positionId) {
        return new OpenResult(true, positionId, null, "Opened");
    }

    public static OpenResult failure(OpenFailure failure, String message) {
        return new OpenResult(false, null, failure, message);
    }
}
