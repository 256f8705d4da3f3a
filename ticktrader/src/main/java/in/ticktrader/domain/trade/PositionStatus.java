package in.ticktrader.domain.trade;

public enum PositionStatus {
    OPEN,
    CLOSING,
    CLOSED
}
