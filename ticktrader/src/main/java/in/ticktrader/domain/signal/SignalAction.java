package in.ticktrader.domain.signal;

public enum SignalAction {
    ENTER_LONG,
    ENTER_SHORT,
    CLOSE;

    public boolean isEntry() {
        return this == ENTER_LONG || this == ENTER_SHORT;
    }
}
