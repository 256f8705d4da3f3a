package in.ticktrader.service.risk;

import in.ticktrader.domain.trade.PositionSnapshot;

/**
 * Position lifecycle notifications from {@link RiskManager}, delivered after
 * the risk manager's lock has been released.
 */
public interface PositionListener {

    default void onPositionOpened(PositionSnapshot position) {}

    default void onPositionClosed(PositionSnapshot position) {}
}
