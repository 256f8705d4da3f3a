package in.ticktrader.service.signal;

import in.ticktrader.domain.data.Tick;
import in.ticktrader.domain.signal.Signal;
import in.ticktrader.domain.trade.Direction;
import in.ticktrader.domain.trade.ExitReason;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Incremental entry / exit rules for one instrument.
 *
 * {@link #onTick(Tick)} is called once per tick by a single thread at a time.
 * It evaluates entry while no position is open and strategy exits while one
 * is; it never mutates positions. The risk manager reports position changes
 * through {@link #onPositionOpened} and {@link #onPositionClosed}.
 */
public interface DecisionEngine {

    /**
     * Update indicators and return at most one signal. A tick without price
     * or timestamp is skipped: no signal, no state change.
     */
    Optional<Signal> onTick(Tick tick);

    void onPositionOpened(Direction side, Instant openedAt);

    void onPositionClosed(ExitReason reason, Instant closedAt);

    /**
     * Lock-free snapshot of indicator state, for other threads.
     */
    IndicatorSnapshot snapshot();

    /**
     * Entry evaluations of the most recent tick that evaluated entry.
     */
    List<EntryEvaluation> lastEntryEvaluations();
}
