package in.ticktrader.service.signal;

import in.ticktrader.domain.trade.Direction;

import java.util.List;

/**
 * Result of evaluating every enabled entry check for one direction on one tick.
 */
public record EntryEvaluation(
    Direction direction,
    List<EntryCheck> passed,
    List<EntryCheck> failed
) {
    public EntryEvaluation {
        passed = List.copyOf(passed);
        failed = List.copyOf(failed);
    }

    public boolean isAccepted() {
        return failed.isEmpty();
    }

    /**
     * At least one gate failed.
     */
    public boolean isBlocked() {
        return failed.stream().anyMatch(EntryCheck::isGate);
    }

    /**
     * Every gate passed but at least one rule failed.
     */
    public boolean isRejected() {
        return !failed.isEmpty() && !isBlocked();
    }
}
