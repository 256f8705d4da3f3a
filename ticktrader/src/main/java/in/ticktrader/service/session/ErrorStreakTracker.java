package in.ticktrader.service.session;

/**
 * Consecutive failed ticks (malformed or failed in processing).
 *
 * Owned by the tick path; not thread-safe on its own.
 */
public final class ErrorStreakTracker {

    private final int threshold;
    private int streak = 0;
    private int maxStreak = 0;

    public ErrorStreakTracker(int threshold) {
        if (threshold <= 0) {
            throw new IllegalArgumentException("threshold must be positive: " + threshold);
        }
        this.threshold = threshold;
    }

    /**
     * @return true once the streak has reached the threshold
     */
    public boolean recordFailure() {
        streak++;
        maxStreak = Math.max(maxStreak, streak);
        return streak >= threshold;
    }

    public void recordSuccess() {
        streak = 0;
    }

    public int streak() {
        return streak;
    }

    public int maxStreak() {
        return maxStreak;
    }
}
