package com.tdengine.indicator;

/**
 * Phase of the bullish TD Sequential Setup run.
 *
 * <pre>
 *  from \ condition   | close[i] &gt; close[i-4]          | otherwise
 *  -------------------+---------------------------------+----------
 *  Idle               | Building(1)                     | Idle
 *  Building(n), n &lt; 8 | Building(n + 1)                 | Idle
 *  Building(8)        | Completed(0, close)             | Idle
 *  Completed(k, best) | Completed(k + 1, max(best, c))  | Idle
 * </pre>
 *
 * A run that keeps qualifying after bar 9 stays Completed; only a failing bar ends it.
 */
public sealed interface SetupPhase permits SetupPhase.Idle, SetupPhase.Building, SetupPhase.Completed {

    Idle IDLE = new Idle();

    /** Setup count reported to callers, 0..9. */
    int count();

    default boolean isComplete() {
        return this instanceof Completed;
    }

    record Idle() implements SetupPhase {
        @Override
        public int count() {
            return 0;
        }
    }

    record Building(int count) implements SetupPhase {}

    /**
     * @param barsSince bars elapsed since the bar that completed the count
     * @param bestClose highest close from bar 9 onwards
     */
    record Completed(int barsSince, double bestClose) implements SetupPhase {
        @Override
        public int count() {
            return SequentialSetupCounter.SETUP_BARS;
        }
    }
}
