package com.tdengine.indicator;

import com.tdengine.domain.enums.TdComponent;

/**
 * Swing higher-low tracking with a one-bar confirmation delay.
 *
 * <p>When a bar's low rises above the previous bar's low and no candidate is pending, the
 * previous low becomes the candidate. On the next bar the candidate is confirmed: it
 * replaces the recent higher low only if it is higher, so the reported value never
 * decreases. The slot is then free for a new candidate from a later bar.
 */
public final class HigherLowTracker implements TdCalculator<HigherLowTracker.State> {

    @Override
    public TdComponent component() {
        return TdComponent.HIGHER_LOW;
    }

    @Override
    public int minRequiredBars() {
        return 2;
    }

    @Override
    public State initialState() {
        return State.INITIAL;
    }

    public State step(State previous, BarHistory history, int index) {
        double low = history.low(index);
        double recentHigherLow = previous.recentHigherLow();
        boolean pending = previous.pending();
        double candidate = previous.candidate();

        if (index > 0) {
            if (!pending && low > previous.previousLow()) {
                pending = true;
                candidate = previous.previousLow();
            } else if (pending) {
                if (candidate > recentHigherLow) {
                    recentHigherLow = candidate;
                }
                pending = false;
                candidate = 0.0;
            }
        }

        return new State(recentHigherLow, low, pending, candidate);
    }

    /**
     * @param recentHigherLow latest confirmed higher low; 0.0 before the first confirmation
     * @param previousLow     low of this bar, compared against by the next bar
     * @param pending         whether a candidate awaits confirmation
     * @param candidate       the pending candidate, 0.0 when none
     */
    public record State(double recentHigherLow, double previousLow, boolean pending, double candidate) {

        static final State INITIAL = new State(0.0, 0.0, false, 0.0);
    }
}
