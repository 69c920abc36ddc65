package com.tdengine.indicator;

import com.tdengine.domain.enums.FollowThroughPolicy;
import com.tdengine.domain.enums.TdComponent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bullish TD Sequential Setup (9-count).
 *
 * <p>A bar qualifies when its close is above the close four bars earlier. Consecutive
 * qualifying bars advance the {@link SetupPhase}; the first failing bar returns it to Idle
 * and clears the setup's lowest low. On the bar that completes the count the counter records
 * the bar-9 close, where that close sits inside the bar's range, and seeds the
 * follow-through tracker used by the exit rules.
 */
public final class SequentialSetupCounter implements TdCalculator<SequentialSetupCounter.State> {

    private static final Logger log = LoggerFactory.getLogger(SequentialSetupCounter.class);

    public static final int SETUP_BARS = 9;

    /** Bars compared against: close[i] vs close[i - COMPARISON_OFFSET]. */
    public static final int COMPARISON_OFFSET = 4;

    /** Range position reported for a bar 9 whose high equals its low. */
    public static final double DEGENERATE_RANGE_PCT = 0.5;

    private final FollowThroughPolicy followThroughPolicy;

    public SequentialSetupCounter(FollowThroughPolicy followThroughPolicy) {
        this.followThroughPolicy = followThroughPolicy;
    }

    @Override
    public TdComponent component() {
        return TdComponent.SETUP;
    }

    @Override
    public int minRequiredBars() {
        return COMPARISON_OFFSET + 1;
    }

    @Override
    public State initialState() {
        return State.INITIAL;
    }

    public State step(State previous, BarHistory history, int index) {
        if (index < COMPARISON_OFFSET) {
            return State.INITIAL;
        }

        double close = history.close(index);
        double low = history.low(index);
        boolean qualifies = close > history.close(index - COMPARISON_OFFSET);

        SetupPhase phase = transition(previous.phase(), qualifies, close);
        boolean runStarted = phase instanceof SetupPhase.Building building && building.count() == 1;
        boolean completed = phase.isComplete() && !previous.phase().isComplete();

        double lowestLow;
        if (!qualifies) {
            lowestLow = 0.0;
        } else if (runStarted) {
            lowestLow = low;
        } else if (phase instanceof SetupPhase.Building || completed) {
            lowestLow = Math.min(previous.lowestLow(), low);
        } else {
            lowestLow = previous.lowestLow();
        }

        double bar9Close = previous.bar9Close();
        double bar9RangePct = previous.bar9RangePct();
        FollowThrough followThrough;

        if (completed) {
            double range = history.high(index) - low;
            bar9Close = close;
            bar9RangePct = range > 0 ? (close - low) / range : DEGENERATE_RANGE_PCT;
            followThrough = FollowThrough.seed(close);
            log.debug(
                    "Setup 9 completed on {} bar {} (close={}, rangePct={}, lowestLow={})",
                    history.getSymbol(),
                    index,
                    close,
                    bar9RangePct,
                    lowestLow);
        } else if (phase instanceof SetupPhase.Completed done) {
            followThrough = new FollowThrough(true, done.barsSince(), done.bestClose());
        } else if (followThroughPolicy == FollowThroughPolicy.STICKY && previous.followThrough().tracking()) {
            followThrough = previous.followThrough().advance(close);
        } else {
            followThrough = FollowThrough.NONE;
        }

        return new State(phase, lowestLow, bar9Close, bar9RangePct, followThrough, completed, runStarted);
    }

    /** Applies one row of the {@link SetupPhase} transition table. */
    static SetupPhase transition(SetupPhase phase, boolean qualifies, double close) {
        if (!qualifies) {
            return SetupPhase.IDLE;
        }
        if (phase instanceof SetupPhase.Building building) {
            int next = building.count() + 1;
            return next == SETUP_BARS ? new SetupPhase.Completed(0, close) : new SetupPhase.Building(next);
        }
        if (phase instanceof SetupPhase.Completed done) {
            return new SetupPhase.Completed(done.barsSince() + 1, Math.max(done.bestClose(), close));
        }
        return new SetupPhase.Building(1);
    }

    /**
     * Post-Setup-9 progress.
     *
     * @param tracking  whether a Setup 9 has seeded the tracker
     * @param barsSince bars since the seeding bar 9
     * @param bestClose highest close since the seeding bar 9
     */
    public record FollowThrough(boolean tracking, int barsSince, double bestClose) {

        static final FollowThrough NONE = new FollowThrough(false, 0, 0.0);

        static FollowThrough seed(double close) {
            return new FollowThrough(true, 0, close);
        }

        FollowThrough advance(double close) {
            return new FollowThrough(true, barsSince + 1, Math.max(bestClose, close));
        }
    }

    /**
     * @param phase            current run phase
     * @param lowestLow        lowest low of the run's first nine bars; 0.0 outside a run
     * @param bar9Close        close of the most recent bar 9
     * @param bar9RangePct     (close - low) / (high - low) of the most recent bar 9
     * @param followThrough    post-Setup-9 tracker
     * @param completedThisBar this bar completed the count (rising edge to 9)
     * @param runStartedThisBar this bar started a new run (rising edge to 1)
     */
    public record State(
            SetupPhase phase,
            double lowestLow,
            double bar9Close,
            double bar9RangePct,
            FollowThrough followThrough,
            boolean completedThisBar,
            boolean runStartedThisBar) {

        static final State INITIAL = new State(SetupPhase.IDLE, 0.0, 0.0, 0.0, FollowThrough.NONE, false, false);

        public int count() {
            return phase.count();
        }

        public boolean isComplete() {
            return phase.isComplete();
        }
    }
}
