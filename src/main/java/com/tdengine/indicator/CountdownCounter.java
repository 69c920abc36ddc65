package com.tdengine.indicator;

import com.tdengine.domain.enums.TdComponent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bullish TD Countdown (13-count).
 *
 * <p>Armed on the bar that completes Setup 9, which also resets the count. While armed and
 * below target, a bar scores when its close is at or above the high two bars earlier.
 * Scored bars need not be consecutive. The start of a new Setup run disarms the counter and
 * resets the count.
 */
public final class CountdownCounter implements TdCalculator<CountdownCounter.State> {

    private static final Logger log = LoggerFactory.getLogger(CountdownCounter.class);

    /** Bars compared against: close[i] vs high[i - HIGH_OFFSET]. */
    public static final int HIGH_OFFSET = 2;

    private final int target;
    private final boolean countOnCompletionBar;

    public CountdownCounter(TdIndicatorProperties.Countdown settings) {
        this.target = settings.getTarget();
        this.countOnCompletionBar = settings.isCountOnCompletionBar();
    }

    @Override
    public TdComponent component() {
        return TdComponent.COUNTDOWN;
    }

    @Override
    public int minRequiredBars() {
        return HIGH_OFFSET + 1;
    }

    @Override
    public State initialState() {
        return State.IDLE;
    }

    public int getTarget() {
        return target;
    }

    public State step(State previous, BarHistory history, int index, SequentialSetupCounter.State setup) {
        if (index < HIGH_OFFSET) {
            return State.IDLE;
        }

        int countdown = previous.countdown();
        boolean counting = previous.counting();

        if (setup.completedThisBar()) {
            counting = true;
            countdown = 0;
        }

        boolean mayScore = countOnCompletionBar || !setup.completedThisBar();
        if (counting && mayScore && countdown < target) {
            if (history.close(index) >= history.high(index - HIGH_OFFSET)) {
                countdown++;
                if (countdown == target) {
                    log.debug("Countdown {} completed on {} bar {}", target, history.getSymbol(), index);
                }
            }
        }

        if (setup.runStartedThisBar()) {
            counting = false;
            countdown = 0;
        }

        return new State(countdown, counting);
    }

    /**
     * @param countdown scored bars since the counter was armed, 0..target
     * @param counting  whether the counter is armed
     */
    public record State(int countdown, boolean counting) {

        static final State IDLE = new State(0, false);
    }
}
