package com.tdengine.domain.model;

import com.tdengine.domain.enums.TdComponent;
import java.util.Set;
import lombok.Builder;
import lombok.Value;

/**
 * Combined DeMark indicator output for a single bar.
 *
 * <p>Produced once per bar by the IndicatorEngine and never mutated afterwards. Zero and
 * false values are ambiguous on their own (inactive vs. not enough history), so every
 * state also lists the components that were still warming up on that bar.
 */
@Value
@Builder
public class IndicatorState {

    int barIndex;

    // TD MA I / II
    boolean ma1Active;
    double ma1Value;
    boolean ma2Active;
    double ma2Value;

    // TD Sequential Setup
    int setupCount;
    boolean setupComplete;
    double setupBar9Close;
    double setupBar9RangePct;
    double setupLowestLow;
    int barsSinceSetup9;
    double highestCloseSinceSetup9;

    // TDST
    double tdstSupport;
    boolean tdstActive;
    double tdstResistance;
    boolean tdstResActive;
    boolean tdstResBroken;

    // TD Countdown
    int countdown;
    boolean countdownComplete;

    double recentHigherLow;

    // MA2 crossover filter
    double ma2Fast;
    double ma2Slow;
    boolean ma2FastRising;
    boolean ma2SlowRising;
    boolean ma2CrossoverEntryValid;

    Set<TdComponent> warmingUp;

    /** Both TD MA windows are open on this bar. */
    public boolean isTdEntryValid() {
        return ma1Active && ma2Active;
    }

    public boolean isMa2FastBelowSlow() {
        return isWarmedUp(TdComponent.MA2_CROSSOVER) && ma2Fast < ma2Slow;
    }

    public boolean isWarmedUp(TdComponent component) {
        return warmingUp == null || !warmingUp.contains(component);
    }

    public boolean isFullyWarmedUp() {
        return warmingUp == null || warmingUp.isEmpty();
    }
}
