package com.tdengine.indicator;

import com.tdengine.domain.enums.PriceField;
import com.tdengine.domain.enums.TdComponent;

/**
 * TD MA2 fast/slow crossover filter.
 *
 * <p>Fast and slow are SMAs of the close. The fast line is rising when it is at or above its
 * value two bars ago, the slow line when it is at or above its value one bar ago. An entry is
 * valid when both lines are rising and fast is above slow.
 *
 * <p>Each bar's state is recomputed from the history alone; no previous state is carried.
 */
public final class Ma2CrossoverFilter implements TdCalculator<Ma2CrossoverFilter.State> {

    private static final int FAST_SLOPE_BARS = 2;
    private static final int SLOW_SLOPE_BARS = 1;

    private final int fastPeriod;
    private final int slowPeriod;

    public Ma2CrossoverFilter(TdIndicatorProperties.Crossover settings) {
        this.fastPeriod = settings.getFastPeriod();
        this.slowPeriod = settings.getSlowPeriod();
    }

    @Override
    public TdComponent component() {
        return TdComponent.MA2_CROSSOVER;
    }

    @Override
    public int minRequiredBars() {
        return Math.max(fastPeriod + FAST_SLOPE_BARS, slowPeriod + SLOW_SLOPE_BARS);
    }

    @Override
    public State initialState() {
        return State.UNDEFINED;
    }

    public State step(BarHistory history, int index) {
        if (!isWarmedUp(index + 1)) {
            return State.UNDEFINED;
        }
        double fast = history.sma(PriceField.CLOSE, fastPeriod, index).orElseThrow();
        double slow = history.sma(PriceField.CLOSE, slowPeriod, index).orElseThrow();
        double fastBefore = history.sma(PriceField.CLOSE, fastPeriod, index - FAST_SLOPE_BARS).orElseThrow();
        double slowBefore = history.sma(PriceField.CLOSE, slowPeriod, index - SLOW_SLOPE_BARS).orElseThrow();

        boolean fastRising = fast - fastBefore >= 0;
        boolean slowRising = slow - slowBefore >= 0;
        return new State(fast, slow, fastRising, slowRising, fastRising && slowRising && fast > slow);
    }

    public record State(double fast, double slow, boolean fastRising, boolean slowRising, boolean entryValid) {

        static final State UNDEFINED = new State(0.0, 0.0, false, false, false);
    }
}
