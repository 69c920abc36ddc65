package com.tdengine.indicator;

import com.tdengine.domain.enums.PriceField;
import com.tdengine.domain.enums.TdComponent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * TDST support and resistance derived from the first four bars of a completed Setup.
 *
 * <p>Support is the lowest low of bars 1-4 of a bullish Setup, set on the bar that completes
 * the count and dropped on the first close below it. Resistance mirrors this for a bearish
 * Setup (nine consecutive closes below the close four bars earlier): the highest high of its
 * bars 1-4, dropped on the first close above it. Only that breakout bar is flagged as
 * broken; the flag does not carry forward.
 */
public final class TdstLevelTracker implements TdCalculator<TdstLevelTracker.State> {

    private static final Logger log = LoggerFactory.getLogger(TdstLevelTracker.class);

    /** Bars 1-4 of a 9-bar run ending at i span [i - 8, i - 5]. */
    private static final int SETUP_SPAN = SequentialSetupCounter.SETUP_BARS - 1;

    private static final int LEVEL_BARS = 4;

    @Override
    public TdComponent component() {
        return TdComponent.TDST_SUPPORT;
    }

    @Override
    public int minRequiredBars() {
        return SETUP_SPAN + 1;
    }

    @Override
    public State initialState() {
        return State.INITIAL;
    }

    public State step(State previous, BarHistory history, int index, SequentialSetupCounter.State setup) {
        double close = history.close(index);
        int levelEnd = index - SETUP_SPAN + LEVEL_BARS - 1;

        double supportLevel = previous.supportLevel();
        boolean supportActive = previous.supportActive();
        if (setup.completedThisBar() && index >= SETUP_SPAN) {
            supportLevel = history.lowest(PriceField.LOW, LEVEL_BARS, levelEnd);
            supportActive = true;
            log.debug("TDST support {} activated on {} bar {}", supportLevel, history.getSymbol(), index);
        }
        if (supportActive && close < supportLevel) {
            supportActive = false;
            log.debug("TDST support {} violated on {} bar {} (close={})", supportLevel, history.getSymbol(), index, close);
        }

        int bearishRun = previous.bearishRun();
        if (index >= SequentialSetupCounter.COMPARISON_OFFSET) {
            boolean qualifies = close < history.close(index - SequentialSetupCounter.COMPARISON_OFFSET);
            // capped one past completion so the rising edge to 9 stays detectable
            bearishRun = qualifies ? Math.min(bearishRun + 1, SequentialSetupCounter.SETUP_BARS + 1) : 0;
        }

        double resistanceLevel = previous.resistanceLevel();
        boolean resistanceActive = previous.resistanceActive();
        if (bearishRun == SequentialSetupCounter.SETUP_BARS
                && previous.bearishRun() < SequentialSetupCounter.SETUP_BARS
                && index >= SETUP_SPAN) {
            resistanceLevel = history.highest(PriceField.HIGH, LEVEL_BARS, levelEnd);
            resistanceActive = true;
            log.debug("TDST resistance {} activated on {} bar {}", resistanceLevel, history.getSymbol(), index);
        }
        boolean resistanceBroken = false;
        if (resistanceActive && close > resistanceLevel) {
            resistanceBroken = true;
            resistanceActive = false;
            log.debug(
                    "TDST resistance {} broken on {} bar {} (close={})",
                    resistanceLevel,
                    history.getSymbol(),
                    index,
                    close);
        }

        return new State(supportLevel, supportActive, resistanceLevel, resistanceActive, resistanceBroken, bearishRun);
    }

    /**
     * @param supportLevel     last TDST support level computed
     * @param supportActive    whether support is still intact
     * @param resistanceLevel  last TDST resistance level computed
     * @param resistanceActive whether resistance is still intact
     * @param resistanceBroken resistance was broken on this bar
     * @param bearishRun       consecutive bearish Setup bars, capped at 10
     */
    public record State(
            double supportLevel,
            boolean supportActive,
            double resistanceLevel,
            boolean resistanceActive,
            boolean resistanceBroken,
            int bearishRun) {

        static final State INITIAL = new State(0.0, false, 0.0, false, false, 0);

        /** Support as reported to callers: the level while active, otherwise 0.0. */
        public double reportedSupport() {
            return supportActive ? supportLevel : 0.0;
        }

        /** Resistance as reported to callers: the level while active or on its breakout bar. */
        public double reportedResistance() {
            return resistanceActive || resistanceBroken ? resistanceLevel : 0.0;
        }

        public int bearishSetupCount() {
            return Math.min(bearishRun, SequentialSetupCounter.SETUP_BARS);
        }
    }
}
