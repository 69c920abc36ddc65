package com.tdengine.indicator;

import com.tdengine.domain.enums.PriceField;
import com.tdengine.domain.enums.TdComponent;
import com.tdengine.domain.enums.UndefinedAveragePolicy;
import java.util.OptionalDouble;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * TD Moving Average I and II breakout triggers.
 *
 * <p>TD MA I fires when a bar's low is above the lowest low of the prior
 * {@code lookbackPeriod} bars; TD MA II fires when a bar's close is above the highest close
 * of the prior {@code lookbackPeriod} bars. A trigger opens an active window of
 * {@code extensionBars} bars (the trigger bar included) valued at the SMA of the same
 * price field on the trigger bar. A re-trigger inside an open window restarts the
 * countdown and re-values the window; windows never stack.
 */
public final class MovingAverageTrigger implements TdCalculator<MovingAverageTrigger.State> {

    private static final Logger log = LoggerFactory.getLogger(MovingAverageTrigger.class);

    private final TdComponent component;
    private final PriceField field;
    private final int lookbackPeriod;
    private final int averagePeriod;
    private final int extensionBars;
    private final UndefinedAveragePolicy undefinedAveragePolicy;

    private MovingAverageTrigger(
            TdComponent component, PriceField field, TdIndicatorProperties.MovingAverage settings) {
        this.component = component;
        this.field = field;
        this.lookbackPeriod = settings.getLookbackPeriod();
        this.averagePeriod = settings.getAveragePeriod();
        this.extensionBars = settings.getExtensionBars();
        this.undefinedAveragePolicy = settings.getUndefinedAveragePolicy();
    }

    /** TD MA I: breakout of lows, valued at SMA(low). */
    public static MovingAverageTrigger tdMa1(TdIndicatorProperties.MovingAverage settings) {
        return new MovingAverageTrigger(TdComponent.TD_MA1, PriceField.LOW, settings);
    }

    /** TD MA II: breakout of closes, valued at SMA(close). */
    public static MovingAverageTrigger tdMa2(TdIndicatorProperties.MovingAverage settings) {
        return new MovingAverageTrigger(TdComponent.TD_MA2, PriceField.CLOSE, settings);
    }

    @Override
    public TdComponent component() {
        return component;
    }

    @Override
    public int minRequiredBars() {
        return Math.max(lookbackPeriod + 1, averagePeriod);
    }

    @Override
    public State initialState() {
        return State.INACTIVE;
    }

    public State step(State previous, BarHistory history, int index) {
        int barsRemaining = previous.barsRemaining();
        double windowValue = previous.value();

        if (index >= lookbackPeriod && isTriggered(history, index)) {
            OptionalDouble average = history.sma(field, averagePeriod, index);
            if (average.isPresent()) {
                barsRemaining = extensionBars;
                windowValue = average.getAsDouble();
            } else if (undefinedAveragePolicy == UndefinedAveragePolicy.LENIENT_ZERO) {
                barsRemaining = extensionBars;
                windowValue = 0.0;
                log.debug(
                        "{} triggered on {} bar {} before SMA({}) is defined, window valued at 0.0",
                        component,
                        history.getSymbol(),
                        index,
                        averagePeriod);
            }
        }

        if (barsRemaining > 0) {
            return new State(true, windowValue, barsRemaining - 1);
        }
        return State.INACTIVE;
    }

    private boolean isTriggered(BarHistory history, int index) {
        if (field == PriceField.LOW) {
            return history.low(index) > history.lowest(PriceField.LOW, lookbackPeriod, index - 1);
        }
        return history.close(index) > history.highest(PriceField.CLOSE, lookbackPeriod, index - 1);
    }

    /**
     * @param active        whether the window covers this bar
     * @param value         SMA captured on the last trigger; 0.0 while inactive
     * @param barsRemaining bars the window stays open after this one
     */
    public record State(boolean active, double value, int barsRemaining) {

        static final State INACTIVE = new State(false, 0.0, 0);
    }
}
