package com.tdengine.indicator;

import com.tdengine.domain.enums.TdComponent;
import com.tdengine.domain.model.Bar;
import com.tdengine.domain.model.IndicatorState;
import com.tdengine.exception.InsufficientHistoryException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Folds the DeMark calculators over one instrument's bar sequence.
 *
 * <p>Every bar runs one pure {@link #step} over the previous {@link EngineState}: TD MA I,
 * TD MA II and the Setup counter first, then Countdown and TDST (which read that bar's Setup
 * edges), then the higher-low tracker and the MA2 crossover filter. The combined result is
 * projected into an immutable {@link IndicatorState} and appended to the history, so bars
 * can be fed all at once for a backtest or one at a time for live use.
 *
 * <p>Thread safety: none needed and none provided. An engine belongs to a single instrument;
 * separate instruments use separate engines and share nothing.
 */
public class IndicatorEngine {

    private static final Logger log = LoggerFactory.getLogger(IndicatorEngine.class);

    private final BarHistory history;
    private final MovingAverageTrigger tdMa1;
    private final MovingAverageTrigger tdMa2;
    private final SequentialSetupCounter setupCounter;
    private final CountdownCounter countdownCounter;
    private final TdstLevelTracker tdstLevelTracker;
    private final HigherLowTracker higherLowTracker;
    private final Ma2CrossoverFilter crossoverFilter;

    /** Bars each component needs before its output is meaningful. */
    private final Map<TdComponent, Integer> requiredBars = new EnumMap<>(TdComponent.class);

    private final List<IndicatorState> states = new ArrayList<>();
    private EngineState current;

    public IndicatorEngine(String symbol, TdIndicatorProperties properties) {
        properties.validate();
        this.history = new BarHistory(symbol, properties.getBarDuration());
        this.tdMa1 = MovingAverageTrigger.tdMa1(properties.getMovingAverage());
        this.tdMa2 = MovingAverageTrigger.tdMa2(properties.getMovingAverage());
        this.setupCounter = new SequentialSetupCounter(properties.getSetup().getFollowThroughPolicy());
        this.countdownCounter = new CountdownCounter(properties.getCountdown());
        this.tdstLevelTracker = new TdstLevelTracker();
        this.higherLowTracker = new HigherLowTracker();
        this.crossoverFilter = new Ma2CrossoverFilter(properties.getCrossover());

        List<TdCalculator<?>> calculators =
                List.of(tdMa1, tdMa2, setupCounter, countdownCounter, tdstLevelTracker, higherLowTracker, crossoverFilter);
        for (TdCalculator<?> calculator : calculators) {
            requiredBars.put(calculator.component(), calculator.minRequiredBars());
        }
        requiredBars.put(TdComponent.TDST_RESISTANCE, tdstLevelTracker.minRequiredBars());

        this.current = initialState();
    }

    public IndicatorEngine(String symbol) {
        this(symbol, new TdIndicatorProperties());
    }

    /**
     * Convenience for backtests: runs a fresh engine over {@code bars}.
     *
     * @return one state per bar, in bar order
     */
    public static List<IndicatorState> compute(String symbol, List<Bar> bars, TdIndicatorProperties properties) {
        IndicatorEngine engine = new IndicatorEngine(symbol, properties);
        return engine.computeAll(bars);
    }

    /**
     * Appends a bar and computes its state.
     *
     * @param bar the next bar in sequence
     * @return the state of the appended bar
     */
    public IndicatorState onBar(Bar bar) {
        int index = history.append(bar);
        current = step(current, history, index);
        IndicatorState state = project(current, index);
        states.add(state);
        return state;
    }

    /**
     * Appends every bar in order.
     *
     * @return the states of the appended bars only, in bar order
     */
    public List<IndicatorState> computeAll(List<Bar> bars) {
        List<IndicatorState> computed = new ArrayList<>(bars.size());
        for (Bar bar : bars) {
            computed.add(onBar(bar));
        }
        log.debug("Computed {} TD states for {} ({} bars total)", computed.size(), history.getSymbol(), barCount());
        return Collections.unmodifiableList(computed);
    }

    /** Latest snapshot, empty before the first bar. */
    public Optional<IndicatorState> latest() {
        return states.isEmpty() ? Optional.empty() : Optional.of(states.get(states.size() - 1));
    }

    /** Read-only view of every state computed so far, oldest first. */
    public List<IndicatorState> states() {
        return Collections.unmodifiableList(states);
    }

    public int barCount() {
        return history.size();
    }

    public int requiredBars(TdComponent component) {
        return requiredBars.get(component);
    }

    /**
     * Asserts that {@code component} has enough history.
     *
     * @throws InsufficientHistoryException if fewer bars than the component's lookback are present
     */
    public void requireWarmedUp(TdComponent component) {
        int required = requiredBars(component);
        if (barCount() < required) {
            throw new InsufficientHistoryException(component, required, barCount());
        }
    }

    /** State before the first bar. */
    public EngineState initialState() {
        return new EngineState(
                tdMa1.initialState(),
                tdMa2.initialState(),
                setupCounter.initialState(),
                countdownCounter.initialState(),
                tdstLevelTracker.initialState(),
                higherLowTracker.initialState(),
                crossoverFilter.initialState());
    }

    /**
     * Derives the state of bar {@code index} from the previous bar's state.
     * Pure: reads bars {@code 0..index} of {@code bars} and nothing else.
     */
    public EngineState step(EngineState previous, BarHistory bars, int index) {
        MovingAverageTrigger.State ma1 = tdMa1.step(previous.ma1(), bars, index);
        MovingAverageTrigger.State ma2 = tdMa2.step(previous.ma2(), bars, index);
        SequentialSetupCounter.State setup = setupCounter.step(previous.setup(), bars, index);
        CountdownCounter.State countdown = countdownCounter.step(previous.countdown(), bars, index, setup);
        TdstLevelTracker.State tdst = tdstLevelTracker.step(previous.tdst(), bars, index, setup);
        HigherLowTracker.State higherLow = higherLowTracker.step(previous.higherLow(), bars, index);
        Ma2CrossoverFilter.State crossover = crossoverFilter.step(bars, index);
        return new EngineState(ma1, ma2, setup, countdown, tdst, higherLow, crossover);
    }

    private IndicatorState project(EngineState state, int index) {
        int barCount = index + 1;
        Set<TdComponent> warmingUp = EnumSet.noneOf(TdComponent.class);
        for (Map.Entry<TdComponent, Integer> entry : requiredBars.entrySet()) {
            if (barCount < entry.getValue()) {
                warmingUp.add(entry.getKey());
            }
        }

        SequentialSetupCounter.State setup = state.setup();
        TdstLevelTracker.State tdst = state.tdst();
        Ma2CrossoverFilter.State crossover = state.crossover();

        return IndicatorState.builder()
                .barIndex(index)
                .ma1Active(state.ma1().active())
                .ma1Value(state.ma1().value())
                .ma2Active(state.ma2().active())
                .ma2Value(state.ma2().value())
                .setupCount(setup.count())
                .setupComplete(setup.isComplete())
                .setupBar9Close(setup.bar9Close())
                .setupBar9RangePct(setup.bar9RangePct())
                .setupLowestLow(setup.lowestLow())
                .barsSinceSetup9(setup.followThrough().barsSince())
                .highestCloseSinceSetup9(setup.followThrough().bestClose())
                .tdstSupport(tdst.reportedSupport())
                .tdstActive(tdst.supportActive())
                .tdstResistance(tdst.reportedResistance())
                .tdstResActive(tdst.resistanceActive())
                .tdstResBroken(tdst.resistanceBroken())
                .countdown(state.countdown().countdown())
                .countdownComplete(state.countdown().countdown() >= countdownCounter.getTarget())
                .recentHigherLow(state.higherLow().recentHigherLow())
                .ma2Fast(crossover.fast())
                .ma2Slow(crossover.slow())
                .ma2FastRising(crossover.fastRising())
                .ma2SlowRising(crossover.slowRising())
                .ma2CrossoverEntryValid(crossover.entryValid())
                .warmingUp(Collections.unmodifiableSet(warmingUp))
                .build();
    }

    /** Fold state: one immutable state per calculator. */
    public record EngineState(
            MovingAverageTrigger.State ma1,
            MovingAverageTrigger.State ma2,
            SequentialSetupCounter.State setup,
            CountdownCounter.State countdown,
            TdstLevelTracker.State tdst,
            HigherLowTracker.State higherLow,
            Ma2CrossoverFilter.State crossover) {}
}
