package com.tdengine.indicator;

import com.tdengine.domain.enums.TdComponent;

/**
 * A single DeMark calculator folded left to right over a {@link BarHistory}.
 *
 * <p>Each implementation exposes a pure {@code step(previous, history, index, ...)} that
 * derives the state of bar {@code index} from the previous bar's state and bars
 * {@code 0..index}. Step signatures differ because some calculators also read the
 * Setup state of the same bar.
 *
 * @param <S> the immutable per-bar state type
 */
public interface TdCalculator<S> {

    TdComponent component();

    /** Bars needed before the calculator's output is meaningful. */
    int minRequiredBars();

    /** State before the first bar. */
    S initialState();

    default boolean isWarmedUp(int barCount) {
        return barCount >= minRequiredBars();
    }
}
