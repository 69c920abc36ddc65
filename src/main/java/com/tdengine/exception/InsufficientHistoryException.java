package com.tdengine.exception;

import com.tdengine.domain.enums.TdComponent;
import java.util.Map;
import lombok.Getter;

/**
 * Raised when a caller asks for a component's output before the bar history
 * covers that component's lookback.
 *
 * <p>The engine itself never throws this while folding bars; warm-up is reported
 * in-band on every {@code IndicatorState}. Callers that prefer a hard failure use
 * {@code IndicatorEngine.requireWarmedUp} or enable
 * {@code td-indicators.fail-on-insufficient-history}.
 */
@Getter
public class InsufficientHistoryException extends BaseException {

    private final TdComponent component;
    private final int requiredBars;
    private final int availableBars;

    public InsufficientHistoryException(TdComponent component, int requiredBars, int availableBars) {
        super(
                ErrorCode.INSUFFICIENT_HISTORY,
                component + " needs " + requiredBars + " bars but only " + availableBars + " are available",
                Map.of("component", component.name(), "requiredBars", requiredBars, "availableBars", availableBars));
        this.component = component;
        this.requiredBars = requiredBars;
        this.availableBars = availableBars;
    }
}
