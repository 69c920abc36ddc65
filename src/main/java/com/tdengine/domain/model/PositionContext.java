package com.tdengine.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Caller-owned facts about an open position, supplied alongside the latest
 * indicator snapshot when evaluating tranche exits.
 */
@Value
@Builder
public class PositionContext {

    double entryPrice;

    /** Trading days (bars) the position has been held. */
    int daysHeld;

    /**
     * Setup validity level captured when the position was opened. Null means
     * "use the snapshot's current setupLowestLow".
     */
    Double setupLowestLow;

    public static PositionContext of(double entryPrice, int daysHeld) {
        return PositionContext.builder().entryPrice(entryPrice).daysHeld(daysHeld).build();
    }
}
