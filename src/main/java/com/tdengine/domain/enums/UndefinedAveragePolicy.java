package com.tdengine.domain.enums;

/**
 * How a TD MA trigger behaves when it fires before its simple moving average has
 * enough bars to be defined.
 *
 * <p>LENIENT_ZERO opens the active window anyway and reports a value of 0.0, which
 * matches historical outputs. STRICT ignores the trigger until the average is defined.
 */
public enum UndefinedAveragePolicy {
    LENIENT_ZERO,
    STRICT
}
