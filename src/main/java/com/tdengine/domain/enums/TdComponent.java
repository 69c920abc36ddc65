package com.tdengine.domain.enums;

/**
 * The calculators folded by the IndicatorEngine. Used to report which outputs
 * are still warming up on a given bar.
 */
public enum TdComponent {
    TD_MA1,
    TD_MA2,
    SETUP,
    COUNTDOWN,
    TDST_SUPPORT,
    TDST_RESISTANCE,
    HIGHER_LOW,
    MA2_CROSSOVER
}
