package com.tdengine.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ExitReason {
    CLOSE_BELOW_TD_MA1(Tranche.FIRST),
    FAILED_FOLLOW_THROUGH(Tranche.FIRST),
    TDST_SUPPORT_BREACH(Tranche.SECOND),
    SETUP_VALIDITY_BREACH(Tranche.SECOND),
    COUNTDOWN_EXHAUSTION(Tranche.THIRD),
    HIGHER_LOW_BREAK(Tranche.THIRD),
    TIME_STOP(Tranche.THIRD),
    MA2_CROSSOVER(Tranche.THIRD);

    /** The tranche whose rule set can produce this reason. */
    private final Tranche tranche;
}
