package com.tdengine.exit;

import com.tdengine.domain.enums.ExitReason;
import com.tdengine.domain.enums.Tranche;
import com.tdengine.domain.model.IndicatorState;
import com.tdengine.domain.model.PositionContext;
import com.tdengine.indicator.TdIndicatorProperties;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Three independent partial-exit gates evaluated against the latest indicator snapshot.
 *
 * <p>Within a tranche, rules are checked in a fixed order and the first one that holds
 * names the reason. Tranches never look at each other, so a bar may trigger any subset of
 * them. Stateless: position facts come from the caller on every call.
 */
@Component
public class ExitRuleEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ExitRuleEvaluator.class);

    private final TdIndicatorProperties.Exit exitSettings;
    private final int countdownTarget;

    public ExitRuleEvaluator(TdIndicatorProperties properties) {
        properties.validate();
        this.exitSettings = properties.getExit();
        this.countdownTarget = properties.getCountdown().getTarget();
    }

    /**
     * Tranche 1 (30%): close under the TD MA I value, or no follow-through after Setup 9.
     */
    public ExitDecision checkTranche1(double close, IndicatorState state) {
        if (state.isMa1Active() && close < state.getMa1Value()) {
            return ExitDecision.triggered(ExitReason.CLOSE_BELOW_TD_MA1);
        }
        if (state.isSetupComplete()
                && state.getBarsSinceSetup9() >= exitSettings.getFollowThroughBars()
                && state.getHighestCloseSinceSetup9() <= state.getSetupBar9Close()
                && (state.getSetupBar9RangePct() < exitSettings.getWeakCloseRangePct()
                        || close < state.getSetupBar9Close())) {
            return ExitDecision.triggered(ExitReason.FAILED_FOLLOW_THROUGH);
        }
        return ExitDecision.notTriggered(Tranche.FIRST);
    }

    /**
     * Tranche 2 (45%): close under active TDST support, or under the Setup validity low.
     *
     * @param setupLowestLow validity level; values at or below zero mean "none"
     */
    public ExitDecision checkTranche2(double close, IndicatorState state, double setupLowestLow) {
        if (state.isTdstActive() && close < state.getTdstSupport()) {
            return ExitDecision.triggered(ExitReason.TDST_SUPPORT_BREACH);
        }
        if (setupLowestLow > 0 && close < setupLowestLow) {
            return ExitDecision.triggered(ExitReason.SETUP_VALIDITY_BREACH);
        }
        return ExitDecision.notTriggered(Tranche.SECOND);
    }

    /**
     * Tranche 3 (25%): countdown exhaustion, a broken higher low, a time stop, and optionally
     * the MA2 fast line crossing under the slow line.
     */
    public ExitDecision checkTranche3(double close, IndicatorState state, double entryPrice, int daysHeld) {
        if (state.getCountdown() >= countdownTarget && state.isMa2Active() && close < state.getMa2Value()) {
            return ExitDecision.triggered(ExitReason.COUNTDOWN_EXHAUSTION);
        }
        if (state.getRecentHigherLow() > 0 && close < state.getRecentHigherLow()) {
            return ExitDecision.triggered(ExitReason.HIGHER_LOW_BREAK);
        }
        if (daysHeld >= timeStopLimit(state) && close <= entryPrice && !state.isSetupComplete()) {
            return ExitDecision.triggered(ExitReason.TIME_STOP);
        }
        if (exitSettings.isCrossoverExitEnabled() && state.isMa2FastBelowSlow()) {
            return ExitDecision.triggered(ExitReason.MA2_CROSSOVER);
        }
        return ExitDecision.notTriggered(Tranche.THIRD);
    }

    /**
     * Evaluates all three tranches for an open position.
     *
     * @return decisions for FIRST, SECOND and THIRD, in that order
     */
    public List<ExitDecision> evaluateAll(double close, IndicatorState state, PositionContext position) {
        double validityLow =
                position.getSetupLowestLow() != null ? position.getSetupLowestLow() : state.getSetupLowestLow();

        List<ExitDecision> decisions = List.of(
                checkTranche1(close, state),
                checkTranche2(close, state, validityLow),
                checkTranche3(close, state, position.getEntryPrice(), position.getDaysHeld()));

        if (log.isDebugEnabled()) {
            decisions.stream()
                    .filter(ExitDecision::isTriggered)
                    .forEach(d -> log.debug(
                            "Tranche {} exit on bar {} (close={}, reason={})",
                            d.getTranche(),
                            state.getBarIndex(),
                            close,
                            d.getReason()));
        }
        return decisions;
    }

    /** Holding period after which an unprofitable runner is cut. */
    int timeStopLimit(IndicatorState state) {
        int base = exitSettings.getTimeStopDays();
        if (state.isSetupComplete()) {
            return Math.max(base, state.getBarsSinceSetup9() + exitSettings.getPostSetupBars());
        }
        return base;
    }
}
