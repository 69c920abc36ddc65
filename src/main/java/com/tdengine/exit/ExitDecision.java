package com.tdengine.exit;

import com.tdengine.domain.enums.ExitReason;
import com.tdengine.domain.enums.Tranche;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of one tranche's exit rules.
 *
 * <p>Either HOLD (not triggered, no reason) or EXIT with the first rule that fired. The
 * fraction is the tranche's fixed share of the position and is reported either way.
 */
@Getter
@ToString
@EqualsAndHashCode
public class ExitDecision {

    private final Tranche tranche;
    private final boolean triggered;
    private final ExitReason reason;

    private ExitDecision(Tranche tranche, boolean triggered, ExitReason reason) {
        this.tranche = tranche;
        this.triggered = triggered;
        this.reason = reason;
    }

    public static ExitDecision notTriggered(Tranche tranche) {
        return new ExitDecision(tranche, false, null);
    }

    public static ExitDecision triggered(ExitReason reason) {
        return new ExitDecision(reason.getTranche(), true, reason);
    }

    public double getFraction() {
        return tranche.getFraction();
    }
}
