package com.tdengine.event;

import com.tdengine.exit.ExitDecision;
import java.time.LocalDateTime;
import org.springframework.context.ApplicationEvent;

/**
 * Published when a tranche's exit rules fire on the latest bar of an instrument.
 *
 * <p>One event per triggered tranche. Order execution and notification are left to
 * listeners; the engine never acts on a signal itself.
 */
public class ExitSignalEvent extends ApplicationEvent {

    private final String symbol;
    private final int barIndex;
    private final double close;
    private final ExitDecision decision;
    private final LocalDateTime signalTime;

    public ExitSignalEvent(Object source, String symbol, int barIndex, double close, ExitDecision decision) {
        super(source);
        this.symbol = symbol;
        this.barIndex = barIndex;
        this.close = close;
        this.decision = decision;
        this.signalTime = LocalDateTime.now();
    }

    public String getSymbol() {
        return symbol;
    }

    public int getBarIndex() {
        return barIndex;
    }

    public double getClose() {
        return close;
    }

    public ExitDecision getDecision() {
        return decision;
    }

    public LocalDateTime getSignalTime() {
        return signalTime;
    }
}
