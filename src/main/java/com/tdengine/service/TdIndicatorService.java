package com.tdengine.service;

import com.tdengine.domain.enums.TdComponent;
import com.tdengine.domain.model.Bar;
import com.tdengine.domain.model.IndicatorState;
import com.tdengine.domain.model.PositionContext;
import com.tdengine.event.ExitSignalEvent;
import com.tdengine.exit.ExitDecision;
import com.tdengine.exit.ExitRuleEvaluator;
import com.tdengine.indicator.IndicatorEngine;
import com.tdengine.indicator.TdIndicatorProperties;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Entry point for computing DeMark indicators and tranche exits for one instrument.
 *
 * <p>Every call loads the instrument's bars from the supplied {@link BarSource} and folds
 * them through a fresh {@link IndicatorEngine}; nothing is cached between calls, so
 * instruments can be processed from any number of threads.
 *
 * <p>Warm-up is reported on the returned states. With
 * {@code td-indicators.fail-on-insufficient-history=true} the service instead throws
 * {@code InsufficientHistoryException} when any component lacks history on the last bar. The
 * MA2 crossover filter counts only while {@code td-indicators.exit.crossover-exit-enabled} is set.
 */
@Service
@EnableConfigurationProperties(TdIndicatorProperties.class)
public class TdIndicatorService {

    private static final Logger log = LoggerFactory.getLogger(TdIndicatorService.class);

    private final TdIndicatorProperties tdIndicatorProperties;
    private final ExitRuleEvaluator exitRuleEvaluator;
    private final ApplicationEventPublisher applicationEventPublisher;

    public TdIndicatorService(
            TdIndicatorProperties tdIndicatorProperties,
            ExitRuleEvaluator exitRuleEvaluator,
            ApplicationEventPublisher applicationEventPublisher) {
        this.tdIndicatorProperties = tdIndicatorProperties;
        this.exitRuleEvaluator = exitRuleEvaluator;
        this.applicationEventPublisher = applicationEventPublisher;
    }

    /**
     * Computes the full per-bar state series, for backtests and diagnostics.
     *
     * @return one state per bar, empty if the source has no bars
     */
    public List<IndicatorState> computeSeries(String symbol, BarSource barSource) {
        IndicatorEngine engine = run(symbol, barSource);
        return engine.states();
    }

    /** Latest snapshot for live use, empty if the source has no bars. */
    public Optional<IndicatorState> latestSnapshot(String symbol, BarSource barSource) {
        return run(symbol, barSource).latest();
    }

    /**
     * Evaluates the three tranches on the latest bar and publishes an {@link ExitSignalEvent}
     * for each one that triggers.
     *
     * @return the three decisions in tranche order, empty if the source has no bars
     */
    public List<ExitDecision> evaluateExits(String symbol, BarSource barSource, PositionContext position) {
        List<Bar> bars = barSource.loadBars(symbol);
        IndicatorEngine engine = run(symbol, bars);
        Optional<IndicatorState> latest = engine.latest();
        if (latest.isEmpty()) {
            return List.of();
        }

        IndicatorState state = latest.get();
        double close = bars.get(bars.size() - 1).close();
        List<ExitDecision> decisions = exitRuleEvaluator.evaluateAll(close, state, position);

        for (ExitDecision decision : decisions) {
            if (decision.isTriggered()) {
                log.info(
                        "Exit signal for {}: tranche {} ({}%) on bar {}, reason {}",
                        symbol,
                        decision.getTranche(),
                        Math.round(decision.getFraction() * 100),
                        state.getBarIndex(),
                        decision.getReason());
                applicationEventPublisher.publishEvent(
                        new ExitSignalEvent(this, symbol, state.getBarIndex(), close, decision));
            }
        }
        return decisions;
    }

    private IndicatorEngine run(String symbol, BarSource barSource) {
        return run(symbol, barSource.loadBars(symbol));
    }

    private IndicatorEngine run(String symbol, List<Bar> bars) {
        IndicatorEngine engine = new IndicatorEngine(symbol, tdIndicatorProperties);
        if (bars == null || bars.isEmpty()) {
            log.warn("No bars supplied for {}, nothing to compute", symbol);
            if (tdIndicatorProperties.isFailOnInsufficientHistory()) {
                engine.requireWarmedUp(TdComponent.TD_MA1);
            }
            return engine;
        }

        engine.computeAll(bars);
        IndicatorState latest = engine.latest().orElseThrow();
        log.info(
                "Computed TD indicators for {} over {} bars (setup={}, countdown={}, warming up={})",
                symbol,
                engine.barCount(),
                latest.getSetupCount(),
                latest.getCountdown(),
                latest.getWarmingUp());

        if (tdIndicatorProperties.isFailOnInsufficientHistory()) {
            for (TdComponent component : latest.getWarmingUp()) {
                if (isEscalated(component)) {
                    engine.requireWarmedUp(component);
                }
            }
        }
        return engine;
    }

    /** The crossover filter only gates a decision when its exit is enabled. */
    private boolean isEscalated(TdComponent component) {
        return component != TdComponent.MA2_CROSSOVER
                || tdIndicatorProperties.getExit().isCrossoverExitEnabled();
    }
}
