package com.tdengine.unit.indicator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.tdengine.domain.enums.TdComponent;
import com.tdengine.domain.enums.UndefinedAveragePolicy;
import com.tdengine.domain.model.Bar;
import com.tdengine.indicator.BarHistory;
import com.tdengine.indicator.MovingAverageTrigger;
import com.tdengine.indicator.TdIndicatorProperties;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for the TD MA I / TD MA II triggers: breakout detection, active window length,
 * re-trigger extension, and the undefined-average policies.
 */
class MovingAverageTriggerTest {

    private static final Bar FLAT = Bar.of(100, 101, 99, 100);

    private TdIndicatorProperties.MovingAverage settings;

    @BeforeEach
    void setUp() {
        settings = new TdIndicatorProperties.MovingAverage();
    }

    @Nested
    @DisplayName("TD MA I")
    class TdMa1 {

        @Test
        @DisplayName("reports its component and lookback requirement")
        void componentAndWarmUp() {
            MovingAverageTrigger trigger = MovingAverageTrigger.tdMa1(settings);

            assertThat(trigger.component()).isEqualTo(TdComponent.TD_MA1);
            assertThat(trigger.minRequiredBars()).isEqualTo(13);
            assertThat(trigger.isWarmedUp(12)).isFalse();
            assertThat(trigger.isWarmedUp(13)).isTrue();
        }

        @Test
        @DisplayName("low above the prior 12-bar lowest low opens a 4-bar window valued at SMA(low, 5)")
        void triggerOpensWindow() {
            List<Bar> bars = flatBars(12);
            bars.add(Bar.of(100, 102, 99.5, 101));
            bars.addAll(flatBars(4));

            List<MovingAverageTrigger.State> states = run(MovingAverageTrigger.tdMa1(settings), bars);

            for (int i = 0; i < 12; i++) {
                assertThat(states.get(i).active()).as("bar %d", i).isFalse();
            }
            for (int i = 12; i <= 15; i++) {
                assertThat(states.get(i).active()).as("bar %d", i).isTrue();
                assertThat(states.get(i).value()).isCloseTo(99.1, within(1e-9));
            }
            assertThat(states.get(12).barsRemaining()).isEqualTo(3);
            assertThat(states.get(15).barsRemaining()).isZero();
            assertThat(states.get(16).active()).isFalse();
            assertThat(states.get(16).value()).isZero();
        }

        @Test
        @DisplayName("low equal to the lowest low does not trigger")
        void equalLowDoesNotTrigger() {
            List<MovingAverageTrigger.State> states = run(MovingAverageTrigger.tdMa1(settings), flatBars(20));

            assertThat(states).noneMatch(MovingAverageTrigger.State::active);
        }

        @Test
        @DisplayName("re-trigger inside an open window restarts it instead of stacking")
        void retriggerExtendsWindow() {
            List<Bar> bars = flatBars(12);
            bars.add(Bar.of(100, 102, 99.5, 101));
            bars.add(FLAT);
            bars.add(Bar.of(100, 102, 99.8, 101));
            bars.addAll(flatBars(4));

            List<MovingAverageTrigger.State> states = run(MovingAverageTrigger.tdMa1(settings), bars);

            assertThat(states.get(14).barsRemaining()).isEqualTo(3);
            assertThat(states.get(14).value()).isCloseTo((99 * 2 + 99.5 + 99 + 99.8) / 5, within(1e-9));
            for (int i = 12; i <= 17; i++) {
                assertThat(states.get(i).active()).as("bar %d", i).isTrue();
            }
            assertThat(states.get(18).active()).isFalse();
        }
    }

    @Nested
    @DisplayName("TD MA II")
    class TdMa2 {

        @Test
        @DisplayName("close above the prior 12-bar highest close triggers, valued at SMA(close, 5)")
        void closeBreakoutTriggers() {
            List<Bar> bars = flatBars(12);
            bars.add(Bar.of(100, 106, 99, 105));

            MovingAverageTrigger trigger = MovingAverageTrigger.tdMa2(settings);
            List<MovingAverageTrigger.State> states = run(trigger, bars);

            assertThat(trigger.component()).isEqualTo(TdComponent.TD_MA2);
            assertThat(states.get(11).active()).isFalse();
            assertThat(states.get(12).active()).isTrue();
            assertThat(states.get(12).value()).isCloseTo(101.0, within(1e-9));
        }

        @Test
        @DisplayName("close equal to the highest close does not trigger")
        void equalCloseDoesNotTrigger() {
            List<Bar> bars = flatBars(12);
            bars.add(Bar.of(100, 106, 99, 100));

            assertThat(run(MovingAverageTrigger.tdMa2(settings), bars)).noneMatch(MovingAverageTrigger.State::active);
        }
    }

    @Nested
    @DisplayName("Undefined average")
    class UndefinedAverage {

        @BeforeEach
        void shortLookback() {
            // lookback 2 lets the trigger fire on bar 2, before SMA(5) exists
            settings.setLookbackPeriod(2);
        }

        @Test
        @DisplayName("LENIENT_ZERO keeps the window active with a 0.0 value")
        void lenientZero() {
            settings.setUndefinedAveragePolicy(UndefinedAveragePolicy.LENIENT_ZERO);

            List<MovingAverageTrigger.State> states =
                    run(MovingAverageTrigger.tdMa1(settings), BarFixtures.fromLows(99, 99, 100));

            assertThat(states.get(2).active()).isTrue();
            assertThat(states.get(2).value()).isZero();
        }

        @Test
        @DisplayName("STRICT ignores the trigger")
        void strictIgnoresTrigger() {
            settings.setUndefinedAveragePolicy(UndefinedAveragePolicy.STRICT);

            List<MovingAverageTrigger.State> states =
                    run(MovingAverageTrigger.tdMa1(settings), BarFixtures.fromLows(99, 99, 100));

            assertThat(states.get(2).active()).isFalse();
        }

        @Test
        @DisplayName("STRICT still triggers once the average is defined")
        void strictTriggersOnceDefined() {
            settings.setUndefinedAveragePolicy(UndefinedAveragePolicy.STRICT);

            List<MovingAverageTrigger.State> states =
                    run(MovingAverageTrigger.tdMa1(settings), BarFixtures.fromLows(99, 99, 99, 99, 100));

            assertThat(states.get(4).active()).isTrue();
            assertThat(states.get(4).value()).isCloseTo(99.2, within(1e-9));
        }
    }

    private static List<Bar> flatBars(int count) {
        return new ArrayList<>(Collections.nCopies(count, FLAT));
    }

    private static List<MovingAverageTrigger.State> run(MovingAverageTrigger trigger, List<Bar> bars) {
        BarHistory history = BarFixtures.history(bars);
        List<MovingAverageTrigger.State> states = new ArrayList<>();
        MovingAverageTrigger.State state = trigger.initialState();
        for (int i = 0; i < history.size(); i++) {
            state = trigger.step(state, history, i);
            states.add(state);
        }
        return states;
    }
}
