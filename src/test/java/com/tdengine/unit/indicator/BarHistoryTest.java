package com.tdengine.unit.indicator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.tdengine.domain.enums.PriceField;
import com.tdengine.domain.model.Bar;
import com.tdengine.exception.ErrorCode;
import com.tdengine.exception.InvalidBarException;
import com.tdengine.indicator.BarHistory;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for BarHistory: appending, validation, and windowed lookups.
 */
class BarHistoryTest {

    private BarHistory barHistory;

    @BeforeEach
    void setUp() {
        barHistory = new BarHistory(BarFixtures.SYMBOL, Duration.ofDays(1));
    }

    @Nested
    @DisplayName("Appending")
    class Appending {

        @Test
        @DisplayName("starts empty")
        void startsEmpty() {
            assertThat(barHistory.isEmpty()).isTrue();
            assertThat(barHistory.size()).isZero();
            assertThat(barHistory.getSymbol()).isEqualTo(BarFixtures.SYMBOL);
        }

        @Test
        @DisplayName("assigns consecutive indices")
        void assignsConsecutiveIndices() {
            assertThat(barHistory.append(Bar.of(100, 101, 99, 100))).isZero();
            assertThat(barHistory.append(Bar.of(100, 102, 98, 101))).isEqualTo(1);
            assertThat(barHistory.append(Bar.of(101, 103, 100, 102))).isEqualTo(2);

            assertThat(barHistory.size()).isEqualTo(3);
            assertThat(barHistory.close(1)).isEqualTo(101.0);
            assertThat(barHistory.high(2)).isEqualTo(103.0);
            assertThat(barHistory.low(1)).isEqualTo(98.0);
            assertThat(barHistory.open(2)).isEqualTo(101.0);
        }

        @Test
        @DisplayName("synthetic end times increase by the bar duration")
        void syntheticEndTimesIncrease() {
            barHistory.append(Bar.of(100, 101, 99, 100));
            barHistory.append(Bar.of(100, 101, 99, 100));

            assertThat(barHistory.getBarSeries().getBar(1).getEndTime())
                    .isEqualTo(barHistory.getBarSeries().getBar(0).getEndTime().plusDays(1));
        }

        @Test
        @DisplayName("rejects a bar whose high is below its low")
        void rejectsInvertedRange() {
            assertThatThrownBy(() -> barHistory.append(Bar.of(100, 98, 99, 100)))
                    .isInstanceOf(InvalidBarException.class)
                    .hasMessageContaining("high is below its low")
                    .extracting("errorCode")
                    .isEqualTo(ErrorCode.INVALID_BAR);
            assertThat(barHistory.isEmpty()).isTrue();
        }

        @Test
        @DisplayName("rejects non-finite prices")
        void rejectsNonFinitePrices() {
            assertThatThrownBy(() -> barHistory.append(Bar.of(100, 101, 99, Double.NaN)))
                    .isInstanceOf(InvalidBarException.class);
            assertThatThrownBy(() -> barHistory.append(Bar.of(100, Double.POSITIVE_INFINITY, 99, 100)))
                    .isInstanceOf(InvalidBarException.class);
        }

        @Test
        @DisplayName("rejects a close above the high")
        void rejectsCloseAboveHigh() {
            assertThatThrownBy(() -> barHistory.append(Bar.of(110, 112, 110, 113)))
                    .isInstanceOfSatisfying(InvalidBarException.class, ex -> {
                        assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.INVALID_BAR);
                        assertThat(ex.getDetails()).containsEntry("close", 113.0).containsEntry("high", 112.0);
                    })
                    .hasMessageContaining("outside its high-low range");
            assertThat(barHistory.isEmpty()).isTrue();
        }

        @Test
        @DisplayName("rejects a close below the low")
        void rejectsCloseBelowLow() {
            assertThatThrownBy(() -> barHistory.append(Bar.of(100, 101, 99, 98.5)))
                    .isInstanceOfSatisfying(InvalidBarException.class, ex ->
                            assertThat(ex.getDetails()).containsEntry("close", 98.5).containsEntry("low", 99.0));
        }

        @Test
        @DisplayName("rejects an open outside the range")
        void rejectsOpenOutsideRange() {
            assertThatThrownBy(() -> barHistory.append(Bar.of(102, 101, 99, 100)))
                    .isInstanceOf(InvalidBarException.class);
        }

        @Test
        @DisplayName("accepts open and close on the range bounds")
        void acceptsPricesOnBounds() {
            barHistory.append(Bar.of(99, 101, 99, 101));

            assertThat(barHistory.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("accepts a single-price bar")
        void acceptsDegenerateBar() {
            barHistory.append(Bar.of(100, 100, 100, 100));

            assertThat(barHistory.size()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Windows")
    class Windows {

        @BeforeEach
        void fill() {
            // closes 5, 4, 3, 6, 7 -> lows 4, 3, 2, 5, 6 and highs 6, 5, 4, 7, 8
            BarFixtures.fromCloses(5, 4, 3, 6, 7).forEach(barHistory::append);
        }

        @Test
        @DisplayName("SMA is defined once the period is covered")
        void smaDefinedOncePeriodCovered() {
            assertThat(barHistory.sma(PriceField.CLOSE, 5, 4).getAsDouble()).isCloseTo(5.0, within(1e-9));
            assertThat(barHistory.sma(PriceField.CLOSE, 2, 1).getAsDouble()).isCloseTo(4.5, within(1e-9));
        }

        @Test
        @DisplayName("SMA is empty before the period is covered")
        void smaEmptyBeforePeriodCovered() {
            assertThat(barHistory.sma(PriceField.CLOSE, 5, 3)).isEmpty();
            assertThat(barHistory.sma(PriceField.LOW, 3, 1)).isEmpty();
        }

        @Test
        @DisplayName("lowest and highest cover exactly the requested window")
        void lowestAndHighest() {
            assertThat(barHistory.lowest(PriceField.LOW, 3, 4)).isEqualTo(2.0);
            assertThat(barHistory.lowest(PriceField.LOW, 2, 4)).isEqualTo(5.0);
            assertThat(barHistory.highest(PriceField.HIGH, 3, 4)).isEqualTo(8.0);
            assertThat(barHistory.highest(PriceField.HIGH, 3, 2)).isEqualTo(6.0);
        }

        @Test
        @DisplayName("windows reaching before the first bar are rejected")
        void rejectsWindowOutsideHistory() {
            assertThatThrownBy(() -> barHistory.lowest(PriceField.LOW, 4, 2))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> barHistory.highest(PriceField.HIGH, 2, 5))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
