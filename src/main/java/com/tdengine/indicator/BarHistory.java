package com.tdengine.indicator;

import com.tdengine.domain.enums.PriceField;
import com.tdengine.domain.model.Bar;
import com.tdengine.exception.InvalidBarException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.OptionalDouble;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.ta4j.core.BarSeries;
import org.ta4j.core.BaseBarSeriesBuilder;
import org.ta4j.core.Indicator;
import org.ta4j.core.indicators.SMAIndicator;
import org.ta4j.core.indicators.helpers.ClosePriceIndicator;
import org.ta4j.core.indicators.helpers.HighPriceIndicator;
import org.ta4j.core.indicators.helpers.HighestValueIndicator;
import org.ta4j.core.indicators.helpers.LowPriceIndicator;
import org.ta4j.core.indicators.helpers.LowestValueIndicator;
import org.ta4j.core.indicators.helpers.OpenPriceIndicator;
import org.ta4j.core.num.DoubleNum;
import org.ta4j.core.num.Num;

/**
 * Append-only bar history for one instrument, backed by a ta4j BarSeries.
 *
 * <p>Bars carry no timestamps, so each appended bar gets a synthetic end time of
 * {@code EPOCH + (index + 1) * barDuration}; ta4j only requires end times to be strictly
 * increasing. The series never evicts bars, so indices stay stable for the lifetime of
 * the history.
 *
 * <p>Windowed lookups (SMA, lowest, highest) reuse one ta4j indicator per
 * {@code FIELD:period} key, the same keying scheme used for cached indicator values.
 *
 * <p>Not thread-safe. A history belongs to exactly one engine and one instrument.
 */
public class BarHistory {

    private static final Logger log = LoggerFactory.getLogger(BarHistory.class);

    private static final ZonedDateTime ORIGIN = ZonedDateTime.ofInstant(Instant.EPOCH, ZoneOffset.UTC);

    @Getter
    private final String symbol;

    @Getter
    private final Duration barDuration;

    private final BarSeries barSeries;
    private final Map<PriceField, Indicator<Num>> prices = new HashMap<>();
    private final Map<String, Indicator<Num>> windows = new HashMap<>();

    public BarHistory(String symbol, Duration barDuration) {
        this.symbol = symbol;
        this.barDuration = barDuration;
        this.barSeries = new BaseBarSeriesBuilder()
                .withName(symbol)
                .withNumTypeOf(DoubleNum.class)
                .build();
    }

    /**
     * Validates and appends a bar.
     *
     * @param bar the next bar in sequence
     * @return the index assigned to the bar
     * @throws InvalidBarException if a price is not finite, high is below low, or open or close
     *     lies outside [low, high]
     */
    public int append(Bar bar) {
        validate(bar);
        int index = size();
        ZonedDateTime endTime = ORIGIN.plus(barDuration.multipliedBy(index + 1L));
        barSeries.addBar(endTime, bar.open(), bar.high(), bar.low(), bar.close(), 0);
        log.trace(
                "Bar {} appended for {} [O={} H={} L={} C={}]",
                index,
                symbol,
                bar.open(),
                bar.high(),
                bar.low(),
                bar.close());
        return index;
    }

    public int size() {
        return barSeries.getBarCount();
    }

    public boolean isEmpty() {
        return barSeries.isEmpty();
    }

    public BarSeries getBarSeries() {
        return barSeries;
    }

    public double price(PriceField field, int index) {
        return priceIndicator(field).getValue(index).doubleValue();
    }

    public double open(int index) {
        return price(PriceField.OPEN, index);
    }

    public double high(int index) {
        return price(PriceField.HIGH, index);
    }

    public double low(int index) {
        return price(PriceField.LOW, index);
    }

    public double close(int index) {
        return price(PriceField.CLOSE, index);
    }

    /**
     * Simple moving average of {@code field} over the {@code period} bars ending at {@code index}.
     *
     * @return the average, or empty when fewer than {@code period} bars end at {@code index}
     */
    public OptionalDouble sma(PriceField field, int period, int index) {
        if (index < period - 1 || index >= size()) {
            return OptionalDouble.empty();
        }
        Indicator<Num> sma = windows.computeIfAbsent(
                windowKey("SMA", field, period), key -> new SMAIndicator(priceIndicator(field), period));
        return OptionalDouble.of(sma.getValue(index).doubleValue());
    }

    /**
     * Lowest value of {@code field} over {@code [endIndex - length + 1, endIndex]}.
     *
     * @throws IllegalArgumentException if the window starts before the first bar
     */
    public double lowest(PriceField field, int length, int endIndex) {
        requireWindow(length, endIndex);
        Indicator<Num> lowest = windows.computeIfAbsent(
                windowKey("LOWEST", field, length), key -> new LowestValueIndicator(priceIndicator(field), length));
        return lowest.getValue(endIndex).doubleValue();
    }

    /**
     * Highest value of {@code field} over {@code [endIndex - length + 1, endIndex]}.
     *
     * @throws IllegalArgumentException if the window starts before the first bar
     */
    public double highest(PriceField field, int length, int endIndex) {
        requireWindow(length, endIndex);
        Indicator<Num> highest = windows.computeIfAbsent(
                windowKey("HIGHEST", field, length), key -> new HighestValueIndicator(priceIndicator(field), length));
        return highest.getValue(endIndex).doubleValue();
    }

    private Indicator<Num> priceIndicator(PriceField field) {
        return prices.computeIfAbsent(field, f -> switch (f) {
            case OPEN -> new OpenPriceIndicator(barSeries);
            case HIGH -> new HighPriceIndicator(barSeries);
            case LOW -> new LowPriceIndicator(barSeries);
            case CLOSE -> new ClosePriceIndicator(barSeries);
        });
    }

    private void requireWindow(int length, int endIndex) {
        if (length <= 0 || endIndex - length + 1 < 0 || endIndex >= size()) {
            throw new IllegalArgumentException(
                    "Window of " + length + " bars ending at " + endIndex + " is outside history of " + size());
        }
    }

    private static String windowKey(String kind, PriceField field, int period) {
        return kind + ":" + field.name() + ":" + period;
    }

    private static void validate(Bar bar) {
        if (bar == null) {
            throw new InvalidBarException("Bar must not be null");
        }
        if (!Double.isFinite(bar.open())
                || !Double.isFinite(bar.high())
                || !Double.isFinite(bar.low())
                || !Double.isFinite(bar.close())) {
            throw new InvalidBarException("Bar prices must be finite: " + bar);
        }
        if (bar.high() < bar.low()) {
            throw new InvalidBarException(
                    "Bar high is below its low: " + bar, Map.of("high", bar.high(), "low", bar.low()));
        }
        if (outsideRange(bar.open(), bar) || outsideRange(bar.close(), bar)) {
            throw new InvalidBarException(
                    "Bar open or close is outside its high-low range: " + bar,
                    Map.of("open", bar.open(), "high", bar.high(), "low", bar.low(), "close", bar.close()));
        }
    }

    private static boolean outsideRange(double price, Bar bar) {
        return price < bar.low() || price > bar.high();
    }
}
