package com.tdengine.unit.indicator;

import com.tdengine.domain.model.Bar;
import com.tdengine.indicator.BarHistory;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Bar series builders shared by the indicator tests.
 */
final class BarFixtures {

    static final String SYMBOL = "NIFTY";

    private BarFixtures() {}

    /** Bars with open = close, high = close + 1, low = close - 1. */
    static List<Bar> fromCloses(double... closes) {
        List<Bar> bars = new ArrayList<>(closes.length);
        for (double close : closes) {
            bars.add(Bar.of(close, close + 1, close - 1, close));
        }
        return bars;
    }

    /** Bars with the given lows and high = low + 2, close = low + 1. */
    static List<Bar> fromLows(double... lows) {
        List<Bar> bars = new ArrayList<>(lows.length);
        for (double low : lows) {
            bars.add(Bar.of(low + 1, low + 2, low, low + 1));
        }
        return bars;
    }

    /** {@code count} closes starting at {@code start}, stepping by {@code step}. */
    static double[] linear(double start, double step, int count) {
        double[] closes = new double[count];
        for (int i = 0; i < count; i++) {
            closes[i] = start + step * i;
        }
        return closes;
    }

    /** Seeded random walk, so property checks see the same bars on every run. */
    static List<Bar> randomWalk(long seed, int count) {
        Random random = new Random(seed);
        List<Bar> bars = new ArrayList<>(count);
        double close = 100.0;
        for (int i = 0; i < count; i++) {
            double open = close;
            close = Math.max(1.0, close + random.nextGaussian() * 2.0);
            double high = Math.max(open, close) + random.nextDouble();
            double low = Math.min(open, close) - random.nextDouble();
            bars.add(Bar.of(open, high, low, close));
        }
        return bars;
    }

    static BarHistory history(List<Bar> bars) {
        BarHistory history = new BarHistory(SYMBOL, Duration.ofDays(1));
        bars.forEach(history::append);
        return history;
    }

    static BarHistory history(double... closes) {
        return history(fromCloses(closes));
    }
}
