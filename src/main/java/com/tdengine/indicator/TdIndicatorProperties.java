package com.tdengine.indicator;

import com.tdengine.domain.enums.FollowThroughPolicy;
import com.tdengine.domain.enums.UndefinedAveragePolicy;
import com.tdengine.exception.InvalidConfigurationException;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Root configuration for the DeMark indicator engine, bound from application.yml
 * under the {@code td-indicators} prefix.
 *
 * <p>Defaults reproduce the historical behaviour of the indicator set, including the
 * two legacy quirks (lenient undefined averages and sticky follow-through counters).
 */
@Data
@ConfigurationProperties(prefix = "td-indicators")
public class TdIndicatorProperties {

    /** Propagate InsufficientHistoryException from the service instead of reporting warm-up. */
    private boolean failOnInsufficientHistory = false;

    /** Spacing of the synthetic bar end times in the ta4j series. */
    private Duration barDuration = Duration.ofDays(1);

    private MovingAverage movingAverage = new MovingAverage();
    private Setup setup = new Setup();
    private Countdown countdown = new Countdown();
    private Crossover crossover = new Crossover();
    private Exit exit = new Exit();

    @Data
    public static class MovingAverage {
        private int lookbackPeriod = 12;
        private int averagePeriod = 5;
        private int extensionBars = 4;
        private UndefinedAveragePolicy undefinedAveragePolicy = UndefinedAveragePolicy.LENIENT_ZERO;
    }

    @Data
    public static class Setup {
        private FollowThroughPolicy followThroughPolicy = FollowThroughPolicy.STICKY;
    }

    @Data
    public static class Countdown {
        private int target = 13;

        /** Whether the bar that completes Setup 9 may itself score a countdown bar. */
        private boolean countOnCompletionBar = false;
    }

    @Data
    public static class Crossover {
        private int fastPeriod = 3;
        private int slowPeriod = 34;
    }

    @Data
    public static class Exit {
        private int followThroughBars = 3;
        private double weakCloseRangePct = 0.5;
        private int timeStopDays = 20;
        private int postSetupBars = 10;
        private boolean crossoverExitEnabled = false;
    }

    /**
     * Fails fast on values that would make a calculator meaningless.
     *
     * @throws InvalidConfigurationException naming the first offending property
     */
    public void validate() {
        requirePositive("moving-average.lookback-period", movingAverage.getLookbackPeriod());
        requirePositive("moving-average.average-period", movingAverage.getAveragePeriod());
        requirePositive("moving-average.extension-bars", movingAverage.getExtensionBars());
        requireNotNull("moving-average.undefined-average-policy", movingAverage.getUndefinedAveragePolicy());
        requireNotNull("setup.follow-through-policy", setup.getFollowThroughPolicy());
        requirePositive("countdown.target", countdown.getTarget());
        requirePositive("crossover.fast-period", crossover.getFastPeriod());
        requirePositive("crossover.slow-period", crossover.getSlowPeriod());
        requirePositive("exit.follow-through-bars", exit.getFollowThroughBars());
        requirePositive("exit.time-stop-days", exit.getTimeStopDays());
        if (exit.getPostSetupBars() < 0) {
            throw new InvalidConfigurationException("exit.post-setup-bars", exit.getPostSetupBars());
        }
        if (exit.getWeakCloseRangePct() < 0.0 || exit.getWeakCloseRangePct() > 1.0) {
            throw new InvalidConfigurationException("exit.weak-close-range-pct", exit.getWeakCloseRangePct());
        }
        if (barDuration == null || barDuration.isZero() || barDuration.isNegative()) {
            throw new InvalidConfigurationException("bar-duration", barDuration);
        }
    }

    private static void requirePositive(String property, int value) {
        if (value <= 0) {
            throw new InvalidConfigurationException(property, value);
        }
    }

    private static void requireNotNull(String property, Object value) {
        if (value == null) {
            throw new InvalidConfigurationException(property, null);
        }
    }
}
