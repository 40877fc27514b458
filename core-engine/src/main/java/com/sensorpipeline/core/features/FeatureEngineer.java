package com.sensorpipeline.core.features;

import com.sensorpipeline.core.model.FeatureVector;
import com.sensorpipeline.core.model.Reading;
import com.sensorpipeline.core.stats.Descriptive;
import com.sensorpipeline.core.stats.StatFeatures;
import com.sensorpipeline.core.stats.StatisticsResult;
import com.sensorpipeline.core.window.WindowSnapshot;

import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.IsoFields;
import java.util.Objects;

/**
 * Turns a processed reading and its window into a {@link FeatureVector}.
 *
 * <p>
 * Time features are pure functions of the reading timestamp in UTC. Window
 * features reuse the snapshot produced by the statistics engine; this class
 * never mutates window state and is safe for concurrent use.
 * </p>
 *
 * <h3>Minimum window sizes</h3>
 * <ul>
 * <li>statistics and quartiles: {@value #MIN_STATISTICS_POINTS} readings</li>
 * <li>trend: {@value #MIN_TREND_POINTS} readings</li>
 * <li>acceleration and volatility: {@value #MIN_CURVATURE_POINTS} readings</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class FeatureEngineer {

    static final int MIN_STATISTICS_POINTS = 2;
    static final int MIN_TREND_POINTS = 2;
    static final int MIN_CURVATURE_POINTS = 3;

    private static final double TWO_PI = 2 * Math.PI;

    /**
     * Build the feature vector for one processed reading.
     *
     * @param statistics output of the statistics engine; must not be
     *                   {@code null}
     * @return the feature vector
     */
    public FeatureVector engineer(StatisticsResult statistics) {
        Objects.requireNonNull(statistics, "StatisticsResult must not be null");
        Reading reading = statistics.getReading();
        StatFeatures stats = statistics.getFeatures();
        WindowSnapshot window = statistics.getWindow();

        FeatureVector.Builder builder = FeatureVector.builder()
                .reading(reading)
                .lateArrival(statistics.isLate())
                .windowCount(window.count());

        applyTimeFeatures(builder, reading.getTimestamp().atZone(ZoneOffset.UTC));
        applyStatisticalFeatures(builder, stats, window);
        applyTrendFeatures(builder, window.values());

        return builder
                .changeFromMean(stats.getChangeFromMean())
                .changePercent(stats.getChangePercent())
                .rateOfChange(stats.getRateOfChange())
                .zScore(stats.getZScore())
                .anomaly(stats.isAnomaly())
                .build();
    }

    // ---------------------------------------------------------------
    // Feature groups
    // ---------------------------------------------------------------

    static void applyTimeFeatures(FeatureVector.Builder builder, ZonedDateTime utc) {
        int hour = utc.getHour();
        int dayOfWeek = utc.getDayOfWeek().getValue() - 1;
        int dayOfYear = utc.getDayOfYear();
        int daysInYear = utc.toLocalDate().lengthOfYear();

        builder.hour(hour)
                .dayOfWeek(dayOfWeek)
                .dayOfMonth(utc.getDayOfMonth())
                .month(utc.getMonthValue())
                .dayOfYear(dayOfYear)
                .weekOfYear(utc.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR))
                .quarter(utc.get(IsoFields.QUARTER_OF_YEAR))
                .weekend(dayOfWeek >= 5)
                .hourCyclical(Math.sin(TWO_PI * hour / 24), Math.cos(TWO_PI * hour / 24))
                .dayOfWeekCyclical(Math.sin(TWO_PI * dayOfWeek / 7), Math.cos(TWO_PI * dayOfWeek / 7))
                .dayOfYearCyclical(Math.sin(TWO_PI * dayOfYear / daysInYear),
                        Math.cos(TWO_PI * dayOfYear / daysInYear));
    }

    private static void applyStatisticalFeatures(FeatureVector.Builder builder,
            StatFeatures stats, WindowSnapshot window) {
        if (window.count() < MIN_STATISTICS_POINTS) {
            return;
        }
        double[] sorted = window.sortedValues();
        builder.mean(stats.getMean())
                .median(stats.getMedian())
                .std(stats.getStd())
                .min(stats.getMin())
                .max(stats.getMax())
                .range(stats.getRange())
                .quartiles(Descriptive.percentile(sorted, 25), Descriptive.percentile(sorted, 75));
    }

    private static void applyTrendFeatures(FeatureVector.Builder builder, double[] series) {
        if (series.length >= MIN_TREND_POINTS) {
            builder.trend(Descriptive.slope(series));
        }
        if (series.length >= MIN_CURVATURE_POINTS) {
            double[] first = Descriptive.differences(series);
            double[] second = Descriptive.differences(first);
            builder.acceleration(Descriptive.mean(second))
                    .volatility(Descriptive.std(first));
        }
    }
}
