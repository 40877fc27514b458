package com.sensorpipeline.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Flat, typed feature record derived from one reading and its window.
 *
 * <p>
 * Keyed by ({@link WindowKey}, timestamp). Feature groups:
 * </p>
 * <ul>
 * <li><b>time</b>: calendar fields in UTC plus sine/cosine encodings of
 * hour, day of week and day of year</li>
 * <li><b>statistical</b>: mean, median, std, min, max, range, quartiles and
 * IQR over the current window</li>
 * <li><b>trend</b>: least-squares slope, mean second difference
 * (acceleration) and std of first differences (volatility)</li>
 * <li><b>point</b>: deviation from the window mean, rate of change,
 * z-score and the anomaly flag</li>
 * </ul>
 *
 * <p>
 * Statistical and trend fields are {@code null} when the window is too short
 * to define them. Instances are immutable and are the unit written to
 * storage.
 * </p>
 *
 * @since 1.0.0
 */
public final class FeatureVector implements Serializable {

    private static final long serialVersionUID = 1L;

    // --- identity ---
    private final String wellId;
    private final SensorType sensorType;
    private final Instant timestamp;
    private final double value;
    private final String unit;
    private final Integer quality;
    private final boolean outOfRange;
    private final boolean lateArrival;
    private final int windowCount;

    // --- time ---
    private final int hour;
    private final int dayOfWeek;
    private final int dayOfMonth;
    private final int month;
    private final int dayOfYear;
    private final int weekOfYear;
    private final int quarter;
    private final boolean weekend;
    private final double hourSin;
    private final double hourCos;
    private final double dayOfWeekSin;
    private final double dayOfWeekCos;
    private final double dayOfYearSin;
    private final double dayOfYearCos;

    // --- statistical ---
    private final Double mean;
    private final Double median;
    private final Double std;
    private final Double min;
    private final Double max;
    private final Double range;
    private final Double percentile25;
    private final Double percentile75;
    private final Double iqr;

    // --- trend ---
    private final Double trend;
    private final Double acceleration;
    private final Double volatility;

    // --- point ---
    private final Double changeFromMean;
    private final Double changePercent;
    private final Double rateOfChange;
    private final Double zScore;
    private final boolean anomaly;

    private FeatureVector(Builder b) {
        this.wellId = Objects.requireNonNull(b.wellId, "wellId must not be null");
        this.sensorType = Objects.requireNonNull(b.sensorType, "sensorType must not be null");
        this.timestamp = Objects.requireNonNull(b.timestamp, "timestamp must not be null");
        this.value = b.value;
        this.unit = b.unit;
        this.quality = b.quality;
        this.outOfRange = b.outOfRange;
        this.lateArrival = b.lateArrival;
        this.windowCount = b.windowCount;
        this.hour = b.hour;
        this.dayOfWeek = b.dayOfWeek;
        this.dayOfMonth = b.dayOfMonth;
        this.month = b.month;
        this.dayOfYear = b.dayOfYear;
        this.weekOfYear = b.weekOfYear;
        this.quarter = b.quarter;
        this.weekend = b.weekend;
        this.hourSin = b.hourSin;
        this.hourCos = b.hourCos;
        this.dayOfWeekSin = b.dayOfWeekSin;
        this.dayOfWeekCos = b.dayOfWeekCos;
        this.dayOfYearSin = b.dayOfYearSin;
        this.dayOfYearCos = b.dayOfYearCos;
        this.mean = b.mean;
        this.median = b.median;
        this.std = b.std;
        this.min = b.min;
        this.max = b.max;
        this.range = b.range;
        this.percentile25 = b.percentile25;
        this.percentile75 = b.percentile75;
        this.iqr = b.iqr;
        this.trend = b.trend;
        this.acceleration = b.acceleration;
        this.volatility = b.volatility;
        this.changeFromMean = b.changeFromMean;
        this.changePercent = b.changePercent;
        this.rateOfChange = b.rateOfChange;
        this.zScore = b.zScore;
        this.anomaly = b.anomaly;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link FeatureVector}. {@code wellId},
     * {@code sensorType} and {@code timestamp} are required.
     */
    public static class Builder {
        private String wellId;
        private SensorType sensorType;
        private Instant timestamp;
        private double value;
        private String unit;
        private Integer quality;
        private boolean outOfRange;
        private boolean lateArrival;
        private int windowCount;
        private int hour;
        private int dayOfWeek;
        private int dayOfMonth;
        private int month;
        private int dayOfYear;
        private int weekOfYear;
        private int quarter;
        private boolean weekend;
        private double hourSin;
        private double hourCos;
        private double dayOfWeekSin;
        private double dayOfWeekCos;
        private double dayOfYearSin;
        private double dayOfYearCos;
        private Double mean;
        private Double median;
        private Double std;
        private Double min;
        private Double max;
        private Double range;
        private Double percentile25;
        private Double percentile75;
        private Double iqr;
        private Double trend;
        private Double acceleration;
        private Double volatility;
        private Double changeFromMean;
        private Double changePercent;
        private Double rateOfChange;
        private Double zScore;
        private boolean anomaly;

        public Builder reading(Reading reading) {
            this.wellId = reading.getWellId();
            this.sensorType = reading.getSensorType();
            this.timestamp = reading.getTimestamp();
            this.value = reading.getValue();
            this.unit = reading.getUnit();
            this.quality = reading.getQuality();
            this.outOfRange = reading.isOutOfRange();
            return this;
        }

        public Builder lateArrival(boolean v) {
            this.lateArrival = v;
            return this;
        }

        public Builder windowCount(int v) {
            this.windowCount = v;
            return this;
        }

        public Builder hour(int v) {
            this.hour = v;
            return this;
        }

        public Builder dayOfWeek(int v) {
            this.dayOfWeek = v;
            return this;
        }

        public Builder dayOfMonth(int v) {
            this.dayOfMonth = v;
            return this;
        }

        public Builder month(int v) {
            this.month = v;
            return this;
        }

        public Builder dayOfYear(int v) {
            this.dayOfYear = v;
            return this;
        }

        public Builder weekOfYear(int v) {
            this.weekOfYear = v;
            return this;
        }

        public Builder quarter(int v) {
            this.quarter = v;
            return this;
        }

        public Builder weekend(boolean v) {
            this.weekend = v;
            return this;
        }

        public Builder hourCyclical(double sin, double cos) {
            this.hourSin = sin;
            this.hourCos = cos;
            return this;
        }

        public Builder dayOfWeekCyclical(double sin, double cos) {
            this.dayOfWeekSin = sin;
            this.dayOfWeekCos = cos;
            return this;
        }

        public Builder dayOfYearCyclical(double sin, double cos) {
            this.dayOfYearSin = sin;
            this.dayOfYearCos = cos;
            return this;
        }

        public Builder mean(Double v) {
            this.mean = v;
            return this;
        }

        public Builder median(Double v) {
            this.median = v;
            return this;
        }

        public Builder std(Double v) {
            this.std = v;
            return this;
        }

        public Builder min(Double v) {
            this.min = v;
            return this;
        }

        public Builder max(Double v) {
            this.max = v;
            return this;
        }

        public Builder range(Double v) {
            this.range = v;
            return this;
        }

        public Builder quartiles(Double p25, Double p75) {
            this.percentile25 = p25;
            this.percentile75 = p75;
            this.iqr = (p25 != null && p75 != null) ? p75 - p25 : null;
            return this;
        }

        public Builder trend(Double v) {
            this.trend = v;
            return this;
        }

        public Builder acceleration(Double v) {
            this.acceleration = v;
            return this;
        }

        public Builder volatility(Double v) {
            this.volatility = v;
            return this;
        }

        public Builder changeFromMean(Double v) {
            this.changeFromMean = v;
            return this;
        }

        public Builder changePercent(Double v) {
            this.changePercent = v;
            return this;
        }

        public Builder rateOfChange(Double v) {
            this.rateOfChange = v;
            return this;
        }

        public Builder zScore(Double v) {
            this.zScore = v;
            return this;
        }

        public Builder anomaly(boolean v) {
            this.anomaly = v;
            return this;
        }

        /**
         * @return a new {@link FeatureVector}
         * @throws NullPointerException if identity fields are missing
         */
        public FeatureVector build() {
            return new FeatureVector(this);
        }
    }

    public WindowKey key() {
        return WindowKey.of(wellId, sensorType);
    }

    // ---------------------------------------------------------------
    // Getters (serialised by Jackson)
    // ---------------------------------------------------------------

    public String getWellId() {
        return wellId;
    }

    public SensorType getSensorType() {
        return sensorType;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getValue() {
        return value;
    }

    public String getUnit() {
        return unit;
    }

    public Integer getQuality() {
        return quality;
    }

    @JsonProperty("out_of_range")
    public boolean isOutOfRange() {
        return outOfRange;
    }

    @JsonProperty("late_arrival")
    public boolean isLateArrival() {
        return lateArrival;
    }

    public int getWindowCount() {
        return windowCount;
    }

    public int getHour() {
        return hour;
    }

    /**
     * @return day of week, Monday = 0 … Sunday = 6
     */
    public int getDayOfWeek() {
        return dayOfWeek;
    }

    public int getDayOfMonth() {
        return dayOfMonth;
    }

    public int getMonth() {
        return month;
    }

    public int getDayOfYear() {
        return dayOfYear;
    }

    public int getWeekOfYear() {
        return weekOfYear;
    }

    public int getQuarter() {
        return quarter;
    }

    @JsonProperty("is_weekend")
    public boolean isWeekend() {
        return weekend;
    }

    public double getHourSin() {
        return hourSin;
    }

    public double getHourCos() {
        return hourCos;
    }

    public double getDayOfWeekSin() {
        return dayOfWeekSin;
    }

    public double getDayOfWeekCos() {
        return dayOfWeekCos;
    }

    public double getDayOfYearSin() {
        return dayOfYearSin;
    }

    public double getDayOfYearCos() {
        return dayOfYearCos;
    }

    public Double getMean() {
        return mean;
    }

    public Double getMedian() {
        return median;
    }

    public Double getStd() {
        return std;
    }

    public Double getMin() {
        return min;
    }

    public Double getMax() {
        return max;
    }

    public Double getRange() {
        return range;
    }

    @JsonProperty("percentile_25")
    public Double getPercentile25() {
        return percentile25;
    }

    @JsonProperty("percentile_75")
    public Double getPercentile75() {
        return percentile75;
    }

    public Double getIqr() {
        return iqr;
    }

    public Double getTrend() {
        return trend;
    }

    public Double getAcceleration() {
        return acceleration;
    }

    public Double getVolatility() {
        return volatility;
    }

    public Double getChangeFromMean() {
        return changeFromMean;
    }

    public Double getChangePercent() {
        return changePercent;
    }

    public Double getRateOfChange() {
        return rateOfChange;
    }

    @JsonProperty("z_score")
    public Double getZScore() {
        return zScore;
    }

    @JsonProperty("is_anomaly")
    public boolean isAnomaly() {
        return anomaly;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FeatureVector that))
            return false;
        return wellId.equals(that.wellId)
                && sensorType == that.sensorType
                && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(wellId, sensorType, timestamp);
    }

    @Override
    public String toString() {
        return "FeatureVector{" +
                "wellId='" + wellId + '\'' +
                ", sensorType=" + sensorType +
                ", timestamp=" + timestamp +
                ", value=" + value +
                ", zScore=" + zScore +
                ", anomaly=" + anomaly +
                '}';
    }
}
