/**
 * Rolling statistics per well/sensor key.
 *
 * <p>
 * {@link com.sensorpipeline.core.stats.StreamStatisticsEngine} validates a
 * raw reading, inserts it into its window and derives point metrics
 * (z-score, change from mean, rate of change) against the window as it was
 * before the insert. Descriptive values that cannot be computed are
 * {@code null}, never {@code NaN}.
 * </p>
 *
 * @since 1.0.0
 */
package com.sensorpipeline.core.stats;
