/**
 * Domain model of the sensor pipeline.
 *
 * <ul>
 * <li>{@link com.sensorpipeline.core.model.RawReading}: a reading as decoded
 * from the wire, before validation</li>
 * <li>{@link com.sensorpipeline.core.model.Reading}: a validated, immutable
 * reading</li>
 * <li>{@link com.sensorpipeline.core.model.WindowKey}: (well, sensor type)
 * identity partitioning all window state</li>
 * <li>{@link com.sensorpipeline.core.model.FeatureVector}: the flat,
 * typed record written to storage</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.sensorpipeline.core.model;
