/**
 * Deployable service wiring the core pipeline to Kafka and PostgreSQL.
 *
 * <p>
 * {@link com.sensorpipeline.service.SensorPipelineApplication} is the entry
 * point; {@link com.sensorpipeline.service.KafkaReadingSource} and
 * {@link com.sensorpipeline.service.JdbcFeatureStore} adapt the external
 * systems to the core interfaces.
 * </p>
 *
 * @since 1.0.0
 */
package com.sensorpipeline.service;
