/**
 * Pipeline configuration.
 *
 * <p>
 * Settings are defined in YAML and loaded by
 * {@link com.sensorpipeline.core.config.PipelineConfigLoader} into an
 * immutable {@link com.sensorpipeline.core.config.PipelineConfig}. Values are
 * validated when the configuration is built, so a bad file fails at startup.
 * </p>
 *
 * @since 1.0.0
 */
package com.sensorpipeline.core.config;
