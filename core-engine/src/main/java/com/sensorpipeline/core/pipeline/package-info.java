/**
 * Pipeline lifecycle, worker threads and the source adapter contract.
 *
 * <p>
 * {@link com.sensorpipeline.core.pipeline.PipelineOrchestrator} drives one
 * worker per {@link com.sensorpipeline.core.pipeline.ReadingSource}; each
 * worker runs readings through statistics, feature engineering and the
 * shared write buffer.
 * </p>
 *
 * @since 1.0.0
 */
package com.sensorpipeline.core.pipeline;
