/**
 * Bounded per-key windows with running aggregates.
 *
 * <p>
 * {@link com.sensorpipeline.core.window.WindowStateStore} hands out one
 * {@link com.sensorpipeline.core.window.WindowState} per key and serialises
 * access per key; unrelated keys never contend on a shared lock.
 * </p>
 *
 * @since 1.0.0
 */
package com.sensorpipeline.core.window;
