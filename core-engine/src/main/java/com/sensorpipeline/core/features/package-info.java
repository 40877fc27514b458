/**
 * Calendar, cyclical and window-derived features attached to every
 * processed reading.
 */
package com.sensorpipeline.core.features;
