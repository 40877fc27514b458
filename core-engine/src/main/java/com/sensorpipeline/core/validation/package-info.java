/**
 * Field rules applied to decoded readings before they reach a window.
 */
package com.sensorpipeline.core.validation;
