/**
 * Trend shape classification over the last few periods of a series.
 *
 * @since 1.0.0
 */
package com.scoutengine.core.trend;
