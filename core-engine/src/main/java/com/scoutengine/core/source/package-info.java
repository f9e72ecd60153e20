/**
 * Metric input: the {@link com.scoutengine.core.source.MetricSource} contract
 * and an in-memory snapshot implementation.
 *
 * @since 1.0.0
 */
package com.scoutengine.core.source;
