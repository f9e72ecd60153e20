/**
 * Domain model classes for Scout Engine.
 *
 * <p>
 * Metric data flows in as {@link com.scoutengine.core.model.MetricObservation}s
 * grouped into immutable {@link com.scoutengine.core.model.MetricSeries}, and
 * leaves the engine as {@link com.scoutengine.core.model.Opportunity} records.
 * {@link com.scoutengine.core.model.DetectionRule} and
 * {@link com.scoutengine.core.model.ConditionSpec} are the YAML-bound rule
 * configuration POJOs.
 * </p>
 *
 * @since 1.0.0
 */
package com.scoutengine.core.model;
