/**
 * Orchestration of detection runs.
 *
 * <p>
 * {@link com.scoutengine.core.engine.DetectionEngine} evaluates every
 * applicable rule for every requested entity on a worker pool, isolates
 * failures to the offending (entity, rule) pair, deduplicates the firings per
 * entity and category and returns them ranked.
 * {@link com.scoutengine.core.engine.ScoutRunner} wires a run to an
 * {@link com.scoutengine.core.sink.OpportunitySink}.
 * </p>
 *
 * @since 1.0.0
 */
package com.scoutengine.core.engine;
