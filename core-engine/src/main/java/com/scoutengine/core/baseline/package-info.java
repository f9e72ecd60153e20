/**
 * Baselines: rolling-window aggregates of an entity's own history and
 * percentile ranks against a cohort of peers.
 *
 * @since 1.0.0
 */
package com.scoutengine.core.baseline;
