package com.scoutengine.core.source;

import com.scoutengine.core.model.EntityRef;
import com.scoutengine.core.model.MetricSeries;
import com.scoutengine.core.model.PeriodRange;

import java.util.List;

/**
 * Read access to metric data for a detection run.
 *
 * <p>
 * The engine performs no blocking I/O: implementations are expected to serve
 * a snapshot that was loaded before the run started. Implementations must be
 * safe for concurrent reads.
 * </p>
 *
 * @since 1.0.0
 */
public interface MetricSource {

    /**
     * Return the observations of one metric for one entity within
     * {@code range}, oldest first. Returns an empty series when there is no
     * data.
     *
     * @param entity     the entity
     * @param metricName metric name
     * @param range      inclusive period range
     * @return the series
     * @throws com.scoutengine.core.model.MalformedSeriesException if the stored
     *         observations violate the series invariants
     */
    MetricSeries fetchSeries(EntityRef entity, String metricName, PeriodRange range);

    /**
     * Return the current value of {@code metricName} for every entity of
     * {@code entityType} that reported the period ending on
     * {@code range.getEnd()}. Entities without an observation for that period
     * are left out, so every peer is ranked on the same period.
     *
     * @param entityType entity type of the cohort
     * @param metricName metric name
     * @param range      inclusive period range of the run
     * @return list of peer values, possibly empty
     */
    List<PeerValue> fetchPeerValues(String entityType, String metricName, PeriodRange range);
}
