package com.scoutengine.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable, time-ordered sequence of observations for one
 * {@code (entityId, metricName)} pair.
 *
 * <p>
 * The last observation is the <em>current</em> period; everything before it
 * is history. A series is built fresh for every detection run and never
 * shared between runs.
 * </p>
 *
 * <h3>Invariants</h3>
 * <ul>
 * <li>all observations belong to the same entity and metric</li>
 * <li>period starts are strictly increasing</li>
 * <li>periods do not overlap (each period starts after the previous one
 * ends)</li>
 * <li>values are finite</li>
 * </ul>
 * Violations throw {@link MalformedSeriesException} at construction time.
 *
 * @since 1.0.0
 */
public final class MetricSeries {

    private final String entityId;
    private final String entityType;
    private final String metricName;
    private final List<MetricObservation> observations;

    private MetricSeries(String entityId, String entityType, String metricName,
                         List<MetricObservation> observations) {
        this.entityId = Objects.requireNonNull(entityId, "entityId must not be null");
        this.entityType = Objects.requireNonNull(entityType, "entityType must not be null");
        this.metricName = Objects.requireNonNull(metricName, "metricName must not be null");
        this.observations = Collections.unmodifiableList(new ArrayList<>(observations));
        validate();
    }

    /**
     * Build a series from a non-empty list of observations. Identity fields
     * are taken from the first observation.
     *
     * @param observations time-ordered observations; must not be empty
     * @return a validated series
     * @throws IllegalArgumentException if {@code observations} is empty
     * @throws MalformedSeriesException if the series invariants are violated
     */
    public static MetricSeries of(List<MetricObservation> observations) {
        Objects.requireNonNull(observations, "observations must not be null");
        if (observations.isEmpty()) {
            throw new IllegalArgumentException("Cannot infer series identity from no observations; use empty()");
        }
        MetricObservation first = observations.get(0);
        return new MetricSeries(first.getEntityId(), first.getEntityType(), first.getMetricName(), observations);
    }

    /**
     * Build a series with explicit identity. The list may be empty.
     */
    public static MetricSeries of(String entityId, String entityType, String metricName,
                                  List<MetricObservation> observations) {
        Objects.requireNonNull(observations, "observations must not be null");
        return new MetricSeries(entityId, entityType, metricName, observations);
    }

    public static MetricSeries empty(String entityId, String entityType, String metricName) {
        return new MetricSeries(entityId, entityType, metricName, List.of());
    }

    private void validate() {
        MetricObservation previous = null;
        for (MetricObservation o : observations) {
            Objects.requireNonNull(o, "observation must not be null");
            if (!entityId.equals(o.getEntityId())) {
                throw new MalformedSeriesException(entityId, metricName,
                        "observation belongs to entity '" + o.getEntityId() + "'");
            }
            if (!metricName.equals(o.getMetricName())) {
                throw new MalformedSeriesException(entityId, metricName,
                        "observation carries metric '" + o.getMetricName() + "'");
            }
            if (!Double.isFinite(o.getValue())) {
                throw new MalformedSeriesException(entityId, metricName,
                        "non-finite value " + o.getValue() + " at " + o.getPeriodStart());
            }
            if (previous != null) {
                if (o.getPeriodStart().equals(previous.getPeriodStart())) {
                    throw new MalformedSeriesException(entityId, metricName,
                            "duplicate period starting " + o.getPeriodStart());
                }
                if (o.getPeriodStart().isBefore(previous.getPeriodStart())) {
                    throw new MalformedSeriesException(entityId, metricName,
                            "period " + o.getPeriodStart() + " is out of order after " + previous.getPeriodStart());
                }
                if (!o.getPeriodStart().isAfter(previous.getPeriodEnd())) {
                    throw new MalformedSeriesException(entityId, metricName,
                            "period " + o.getPeriodStart() + " overlaps period ending " + previous.getPeriodEnd());
                }
            }
            previous = o;
        }
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public String getEntityId() {
        return entityId;
    }

    public String getEntityType() {
        return entityType;
    }

    public String getMetricName() {
        return metricName;
    }

    /**
     * @return unmodifiable list of all observations, oldest first
     */
    public List<MetricObservation> getObservations() {
        return observations;
    }

    public int size() {
        return observations.size();
    }

    public boolean isEmpty() {
        return observations.isEmpty();
    }

    /**
     * @return the most recent observation, or empty for an empty series
     */
    public Optional<MetricObservation> current() {
        return observations.isEmpty()
                ? Optional.empty()
                : Optional.of(observations.get(observations.size() - 1));
    }

    /**
     * @return all observations except the current one, oldest first
     */
    public List<MetricObservation> history() {
        return observations.isEmpty()
                ? List.of()
                : observations.subList(0, observations.size() - 1);
    }

    /**
     * Return the values of the last {@code n} observations (fewer if the
     * series is shorter), oldest first.
     *
     * @param n number of trailing observations
     * @return array of values
     */
    public double[] lastValues(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("n must be >= 0, got: " + n);
        }
        int from = Math.max(0, observations.size() - n);
        double[] values = new double[observations.size() - from];
        for (int i = from; i < observations.size(); i++) {
            values[i - from] = observations.get(i).getValue();
        }
        return values;
    }

    @Override
    public String toString() {
        return "MetricSeries{" +
                "entityId='" + entityId + '\'' +
                ", metricName='" + metricName + '\'' +
                ", size=" + observations.size() +
                '}';
    }
}
