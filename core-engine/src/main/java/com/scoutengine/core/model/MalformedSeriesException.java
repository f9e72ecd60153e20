package com.scoutengine.core.model;

/**
 * Thrown when observations cannot form a valid {@link MetricSeries}: periods
 * out of order, duplicated or overlapping, mixed entities or metrics, or
 * non-finite values.
 *
 * @since 1.0.0
 */
public class MalformedSeriesException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final String entityId;
    private final String metricName;

    public MalformedSeriesException(String entityId, String metricName, String message) {
        super("Malformed series [" + entityId + "/" + metricName + "]: " + message);
        this.entityId = entityId;
        this.metricName = metricName;
    }

    public String getEntityId() {
        return entityId;
    }

    public String getMetricName() {
        return metricName;
    }
}
