package com.scoutengine.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.Objects;

/**
 * A single value of one metric for one entity over one period.
 *
 * <p>
 * Periods are closed date ranges: both {@code periodStart} and
 * {@code periodEnd} are inclusive. Observations are immutable.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class MetricObservation implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String entityId;
    private final String entityType;
    private final String metricName;
    private final LocalDate periodStart;
    private final LocalDate periodEnd;
    private final double value;

    /**
     * @throws NullPointerException     if any identifying field is {@code null}
     * @throws IllegalArgumentException if {@code periodEnd} precedes
     *                                  {@code periodStart}
     */
    @JsonCreator
    public MetricObservation(@JsonProperty("entity_id") String entityId,
                             @JsonProperty("entity_type") String entityType,
                             @JsonProperty("metric_name") String metricName,
                             @JsonProperty("period_start") LocalDate periodStart,
                             @JsonProperty("period_end") LocalDate periodEnd,
                             @JsonProperty("value") double value) {
        this.entityId = Objects.requireNonNull(entityId, "entityId must not be null");
        this.entityType = Objects.requireNonNull(entityType, "entityType must not be null");
        this.metricName = Objects.requireNonNull(metricName, "metricName must not be null");
        this.periodStart = Objects.requireNonNull(periodStart, "periodStart must not be null");
        this.periodEnd = Objects.requireNonNull(periodEnd, "periodEnd must not be null");
        if (periodEnd.isBefore(periodStart)) {
            throw new IllegalArgumentException(
                    "periodEnd " + periodEnd + " is before periodStart " + periodStart);
        }
        this.value = value;
    }

    public String getEntityId() {
        return entityId;
    }

    public String getEntityType() {
        return entityType;
    }

    public String getMetricName() {
        return metricName;
    }

    public LocalDate getPeriodStart() {
        return periodStart;
    }

    public LocalDate getPeriodEnd() {
        return periodEnd;
    }

    public double getValue() {
        return value;
    }

    /**
     * @return number of days covered by this observation's period
     */
    public long lengthInDays() {
        return periodEnd.toEpochDay() - periodStart.toEpochDay() + 1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MetricObservation that))
            return false;
        return Double.compare(value, that.value) == 0
                && entityId.equals(that.entityId)
                && entityType.equals(that.entityType)
                && metricName.equals(that.metricName)
                && periodStart.equals(that.periodStart)
                && periodEnd.equals(that.periodEnd);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entityId, entityType, metricName, periodStart, periodEnd, value);
    }

    @Override
    public String toString() {
        return "MetricObservation{" +
                "entityId='" + entityId + '\'' +
                ", metricName='" + metricName + '\'' +
                ", period=" + periodStart + ".." + periodEnd +
                ", value=" + value +
                '}';
    }
}
