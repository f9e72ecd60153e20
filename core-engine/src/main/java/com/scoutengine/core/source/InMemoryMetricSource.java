package com.scoutengine.core.source;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scoutengine.core.model.EntityRef;
import com.scoutengine.core.model.MetricObservation;
import com.scoutengine.core.model.MetricSeries;
import com.scoutengine.core.model.PeriodRange;
import com.scoutengine.core.util.ObjectMappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * {@link MetricSource} backed by an immutable in-memory snapshot of
 * observations.
 *
 * <p>
 * Observations are served in the order they were added, so a snapshot with
 * out-of-order or duplicate periods surfaces as a
 * {@link com.scoutengine.core.model.MalformedSeriesException} when the series
 * is fetched, not when the snapshot is built.
 * </p>
 *
 * <p>
 * A snapshot can be loaded from a JSON array of observations:
 * </p>
 *
 * <pre>
 * [
 *   {"entity_id": "page_42", "entity_type": "page", "metric_name": "sessions",
 *    "period_start": "2024-01-01", "period_end": "2024-01-31", "value": 1000}
 * ]
 * </pre>
 *
 * @since 1.0.0
 */
public final class InMemoryMetricSource implements MetricSource {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryMetricSource.class);

    private static final TypeReference<List<MetricObservation>> OBSERVATION_LIST = new TypeReference<>() {
    };

    /** (entityId, metric) → observations in insertion order. */
    private final Map<SeriesKey, List<MetricObservation>> series;

    private InMemoryMetricSource(Map<SeriesKey, List<MetricObservation>> series) {
        this.series = series;
    }

    // ---------------------------------------------------------------
    // Factories
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static InMemoryMetricSource of(Collection<MetricObservation> observations) {
        return builder().addAll(observations).build();
    }

    /**
     * Load a snapshot from a JSON array of observations.
     *
     * @param in input stream; not closed by this method
     * @return the snapshot
     * @throws IllegalStateException if the JSON cannot be parsed
     */
    public static InMemoryMetricSource fromJson(InputStream in) {
        Objects.requireNonNull(in, "input stream must not be null");
        ObjectMapper mapper = ObjectMappers.create();
        try {
            List<MetricObservation> observations = mapper.readValue(in, OBSERVATION_LIST);
            LOG.info("Loaded {} metric observation(s) from JSON", observations.size());
            return of(observations);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to parse metric snapshot: " + e.getMessage(), e);
        }
    }

    /**
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading or parsing fails
     */
    public static InMemoryMetricSource fromJsonFile(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        if (!Files.exists(path)) {
            throw new IllegalArgumentException("Metric snapshot not found: " + path);
        }
        try (InputStream in = Files.newInputStream(path)) {
            return fromJson(in);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read metric snapshot: " + path, e);
        }
    }

    // ---------------------------------------------------------------
    // MetricSource
    // ---------------------------------------------------------------

    @Override
    public MetricSeries fetchSeries(EntityRef entity, String metricName, PeriodRange range) {
        Objects.requireNonNull(entity, "entity must not be null");
        Objects.requireNonNull(metricName, "metricName must not be null");
        Objects.requireNonNull(range, "range must not be null");

        List<MetricObservation> stored = series.getOrDefault(new SeriesKey(entity.getEntityId(), metricName), List.of());
        List<MetricObservation> inRange = stored.stream()
                .filter(range::contains)
                .toList();
        return MetricSeries.of(entity.getEntityId(), entity.getEntityType(), metricName, inRange);
    }

    @Override
    public List<PeerValue> fetchPeerValues(String entityType, String metricName, PeriodRange range) {
        Objects.requireNonNull(entityType, "entityType must not be null");
        Objects.requireNonNull(metricName, "metricName must not be null");
        Objects.requireNonNull(range, "range must not be null");

        List<PeerValue> peers = new ArrayList<>();
        for (Map.Entry<SeriesKey, List<MetricObservation>> e : series.entrySet()) {
            if (!e.getKey().metricName.equals(metricName)) {
                continue;
            }
            MetricObservation current = null;
            for (MetricObservation o : e.getValue()) {
                if (!o.getEntityType().equals(entityType) || !range.contains(o)
                        || !o.getPeriodEnd().equals(range.getEnd())) {
                    continue;
                }
                if (current == null || o.getPeriodStart().isAfter(current.getPeriodStart())) {
                    current = o;
                }
            }
            if (current != null) {
                peers.add(PeerValue.of(current.getEntityId(), current.getValue()));
            }
        }
        return peers;
    }

    /**
     * @return every entity that has at least one observation, in insertion
     *         order
     */
    public List<EntityRef> entities() {
        Set<EntityRef> refs = new LinkedHashSet<>();
        for (List<MetricObservation> observations : series.values()) {
            for (MetricObservation o : observations) {
                refs.add(EntityRef.of(o.getEntityId(), o.getEntityType()));
            }
        }
        return List.copyOf(refs);
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Accumulates observations; {@link #build()} freezes them.
     */
    public static class Builder {
        private final Map<SeriesKey, List<MetricObservation>> series = new LinkedHashMap<>();

        public Builder add(MetricObservation observation) {
            Objects.requireNonNull(observation, "observation must not be null");
            series.computeIfAbsent(new SeriesKey(observation.getEntityId(), observation.getMetricName()),
                    k -> new ArrayList<>()).add(observation);
            return this;
        }

        public Builder addAll(Collection<MetricObservation> observations) {
            Objects.requireNonNull(observations, "observations must not be null");
            observations.forEach(this::add);
            return this;
        }

        public InMemoryMetricSource build() {
            Map<SeriesKey, List<MetricObservation>> frozen = new LinkedHashMap<>();
            series.forEach((k, v) -> frozen.put(k, List.copyOf(v)));
            return new InMemoryMetricSource(Collections.unmodifiableMap(frozen));
        }
    }

    private static final class SeriesKey {
        private final String entityId;
        private final String metricName;

        SeriesKey(String entityId, String metricName) {
            this.entityId = entityId;
            this.metricName = metricName;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof SeriesKey that))
                return false;
            return entityId.equals(that.entityId) && metricName.equals(that.metricName);
        }

        @Override
        public int hashCode() {
            return Objects.hash(entityId, metricName);
        }
    }
}
