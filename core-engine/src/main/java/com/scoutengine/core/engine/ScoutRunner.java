package com.scoutengine.core.engine;

import com.scoutengine.core.model.Opportunity;
import com.scoutengine.core.model.Priority;
import com.scoutengine.core.sink.OpportunitySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Runs the {@link DetectionEngine} and hands the ranked opportunities to an
 * {@link OpportunitySink}, logging a per-priority and per-category summary.
 *
 * <p>
 * A cancelled run still writes the opportunities of its completed batches.
 * Sink failures propagate to the caller; wrap the sink in a
 * {@link com.scoutengine.core.sink.RetryingOpportunitySink} to retry them.
 * </p>
 *
 * @since 1.0.0
 */
public class ScoutRunner {

    private static final Logger LOG = LoggerFactory.getLogger(ScoutRunner.class);

    private final DetectionEngine engine;
    private final OpportunitySink sink;

    public ScoutRunner(DetectionEngine engine, OpportunitySink sink) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
    }

    public RunSummary run(DetectionRequest request) {
        return run(request, CancellationSignal.create());
    }

    /**
     * @throws com.scoutengine.core.sink.SinkWriteException if the sink rejects
     *                                                       the opportunities
     */
    public RunSummary run(DetectionRequest request, CancellationSignal signal) {
        DetectionResult result = engine.run(request, signal);
        LOG.info("Saving {} opportunit(ies) for organization {}",
                result.getOpportunities().size(), request.getOrganizationId());
        sink.write(result.getOpportunities());

        RunSummary summary = RunSummary.of(request.getOrganizationId(), result);
        LOG.info("Scout run complete for {}: {} opportunit(ies), {} high priority, by category {}",
                request.getOrganizationId(), summary.getTotal(),
                summary.getByPriority().get(Priority.HIGH), summary.getByCategory());
        return summary;
    }

    /**
     * Counts of a finished run.
     */
    public static final class RunSummary {

        private final String organizationId;
        private final DetectionResult result;
        private final Map<Priority, Integer> byPriority;
        private final Map<String, Integer> byCategory;

        private RunSummary(String organizationId, DetectionResult result,
                           Map<Priority, Integer> byPriority, Map<String, Integer> byCategory) {
            this.organizationId = organizationId;
            this.result = result;
            this.byPriority = Collections.unmodifiableMap(byPriority);
            this.byCategory = Collections.unmodifiableMap(byCategory);
        }

        static RunSummary of(String organizationId, DetectionResult result) {
            Map<Priority, Integer> byPriority = new EnumMap<>(Priority.class);
            for (Priority p : Priority.values()) {
                byPriority.put(p, 0);
            }
            Map<String, Integer> byCategory = new TreeMap<>();
            for (Opportunity o : result.getOpportunities()) {
                byPriority.merge(o.getPriority(), 1, Integer::sum);
                byCategory.merge(o.getCategory(), 1, Integer::sum);
            }
            return new RunSummary(organizationId, result, byPriority, byCategory);
        }

        public String getOrganizationId() {
            return organizationId;
        }

        public DetectionResult getResult() {
            return result;
        }

        public int getTotal() {
            return result.getOpportunities().size();
        }

        /** @return count per priority; every priority is present */
        public Map<Priority, Integer> getByPriority() {
            return byPriority;
        }

        /** @return count per category, sorted by category */
        public Map<String, Integer> getByCategory() {
            return byCategory;
        }

        @Override
        public String toString() {
            return "RunSummary{" +
                    "organizationId='" + organizationId + '\'' +
                    ", total=" + getTotal() +
                    ", byPriority=" + byPriority +
                    ", byCategory=" + byCategory +
                    '}';
        }
    }
}
