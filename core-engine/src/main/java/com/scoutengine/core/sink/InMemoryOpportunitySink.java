package com.scoutengine.core.sink;

import com.scoutengine.core.model.Opportunity;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Collects written opportunities in memory. Thread-safe.
 *
 * @since 1.0.0
 */
public class InMemoryOpportunitySink implements OpportunitySink {

    private final List<Opportunity> written = new ArrayList<>();

    @Override
    public synchronized void write(List<Opportunity> opportunities) {
        Objects.requireNonNull(opportunities, "opportunities must not be null");
        written.addAll(opportunities);
    }

    /**
     * @return a snapshot of everything written so far, in write order
     */
    public synchronized List<Opportunity> getWritten() {
        return List.copyOf(written);
    }

    public synchronized void clear() {
        written.clear();
    }
}
