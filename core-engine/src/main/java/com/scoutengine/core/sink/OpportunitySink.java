package com.scoutengine.core.sink;

import com.scoutengine.core.model.Opportunity;

import java.util.List;

/**
 * Receives the opportunities of a detection run.
 *
 * <p>
 * Implementations must accept an empty list. A write either succeeds as a
 * whole or throws {@link SinkWriteException}; callers may retry.
 * </p>
 *
 * @since 1.0.0
 */
public interface OpportunitySink {

    /**
     * @param opportunities opportunities in ranked order; must not be
     *                      {@code null}
     * @throws SinkWriteException if the write failed
     */
    void write(List<Opportunity> opportunities);
}
