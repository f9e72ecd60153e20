package com.scoutengine.core.engine;

import com.scoutengine.core.model.Opportunity;

import java.util.List;

/**
 * Outcome of a detection run: the ranked opportunities and counters.
 *
 * <p>
 * {@code evaluatedCount} is the number of (entity, rule) pairs considered.
 * Each of them either fired, declined (undefined baseline or no current
 * value), was skipped (malformed series or evaluation error) or did not match.
 * {@code suppressedCount} is the number of firings dropped by deduplication.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectionResult {

    private final List<Opportunity> opportunities;
    private final int evaluatedCount;
    private final int firedCount;
    private final int declinedCount;
    private final int skippedCount;
    private final int suppressedCount;
    private final boolean cancelled;

    DetectionResult(List<Opportunity> opportunities, int evaluatedCount, int firedCount, int declinedCount,
                    int skippedCount, int suppressedCount, boolean cancelled) {
        this.opportunities = List.copyOf(opportunities);
        this.evaluatedCount = evaluatedCount;
        this.firedCount = firedCount;
        this.declinedCount = declinedCount;
        this.skippedCount = skippedCount;
        this.suppressedCount = suppressedCount;
        this.cancelled = cancelled;
    }

    /** @return opportunities ordered by priority, urgency and impact, highest first */
    public List<Opportunity> getOpportunities() {
        return opportunities;
    }

    public int getEvaluatedCount() {
        return evaluatedCount;
    }

    public int getFiredCount() {
        return firedCount;
    }

    public int getDeclinedCount() {
        return declinedCount;
    }

    public int getSkippedCount() {
        return skippedCount;
    }

    public int getSuppressedCount() {
        return suppressedCount;
    }

    /** @return {@code true} if the run stopped early; opportunities cover completed batches only */
    public boolean isCancelled() {
        return cancelled;
    }

    @Override
    public String toString() {
        return "DetectionResult{" +
                "opportunities=" + opportunities.size() +
                ", evaluated=" + evaluatedCount +
                ", fired=" + firedCount +
                ", declined=" + declinedCount +
                ", skipped=" + skippedCount +
                ", suppressed=" + suppressedCount +
                ", cancelled=" + cancelled +
                '}';
    }
}
