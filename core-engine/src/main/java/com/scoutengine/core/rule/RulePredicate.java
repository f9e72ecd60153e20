package com.scoutengine.core.rule;

/**
 * Pure boolean test over an {@link EvaluationContext}.
 *
 * <p>
 * Implementations must not divide by baseline values directly; use
 * {@link MetricContext#deviation()} and {@link MetricContext#zScore()}, which
 * are undefined rather than infinite on a zero baseline.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface RulePredicate {

    boolean test(EvaluationContext context);

    default RulePredicate and(RulePredicate other) {
        return ctx -> test(ctx) && other.test(ctx);
    }
}
