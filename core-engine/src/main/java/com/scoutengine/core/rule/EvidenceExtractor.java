package com.scoutengine.core.rule;

import java.util.Map;

/**
 * Contributes rule-specific entries to an opportunity's evidence map, on top
 * of the standard entries the {@link RuleEvaluator} always records.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface EvidenceExtractor {

    EvidenceExtractor NONE = ctx -> Map.of();

    Map<String, Object> extract(EvaluationContext context);
}
