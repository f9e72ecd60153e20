/**
 * Compiled rules and their evaluation.
 *
 * <p>
 * {@link com.scoutengine.core.rule.RuleFactory} compiles YAML
 * {@link com.scoutengine.core.model.DetectionRule}s into immutable
 * {@link com.scoutengine.core.rule.Rule}s; {@link com.scoutengine.core.rule.RuleEvaluator}
 * decides, per entity, whether a rule fires and collects the evidence.
 * </p>
 *
 * @since 1.0.0
 */
package com.scoutengine.core.rule;
