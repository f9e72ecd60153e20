package com.scoutengine.core.rule;

/**
 * Thrown when a rule's predicate or evidence extraction fails for an entity.
 * The detection engine isolates it to that single {@code (entity, rule)} pair.
 *
 * @since 1.0.0
 */
public class RuleEvaluationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String ruleId;
    private final String entityId;

    public RuleEvaluationException(String ruleId, String entityId, Throwable cause) {
        super("Rule [" + ruleId + "] failed for entity '" + entityId + "': " + cause.getMessage(), cause);
        this.ruleId = ruleId;
        this.entityId = entityId;
    }

    public String getRuleId() {
        return ruleId;
    }

    public String getEntityId() {
        return entityId;
    }
}
