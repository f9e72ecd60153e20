package com.scoutengine.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One declarative condition of a {@link DetectionRule}, as written in YAML.
 *
 * <pre>
 * conditions:
 *   - subject: deviation
 *     operator: lt
 *     value: -0.20
 *   - subject: trend
 *     patterns: [declining, accelerating_decline]
 *   - subject: current
 *     metric: conversions
 *     operator: eq
 *     value: 0
 * </pre>
 *
 * <p>
 * {@code metric} defaults to the rule's primary metric.
 * </p>
 *
 * @since 1.0.0
 */
public class ConditionSpec implements Serializable {

    private static final long serialVersionUID = 1L;

    private String subject;
    private String metric;
    private String operator;
    private double value;
    private List<String> patterns = new ArrayList<>();

    /**
     * Collect validation errors for this condition.
     *
     * @param ruleId      owning rule id, used in messages
     * @param ruleMetrics metrics the owning rule declares
     * @return list of error messages, empty if valid
     */
    public List<String> validate(String ruleId, List<String> ruleMetrics) {
        List<String> errors = new ArrayList<>();
        ConditionSubject parsedSubject = null;
        try {
            parsedSubject = ConditionSubject.fromConfig(subject);
        } catch (IllegalArgumentException e) {
            errors.add("Rule '" + ruleId + "' has a condition with unknown subject '" + subject + "'");
        }

        if (metric != null && ruleMetrics != null && !ruleMetrics.contains(metric)) {
            errors.add("Rule '" + ruleId + "' condition references undeclared metric '" + metric + "'");
        }

        if (parsedSubject == ConditionSubject.TREND) {
            if (patterns == null || patterns.isEmpty()) {
                errors.add("Rule '" + ruleId + "' trend condition requires 'patterns'");
            } else {
                for (String p : patterns) {
                    try {
                        TrendPattern.fromConfig(p);
                    } catch (IllegalArgumentException e) {
                        errors.add("Rule '" + ruleId + "' has unknown trend pattern '" + p + "'");
                    }
                }
            }
        } else if (parsedSubject != null) {
            try {
                ComparisonOperator.fromConfig(operator);
            } catch (IllegalArgumentException e) {
                errors.add("Rule '" + ruleId + "' condition on " + subject
                        + " has invalid operator '" + operator + "'");
            }
            if (!Double.isFinite(value)) {
                errors.add("Rule '" + ruleId + "' condition on " + subject + " requires a finite 'value'");
            }
        }
        return errors;
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getSubject() {
        return subject;
    }

    public void setSubject(String subject) {
        this.subject = subject;
    }

    public String getMetric() {
        return metric;
    }

    public void setMetric(String metric) {
        this.metric = metric;
    }

    public String getOperator() {
        return operator;
    }

    public void setOperator(String operator) {
        this.operator = operator;
    }

    public double getValue() {
        return value;
    }

    public void setValue(double value) {
        this.value = value;
    }

    public List<String> getPatterns() {
        return patterns;
    }

    public void setPatterns(List<String> patterns) {
        this.patterns = patterns != null ? new ArrayList<>(patterns) : new ArrayList<>();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ConditionSpec that))
            return false;
        return Double.compare(value, that.value) == 0
                && Objects.equals(subject, that.subject)
                && Objects.equals(metric, that.metric)
                && Objects.equals(operator, that.operator)
                && Objects.equals(patterns, that.patterns);
    }

    @Override
    public int hashCode() {
        return Objects.hash(subject, metric, operator, value, patterns);
    }

    @Override
    public String toString() {
        return "ConditionSpec{" +
                "subject='" + subject + '\'' +
                ", metric='" + metric + '\'' +
                ", operator='" + operator + '\'' +
                ", value=" + value +
                ", patterns=" + patterns +
                '}';
    }
}
