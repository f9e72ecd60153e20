package com.scoutengine.core.engine;

import com.scoutengine.core.model.EntityRef;
import com.scoutengine.core.model.PeriodRange;
import com.scoutengine.core.rule.Rule;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * Input of one detection run: which entities to scan, with which rules, over
 * which period.
 *
 * @since 1.0.0
 */
public final class DetectionRequest {

    private final List<EntityRef> entities;
    private final List<Rule> rules;
    private final PeriodRange period;
    private final String organizationId;

    private DetectionRequest(Builder b) {
        this.entities = List.copyOf(new LinkedHashSet<>(b.entities));
        this.rules = List.copyOf(b.rules);
        this.period = Objects.requireNonNull(b.period, "period must not be null");
        this.organizationId = b.organizationId;
    }

    /** @return requested entities, duplicates removed, in request order */
    public List<EntityRef> getEntities() {
        return entities;
    }

    public List<Rule> getRules() {
        return rules;
    }

    /** @return the range of periods whose observations are read */
    public PeriodRange getPeriod() {
        return period;
    }

    /** @return owning organization, copied onto every opportunity; may be {@code null} */
    public String getOrganizationId() {
        return organizationId;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final List<EntityRef> entities = new ArrayList<>();
        private final List<Rule> rules = new ArrayList<>();
        private PeriodRange period;
        private String organizationId;

        public Builder entity(EntityRef entity) {
            this.entities.add(Objects.requireNonNull(entity, "entity must not be null"));
            return this;
        }

        public Builder entities(List<EntityRef> entities) {
            entities.forEach(this::entity);
            return this;
        }

        public Builder rule(Rule rule) {
            this.rules.add(Objects.requireNonNull(rule, "rule must not be null"));
            return this;
        }

        public Builder rules(List<Rule> rules) {
            rules.forEach(this::rule);
            return this;
        }

        public Builder period(PeriodRange period) {
            this.period = period;
            return this;
        }

        public Builder organizationId(String organizationId) {
            this.organizationId = organizationId;
            return this;
        }

        public DetectionRequest build() {
            return new DetectionRequest(this);
        }
    }

    @Override
    public String toString() {
        return "DetectionRequest{" +
                "entities=" + entities.size() +
                ", rules=" + rules.size() +
                ", period=" + period +
                ", organizationId='" + organizationId + '\'' +
                '}';
    }
}
