package com.scoutengine.core.engine;

import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Deterministic opportunity ids: a name-based (version 3) UUID of
 * {@code entityId|ruleId|periodStart|periodEnd}. Re-running detection over the
 * same data yields the same ids.
 *
 * @since 1.0.0
 */
public final class OpportunityIds {

    private OpportunityIds() {
        // utility class - not instantiable
    }

    public static String of(String entityId, String ruleId, LocalDate periodStart, LocalDate periodEnd) {
        String name = entityId + '|' + ruleId + '|' + periodStart + '|' + periodEnd;
        return UUID.nameUUIDFromBytes(name.getBytes(StandardCharsets.UTF_8)).toString();
    }
}
