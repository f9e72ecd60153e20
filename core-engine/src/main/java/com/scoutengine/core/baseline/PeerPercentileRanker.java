package com.scoutengine.core.baseline;

import com.scoutengine.core.source.PeerValue;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ranks entities against their cohort by a metric's current value.
 *
 * <p>
 * Ranks lie in {@code [0, 1]}: the lowest value ranks 0, the highest 1. Ties
 * share the mid-rank {@code (below + 0.5 * (equal - 1)) / (n - 1)}. A cohort of
 * one ranks {@value #SINGLE_PEER_RANK}. Non-finite values are ignored.
 * </p>
 *
 * @since 1.0.0
 */
public class PeerPercentileRanker {

    static final double SINGLE_PEER_RANK = 0.5;

    /**
     * @param peers values of entities sharing one entity type; must not be
     *              {@code null}
     * @return unmodifiable map of entity id to rank
     */
    public Map<String, Double> rank(List<PeerValue> peers) {
        Objects.requireNonNull(peers, "peers must not be null");
        List<PeerValue> finite = peers.stream()
                .filter(p -> Double.isFinite(p.getValue()))
                .toList();
        int n = finite.size();
        if (n == 0) {
            return Map.of();
        }

        double[] sorted = finite.stream().mapToDouble(PeerValue::getValue).sorted().toArray();
        Map<String, Double> ranks = new LinkedHashMap<>();
        for (PeerValue peer : finite) {
            if (n == 1) {
                ranks.put(peer.getEntityId(), SINGLE_PEER_RANK);
                continue;
            }
            int below = lowerBound(sorted, peer.getValue());
            int equal = upperBound(sorted, peer.getValue()) - below;
            ranks.put(peer.getEntityId(), (below + 0.5 * (equal - 1)) / (n - 1));
        }
        return Collections.unmodifiableMap(ranks);
    }

    private static int lowerBound(double[] sorted, double v) {
        int idx = Arrays.binarySearch(sorted, v);
        if (idx < 0) {
            return -idx - 1;
        }
        while (idx > 0 && sorted[idx - 1] == v) {
            idx--;
        }
        return idx;
    }

    private static int upperBound(double[] sorted, double v) {
        int idx = lowerBound(sorted, v);
        while (idx < sorted.length && sorted[idx] == v) {
            idx++;
        }
        return idx;
    }
}
