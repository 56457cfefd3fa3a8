package com.kamisolver.signature;

import com.google.common.collect.ImmutableMap;
import com.kamisolver.puzzle.RegionGraph;
import lombok.Value;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Registry of isomorphism-class representatives, bucketed by refinement hash.
 *
 * <p>Exact signatures are {@code (hash, index of representative in its bucket)}. The first
 * state with a given hash becomes representative 0; a later state with the same hash is
 * compared against each representative and either matches one or is appended as a new one.
 *
 * <p>Entries are never evicted or invalidated, so a cache may be reused across solver runs
 * and signatures stay comparable between them. Not thread-safe: give each concurrent worker
 * its own cache.
 */
public class SignatureCache {

    @Value
    private static class Representative {
        RegionGraph graph;
        ImmutableMap<Integer, Long> labels;
    }

    private final Map<Long, List<Representative>> buckets = new HashMap<>();
    private int representativeCount;
    private long isomorphismChecks;

    /**
     * Find the representative index for a refined graph, registering it if new.
     */
    int resolve(RegionGraph graph, ColorRefinement.Result refinement) {
        List<Representative> bucket = buckets.computeIfAbsent(refinement.getGraphHash(), k -> new ArrayList<>(1));
        for (int i = 0; i < bucket.size(); i++) {
            Representative candidate = bucket.get(i);
            isomorphismChecks++;
            if (IsomorphismChecker.areIsomorphic(graph, refinement.getLabels(),
                    candidate.getGraph(), candidate.getLabels())) {
                return i;
            }
        }
        bucket.add(new Representative(graph, refinement.getLabels()));
        representativeCount++;
        return bucket.size() - 1;
    }

    /**
     * Number of distinct refinement hashes seen.
     */
    public int getBucketCount() {
        return buckets.size();
    }

    /**
     * Number of distinct isomorphism classes seen.
     */
    public int getRepresentativeCount() {
        return representativeCount;
    }

    /**
     * Buckets holding more than one class, i.e. refinement hash collisions.
     */
    public int getCollidingBucketCount() {
        int colliding = 0;
        for (List<Representative> bucket : buckets.values()) {
            if (bucket.size() > 1) {
                colliding++;
            }
        }
        return colliding;
    }

    public long getIsomorphismChecks() {
        return isomorphismChecks;
    }
}
