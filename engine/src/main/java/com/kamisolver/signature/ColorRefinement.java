package com.kamisolver.signature;

import com.google.common.collect.ImmutableMap;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import com.kamisolver.puzzle.RegionGraph;
import com.kamisolver.puzzle.RegionNode;
import lombok.Value;

import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;

/**
 * Iterative color refinement (1-dimensional Weisfeiler-Lehman) over a region graph.
 *
 * <p>Each region starts with a label derived from its color. Every round replaces a label
 * with the hash of (label, sorted neighbor labels). Refinement stops once a round no longer
 * splits any label class, or after as many rounds as there are regions.
 *
 * <p>The result does not depend on region ids, so isomorphic puzzles with the same colors
 * always refine to the same hash. The converse does not hold (regular graphs defeat it),
 * which is why exact signatures confirm matches with {@link IsomorphismChecker}.
 */
final class ColorRefinement {

    private static final HashFunction HASH = Hashing.murmur3_128();

    private ColorRefinement() {
    }

    @Value
    static class Result {
        /**
         * Final label of every region id.
         */
        ImmutableMap<Integer, Long> labels;

        /**
         * Hash of the label multiset, region count and edge count.
         */
        long graphHash;

        int rounds;
    }

    static Result refine(RegionGraph graph) {
        Map<Integer, Long> labels = new HashMap<>();
        for (RegionNode node : graph.getNodes()) {
            labels.put(node.getId(), HASH.newHasher()
                    .putInt(node.getColor().getIndex())
                    .hash().asLong());
        }

        int classes = distinct(labels);
        int rounds = 0;
        while (rounds < graph.size()) {
            Map<Integer, Long> next = new HashMap<>();
            for (RegionNode node : graph.getNodes()) {
                long[] around = new long[node.getDegree()];
                int i = 0;
                for (int neighbor : node.getNeighbors()) {
                    around[i++] = labels.get(neighbor);
                }
                Arrays.sort(around);
                Hasher hasher = HASH.newHasher().putLong(labels.get(node.getId()));
                for (long label : around) {
                    hasher.putLong(label);
                }
                next.put(node.getId(), hasher.hash().asLong());
            }
            rounds++;
            int nextClasses = distinct(next);
            labels = next;
            if (nextClasses == classes) {
                break;
            }
            classes = nextClasses;
        }

        long[] sorted = labels.values().stream().mapToLong(Long::longValue).sorted().toArray();
        Hasher hasher = HASH.newHasher()
                .putInt(graph.size())
                .putInt(graph.getEdgeCount())
                .putInt(rounds);
        for (long label : sorted) {
            hasher.putLong(label);
        }
        return new Result(ImmutableMap.copyOf(labels), hasher.hash().asLong(), rounds);
    }

    private static int distinct(Map<Integer, Long> labels) {
        return new HashSet<>(labels.values()).size();
    }
}
