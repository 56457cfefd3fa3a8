package com.kamisolver.signature;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import com.kamisolver.puzzle.RegionGraph;
import com.kamisolver.puzzle.RegionNode;
import lombok.Getter;

import java.util.Arrays;
import java.util.Objects;

/**
 * Computes deduplication signatures for puzzle states.
 *
 * <p>Both modes are deterministic and never modify the graph:
 * <ul>
 *   <li>{@link SignatureMode#EXACT}: color refinement to a fixed point, resolved against the
 *       {@link SignatureCache} with an isomorphism check</li>
 *   <li>{@link SignatureMode#FUZZY}: a single histogram pass, cheaper but collision-prone</li>
 * </ul>
 *
 * <p>Exact signatures are only comparable between states resolved through the same cache.
 */
public class StateCanonicalizer {

    private static final HashFunction HASH = Hashing.murmur3_128();

    @Getter
    private final SignatureMode mode;

    @Getter
    private final SignatureCache cache;

    public StateCanonicalizer(SignatureMode mode) {
        this(mode, new SignatureCache());
    }

    public StateCanonicalizer(SignatureMode mode, SignatureCache cache) {
        this.mode = Objects.requireNonNull(mode, "mode");
        this.cache = Objects.requireNonNull(cache, "cache");
    }

    public CanonicalSignature signature(RegionGraph graph) {
        if (mode == SignatureMode.FUZZY) {
            return new CanonicalSignature(SignatureMode.FUZZY, fuzzyHash(graph), 0);
        }
        ColorRefinement.Result refinement = ColorRefinement.refine(graph);
        int variant = cache.resolve(graph, refinement);
        return new CanonicalSignature(SignatureMode.EXACT, refinement.getGraphHash(), variant);
    }

    /**
     * Refinement hash alone, without the isomorphism check. Isomorphic puzzles always share
     * it; it is what exact signatures are bucketed by.
     */
    public long refinementHash(RegionGraph graph) {
        return ColorRefinement.refine(graph).getGraphHash();
    }

    private static long fuzzyHash(RegionGraph graph) {
        long[] profiles = new long[graph.size()];
        int i = 0;
        for (RegionNode node : graph.getNodes()) {
            int[] around = new int[node.getDegree()];
            int j = 0;
            for (int neighbor : node.getNeighbors()) {
                around[j++] = graph.getColor(neighbor).getIndex();
            }
            Arrays.sort(around);
            Hasher hasher = HASH.newHasher()
                    .putInt(node.getColor().getIndex())
                    .putInt(around.length);
            for (int color : around) {
                hasher.putInt(color);
            }
            profiles[i++] = hasher.hash().asLong();
        }
        Arrays.sort(profiles);

        Hasher hasher = HASH.newHasher().putInt(profiles.length);
        for (long profile : profiles) {
            hasher.putLong(profile);
        }
        return hasher.hash().asLong();
    }
}
