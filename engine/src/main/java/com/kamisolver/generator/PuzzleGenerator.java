package com.kamisolver.generator;

import com.google.common.base.Stopwatch;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.kamisolver.puzzle.MoveApplicator;
import com.kamisolver.puzzle.RegionGraph;
import com.kamisolver.puzzle.UnsolvableException;
import com.kamisolver.search.PuzzleSolver;
import com.kamisolver.search.SearchResult;
import com.kamisolver.search.SolverConfig;
import com.kamisolver.search.heuristic.HeuristicRegistry;
import com.kamisolver.signature.CanonicalSignature;
import com.kamisolver.signature.SignatureCache;
import com.kamisolver.signature.StateCanonicalizer;
import lombok.extern.slf4j.Slf4j;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Brute-force search for the puzzle needing the most moves, for a node and color count.
 *
 * <p>Every connected planar topology is combined with every coloring using exactly the
 * requested number of colors (see {@link ColoringEnumerator}) and solved. A candidate is first
 * searched only as deep as the current best; if a solution fits it cannot be a new record and
 * the candidate is dropped, otherwise it is solved to completion and recorded.
 *
 * <p>With several workers each one enumerates its own shard of topologies with its own
 * solver and caches; only the {@link BestRecordTracker} is shared. Workers prune one move
 * shallower than the best so that ties are measured and resolved by enumeration order, which
 * makes the result identical to a single-worker run.
 */
@Slf4j
@Singleton
public class PuzzleGenerator {

    private final PlanarityTester planarity;
    private final HeuristicRegistry heuristics;
    private final MoveApplicator applicator;

    @Inject
    public PuzzleGenerator(PlanarityTester planarity, HeuristicRegistry heuristics, MoveApplicator applicator) {
        this.planarity = planarity;
        this.heuristics = heuristics;
        this.applicator = applicator;
    }

    /**
     * Find the hardest puzzle with the default solver on a single worker.
     *
     * @throws IllegalArgumentException for counts outside {@code 1 <= colorCount <= nodeCount <= 8}
     */
    public HardestPuzzleRecord findHardest(int nodeCount, int colorCount) {
        return findHardest(GeneratorConfig.builder()
                .nodeCount(nodeCount)
                .colorCount(colorCount)
                .build())
                .orElseThrow(() -> new IllegalStateException(
                        "No candidate puzzles for " + nodeCount + " nodes and " + colorCount + " colors"));
    }

    /**
     * Find the hardest puzzle.
     *
     * @return the record, or empty if the enumeration produced no candidate
     */
    public Optional<HardestPuzzleRecord> findHardest(GeneratorConfig config) {
        validate(config);
        if (!config.getSolver().getHeuristics().isEmpty()
                && !heuristics.combine(config.getSolver().getHeuristics()).isAdmissible()) {
            log.warn("Generator solver uses a non-admissible heuristic; reported move counts may exceed the optimum");
        }

        BestRecordTracker tracker = new BestRecordTracker();
        Stopwatch stopwatch = Stopwatch.createStarted();
        log.info("Searching for the hardest {}-region puzzle with {} colors ({} worker(s))",
                config.getNodeCount(), config.getColorCount(), config.getWorkers());

        if (config.getWorkers() == 1) {
            new Worker(config, 0, 1, tracker, true).run();
        } else {
            runParallel(config, tracker);
        }

        Optional<HardestPuzzleRecord> best = tracker.getBest();
        log.info("Hardest {}-region puzzle with {} colors needs {} moves (searched in {})",
                config.getNodeCount(), config.getColorCount(),
                best.map(HardestPuzzleRecord::getMoveCount).orElse(-1), stopwatch);
        return best;
    }

    private void validate(GeneratorConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("Generator config cannot be null");
        }
        int n = config.getNodeCount();
        int k = config.getColorCount();
        if (n < 1 || n > TopologyEnumerator.MAX_NODES) {
            throw new IllegalArgumentException("Node count must be between 1 and " + TopologyEnumerator.MAX_NODES + ", got " + n);
        }
        if (k < 1 || k > n) {
            throw new IllegalArgumentException("Color count must be between 1 and the node count " + n + ", got " + k);
        }
        if (config.getWorkers() < 1) {
            throw new IllegalArgumentException("At least one worker is required, got " + config.getWorkers());
        }
    }

    private void runParallel(GeneratorConfig config, BestRecordTracker tracker) {
        ExecutorService executor = Executors.newFixedThreadPool(config.getWorkers(), new ThreadFactoryBuilder()
                .setNameFormat("puzzle-generator-%d")
                .setDaemon(true)
                .build());
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int shard = 0; shard < config.getWorkers(); shard++) {
                futures.add(executor.submit(new Worker(config, shard, config.getWorkers(), tracker, false)));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("Generator worker failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for generator workers", e);
        } finally {
            executor.shutdownNow();
            try {
                executor.awaitTermination(1, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Enumerates and evaluates one shard of topologies.
     */
    private class Worker implements Runnable {
        private final GeneratorConfig config;
        private final int shardIndex;
        private final int shardCount;
        private final BestRecordTracker tracker;
        private final boolean sequential;

        private long candidates;
        private long pruned;
        private long duplicates;
        private long solved;

        Worker(GeneratorConfig config, int shardIndex, int shardCount, BestRecordTracker tracker, boolean sequential) {
            this.config = config;
            this.shardIndex = shardIndex;
            this.shardCount = shardCount;
            this.tracker = tracker;
            this.sequential = sequential;
        }

        @Override
        public void run() {
            SolverConfig solverConfig = config.getSolver().toBuilder()
                    .maxDepth(SolverConfig.UNBOUNDED)
                    .maxExpansions(SolverConfig.UNBOUNDED)
                    .build();
            PuzzleSolver solver = new PuzzleSolver(solverConfig, heuristics, applicator,
                    config.isReuseSignatureCache() ? new SignatureCache() : null);
            StateCanonicalizer deduplicator = config.isDeduplicate()
                    ? new StateCanonicalizer(config.getDeduplicationMode())
                    : null;
            Set<CanonicalSignature> seen = new HashSet<>();

            TopologyEnumerator topologies = new TopologyEnumerator(config.getNodeCount(), planarity,
                    config.getStartMask(), shardIndex, shardCount);
            CandidateSequence sequence = new CandidateSequence(topologies, config.getNodeCount(), config.getColorCount());
            long lastReported = 0;

            while (sequence.hasNext()) {
                PuzzleCandidate candidate = sequence.next();
                candidates++;
                RegionGraph graph = candidate.toGraph();

                if (deduplicator != null && !seen.add(deduplicator.signature(graph))) {
                    duplicates++;
                    continue;
                }
                evaluate(candidate, graph, solver);

                if (sequence.getTopologyCount() - lastReported >= config.getProgressInterval()) {
                    lastReported = sequence.getTopologyCount();
                    log.debug("Shard {}/{}: {} topologies, mask {} of {}, best so far {} moves",
                            shardIndex + 1, shardCount, lastReported, candidate.getTopology().getMask(),
                            topologies.getTotalMasks(), tracker.getBestMoveCount());
                }
            }
            log.debug("Shard {}/{} done: {} topologies, {} candidates, {} solved, {} pruned, {} duplicates",
                    shardIndex + 1, shardCount, sequence.getTopologyCount(), candidates, solved, pruned, duplicates);
        }

        private void evaluate(PuzzleCandidate candidate, RegionGraph graph, PuzzleSolver solver) {
            if (graph.isSolved()) {
                tracker.offer(HardestPuzzleRecord.builder()
                        .candidate(candidate)
                        .puzzle(graph)
                        .moveCount(0)
                        .build());
                return;
            }

            int best = tracker.getBestMoveCount();
            int bound = sequential ? best : best - 1;
            if (bound >= 1) {
                SearchResult bounded = solver.search(graph, bound);
                if (bounded.isSolved()) {
                    pruned++;
                    return;
                }
                if (bounded.getOutcome() == SearchResult.Outcome.EXHAUSTED) {
                    throw new UnsolvableException("Search exhausted for generated puzzle " + graph);
                }
            }

            SearchResult full = solver.search(graph, SolverConfig.UNBOUNDED);
            if (!full.isSolved()) {
                throw new UnsolvableException("Search " + full.getOutcome() + " for generated puzzle " + graph);
            }
            solved++;
            tracker.offer(HardestPuzzleRecord.builder()
                    .candidate(candidate)
                    .puzzle(graph)
                    .moveCount(full.getMoveCount())
                    .solution(full.getMoves())
                    .build());
        }
    }
}
