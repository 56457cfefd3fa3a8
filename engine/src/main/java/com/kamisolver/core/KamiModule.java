package com.kamisolver.core;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.kamisolver.search.SolverConfig;
import lombok.extern.slf4j.Slf4j;

/**
 * Guice module for the puzzle engine.
 *
 * <p>Engine components are {@code @Singleton} annotated on the classes themselves; this
 * module only supplies the solver configuration used when a caller does not pass one.
 */
@Slf4j
public class KamiModule extends AbstractModule {

    private final SolverConfig defaultSolverConfig;

    public KamiModule() {
        this(SolverConfig.DEFAULT);
    }

    public KamiModule(SolverConfig defaultSolverConfig) {
        if (defaultSolverConfig == null) {
            throw new IllegalArgumentException("Default solver config cannot be null");
        }
        this.defaultSolverConfig = defaultSolverConfig;
    }

    @Provides
    @Singleton
    public SolverConfig provideSolverConfig() {
        log.debug("Default solver: {} with heuristics {}", defaultSolverConfig.getStrategy(),
                defaultSolverConfig.getHeuristics());
        return defaultSolverConfig;
    }
}
