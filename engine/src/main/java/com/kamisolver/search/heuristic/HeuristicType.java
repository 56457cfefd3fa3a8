package com.kamisolver.search.heuristic;

/**
 * Lower-bound estimators available to best-first search.
 */
public enum HeuristicType {

    /**
     * Distinct colors still present, minus one. A move removes at most one color class,
     * so this never overestimates.
     */
    COLOR_COUNT("Color count", true),

    /**
     * Live edges divided by the largest edge reduction any single move achieves now.
     * Later moves can remove more edges than the best move available today, so this may
     * overestimate and cost search its minimality guarantee.
     */
    MAX_EDGE_REDUCTION("Max edge reduction", false);

    private final String displayName;
    private final boolean admissible;

    HeuristicType(String displayName, boolean admissible) {
        this.displayName = displayName;
        this.admissible = admissible;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Whether the estimator is known never to overestimate the remaining move count.
     */
    public boolean isAdmissible() {
        return admissible;
    }
}
