package io.github.flameyossnowy.associative.memory.query;

/**
 * Lifecycle of a {@link QueryPlan}. A plan only moves from {@link #BUILT} to {@link #MATERIALIZED}.
 */
public enum QueryState {
    /**
     * Operations are recorded but nothing has been evaluated.
     */
    BUILT,

    /**
     * A terminal operation consumed the plan.
     */
    MATERIALIZED
}
