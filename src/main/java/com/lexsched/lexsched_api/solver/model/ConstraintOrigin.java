package com.lexsched.lexsched_api.solver.model;

/**
 * Where a constraint in the model's log came from.
 */
public enum ConstraintOrigin {
    /** Hard constraint contributed by a constraint plugin at build time. */
    BASE,
    /** Linking row for an auxiliary variable requested by an objective. */
    AUXILIARY,
    /** Achieved value of an earlier lexicographic stage, relaxed by its tolerance. */
    FROZEN
}
