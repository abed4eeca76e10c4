package com.lexsched.lexsched_api.solver.engine;

import com.lexsched.lexsched_api.solver.model.ObjectiveSense;

/**
 * Relaxed bound for a frozen objective. The slack is {@code tolerance * |value|}, so the
 * bound is always on the permissive side of the optimum, including for negative optima.
 */
public final class ToleranceBounds {

    private ToleranceBounds() {
    }

    public static double bound(ObjectiveSense sense, double value, double tolerance) {
        if (tolerance < 0) {
            throw new IllegalArgumentException("Tolerance must be non-negative, got " + tolerance);
        }
        double slack = tolerance * Math.abs(value);
        return sense == ObjectiveSense.MINIMIZE ? value + slack : value - slack;
    }
}
