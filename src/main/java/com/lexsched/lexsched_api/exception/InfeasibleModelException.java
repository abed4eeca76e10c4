package com.lexsched.lexsched_api.exception;

import java.util.List;

/**
 * The hard constraints alone admit no schedule. Always raised at the first solve.
 */
public class InfeasibleModelException extends OptimizationFailureException {

    public InfeasibleModelException(String objectiveName) {
        super("No schedule satisfies the hard constraints (stage 1"
                + (objectiveName != null ? ", objective '" + objectiveName + "'" : "") + ").",
                1, objectiveName, List.of(), null);
    }

    @Override
    public String getKind() {
        return "INFEASIBLE_MODEL";
    }
}
