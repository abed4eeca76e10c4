package com.lexsched.lexsched_api.solver.adapter;

import java.util.Map;

import com.lexsched.lexsched_api.solver.model.DecisionVariable;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * What a solver returns for one snapshot. Assignment and objective value are only
 * meaningful when the status is {@link SolveStatus#OPTIMAL}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SolveResult {
    SolveStatus status;
    Map<DecisionVariable, Integer> assignment;
    double objectiveValue;

    public static SolveResult optimal(Map<DecisionVariable, Integer> assignment, double objectiveValue) {
        return new SolveResult(SolveStatus.OPTIMAL, Map.copyOf(assignment), objectiveValue);
    }

    public static SolveResult infeasible() {
        return new SolveResult(SolveStatus.INFEASIBLE, Map.of(), Double.NaN);
    }

    public static SolveResult timeout() {
        return new SolveResult(SolveStatus.TIMEOUT, Map.of(), Double.NaN);
    }

    public static SolveResult unbounded() {
        return new SolveResult(SolveStatus.UNBOUNDED, Map.of(), Double.NaN);
    }

    public boolean isOptimal() {
        return status == SolveStatus.OPTIMAL;
    }
}
