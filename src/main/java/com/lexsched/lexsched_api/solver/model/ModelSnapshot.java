package com.lexsched.lexsched_api.solver.model;

import java.util.List;

import lombok.Value;

/**
 * Frozen copy of a model at the moment it was handed to the solver.
 * {@code objective} is null for a pure feasibility solve.
 */
@Value
public class ModelSnapshot {
    List<DecisionVariable> variables;
    List<LinearConstraint> constraints;
    LinearExpression objective;
    ObjectiveSense sense;

    public boolean hasObjective() {
        return objective != null;
    }

    public long countConstraints(ConstraintOrigin origin) {
        return constraints.stream().filter(c -> c.getOrigin() == origin).count();
    }
}
