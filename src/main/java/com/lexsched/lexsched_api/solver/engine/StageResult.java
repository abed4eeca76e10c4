package com.lexsched.lexsched_api.solver.engine;

import com.lexsched.lexsched_api.solver.model.ModelSnapshot;
import com.lexsched.lexsched_api.solver.model.ObjectiveSense;

import lombok.ToString;
import lombok.Value;

/**
 * Outcome of one solved stage. {@code frozenBound} is null for the last stage and for
 * feasibility-only runs; {@code input} is the exact model the solver saw.
 */
@Value
public class StageResult {
    int index;
    String objectiveName;
    ObjectiveSense sense;
    double achievedValue;
    double tolerance;
    FrozenBound frozenBound;
    @ToString.Exclude
    ModelSnapshot input;

    public int getInputConstraintCount() {
        return input.getConstraints().size();
    }

    public boolean isFrozen() {
        return frozenBound != null;
    }
}
