package com.lexsched.lexsched_api.solver.engine;

import com.lexsched.lexsched_api.solver.model.Relation;

import lombok.Value;

/**
 * Bound appended after a stage: {@code expr(objective) relation bound}.
 */
@Value
public class FrozenBound {
    int stageIndex;
    String objectiveName;
    Relation relation;
    double bound;
    double achievedValue;
    double tolerance;

    @Override
    public String toString() {
        return String.format("stage %d '%s' %s %s (achieved %s, tolerance %s)",
                stageIndex, objectiveName, relation.getSymbol(), bound, achievedValue, tolerance);
    }
}
