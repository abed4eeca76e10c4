package com.lexsched.lexsched_api.exception;

import java.util.List;

import com.lexsched.lexsched_api.solver.engine.FrozenBound;
import com.lexsched.lexsched_api.solver.engine.StageResult;

/**
 * A later stage became infeasible once earlier objectives were frozen.
 * {@link #getFrozenBound()} is the bound added just before the failing stage.
 */
public class StagedInfeasibilityException extends OptimizationFailureException {

    private final FrozenBound frozenBound;

    public StagedInfeasibilityException(int stageIndex, String objectiveName, FrozenBound frozenBound,
                                        List<StageResult> completedStages) {
        super(String.format("Stage %d ('%s') is infeasible under the bounds frozen by earlier stages; last frozen: %s",
                stageIndex, objectiveName, frozenBound), stageIndex, objectiveName, completedStages, null);
        this.frozenBound = frozenBound;
    }

    public FrozenBound getFrozenBound() {
        return frozenBound;
    }

    @Override
    public String getKind() {
        return "STAGED_INFEASIBILITY";
    }
}
