package com.lexsched.lexsched_api.exception;

import java.util.List;

import com.lexsched.lexsched_api.solver.engine.StageResult;

public class UnboundedObjectiveException extends OptimizationFailureException {

    public UnboundedObjectiveException(int stageIndex, String objectiveName, List<StageResult> completedStages) {
        super(String.format("Objective '%s' at stage %d is unbounded.", objectiveName, stageIndex),
                stageIndex, objectiveName, completedStages, null);
    }

    @Override
    public String getKind() {
        return "UNBOUNDED_OBJECTIVE";
    }
}
