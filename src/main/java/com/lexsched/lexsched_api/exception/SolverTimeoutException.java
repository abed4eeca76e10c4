package com.lexsched.lexsched_api.exception;

import java.util.List;

import com.lexsched.lexsched_api.solver.engine.StageResult;

public class SolverTimeoutException extends OptimizationFailureException {

    public SolverTimeoutException(int stageIndex, String objectiveName, List<StageResult> completedStages) {
        super(String.format("Solver exhausted its time budget at stage %d ('%s') before proving optimality.",
                stageIndex, objectiveName), stageIndex, objectiveName, completedStages, null);
    }

    @Override
    public String getKind() {
        return "SOLVER_TIMEOUT";
    }
}
