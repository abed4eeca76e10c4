package com.lexsched.lexsched_api.exception;

import java.util.List;

import com.lexsched.lexsched_api.solver.engine.StageResult;

/**
 * A lexicographic run stopped at {@code stageIndex}. Stages are 1-based; stage 0 is model construction.
 * {@code completedStages} holds every stage solved before the failure, in order.
 */
public abstract class OptimizationFailureException extends SchedulingException {

    private final int stageIndex;
    private final String objectiveName;
    private final List<StageResult> completedStages;

    protected OptimizationFailureException(String message, int stageIndex, String objectiveName,
                                           List<StageResult> completedStages, Throwable cause) {
        super(message, cause);
        this.stageIndex = stageIndex;
        this.objectiveName = objectiveName;
        this.completedStages = List.copyOf(completedStages);
    }

    public int getStageIndex() {
        return stageIndex;
    }

    public String getObjectiveName() {
        return objectiveName;
    }

    public List<StageResult> getCompletedStages() {
        return completedStages;
    }

    /** Short machine-readable kind, used in API error bodies. */
    public abstract String getKind();
}
