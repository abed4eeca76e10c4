package com.lexsched.lexsched_api.model;

import java.util.List;

import com.lexsched.lexsched_api.solver.engine.StageResult;

import lombok.Value;

/**
 * Why a run failed. {@code stageIndex} is 0 for failures before the first solve.
 */
@Value
public class RunFailure {
    String kind;
    String message;
    int stageIndex;
    String objectiveName;
    List<StageResult> completedStages;
}
