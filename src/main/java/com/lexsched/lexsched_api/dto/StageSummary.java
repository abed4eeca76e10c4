package com.lexsched.lexsched_api.dto;

import com.lexsched.lexsched_api.solver.engine.StageResult;

public record StageSummary(int stage, String objective, String sense, double achievedValue, double tolerance,
                           String frozenConstraint, int constraintCount) {

    public static StageSummary from(StageResult stage) {
        String frozen = stage.isFrozen()
                ? stage.getFrozenBound().getRelation().getSymbol() + " " + stage.getFrozenBound().getBound()
                : null;
        return new StageSummary(stage.getIndex(), stage.getObjectiveName(), stage.getSense().name(),
                stage.getAchievedValue(), stage.getTolerance(), frozen, stage.getInputConstraintCount());
    }
}
