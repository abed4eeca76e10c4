package com.lexsched.lexsched_api.solver.model;

import java.util.List;

import com.lexsched.lexsched_api.solver.domain.AssignmentSpace;
import com.lexsched.lexsched_api.solver.domain.EntityCatalog;

import lombok.Getter;

/**
 * Variables plus hard constraints, built once and shared by every optimization run.
 * Runs never touch this object; they work on {@link #newWorkingModel()} copies.
 */
@Getter
public final class BaseModel {

    private final AssignmentSpace space;
    private final List<DecisionVariable> variables;
    private final List<LinearConstraint> constraints;
    private final int overlapBufferMinutes;

    BaseModel(AssignmentSpace space, List<DecisionVariable> variables, List<LinearConstraint> constraints,
              int overlapBufferMinutes) {
        this.space = space;
        this.variables = List.copyOf(variables);
        this.constraints = List.copyOf(constraints);
        this.overlapBufferMinutes = overlapBufferMinutes;
    }

    public EntityCatalog getCatalog() {
        return space.getCatalog();
    }

    public ScheduleModel newWorkingModel() {
        return new ScheduleModel(variables, constraints);
    }

    public ModelContext newContext(ScheduleModel workingModel) {
        return new ModelContext(space, workingModel, overlapBufferMinutes);
    }
}
