package com.lexsched.lexsched_api.solver.model;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.lexsched.lexsched_api.exception.PluginEvaluationException;
import com.lexsched.lexsched_api.solver.constraint.ConstraintRegistry;
import com.lexsched.lexsched_api.solver.constraint.SchedulingConstraint;
import com.lexsched.lexsched_api.solver.domain.AssignmentSpace;

/**
 * Assembles the base model: one binary per assignment key and every registered hard constraint.
 */
public class ModelBuilder {

    private static final Logger logger = LoggerFactory.getLogger(ModelBuilder.class);

    private final int overlapBufferMinutes;

    public ModelBuilder(int overlapBufferMinutes) {
        if (overlapBufferMinutes < 0) {
            throw new IllegalArgumentException("Overlap buffer must be non-negative, got " + overlapBufferMinutes);
        }
        this.overlapBufferMinutes = overlapBufferMinutes;
    }

    public BaseModel build(AssignmentSpace space, ConstraintRegistry registry) {
        ScheduleModel model = new ScheduleModel(space.variables(), List.of());
        ModelContext context = new ModelContext(space, model, overlapBufferMinutes);
        for (SchedulingConstraint constraint : registry.getConstraints()) {
            List<LinearConstraint> rows;
            try {
                rows = constraint.generate(context);
            } catch (RuntimeException e) {
                logger.error("Constraint plugin '{}' failed while building the base model", constraint.getName(), e);
                throw new PluginEvaluationException(constraint.getName(), 0, List.of(), e);
            }
            rows.forEach(model::addConstraint);
            logger.debug("Constraint '{}' contributed {} rows", constraint.getName(), rows.size());
        }
        logger.info("Base model built: {} variables, {} constraints", model.getVariables().size(), model.constraintCount());
        return new BaseModel(space, model.getVariables(), model.getConstraints(), overlapBufferMinutes);
    }
}
