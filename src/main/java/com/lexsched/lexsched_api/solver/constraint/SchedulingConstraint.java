package com.lexsched.lexsched_api.solver.constraint;

import java.util.List;

import com.lexsched.lexsched_api.solver.model.LinearConstraint;
import com.lexsched.lexsched_api.solver.model.ModelContext;

/**
 * A hard rule contributed to the base model. Implementations are stateless and read the
 * catalog and key space only through the {@link ModelContext}.
 */
public interface SchedulingConstraint {

    String getName();

    List<LinearConstraint> generate(ModelContext context);
}
