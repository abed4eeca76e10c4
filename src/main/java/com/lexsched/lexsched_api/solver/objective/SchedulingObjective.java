package com.lexsched.lexsched_api.solver.objective;

import com.lexsched.lexsched_api.solver.model.LinearExpression;
import com.lexsched.lexsched_api.solver.model.ModelContext;
import com.lexsched.lexsched_api.solver.model.ObjectiveSense;

/**
 * A soft goal optimized in priority order. {@link #evaluate} is called once per stage and must
 * return an expression over the context's variables without keeping any state between calls.
 */
public interface SchedulingObjective {

    String getName();

    ObjectiveSense getSense();

    /** Fractional slack allowed on the achieved value once this objective is frozen. */
    double getTolerance();

    LinearExpression evaluate(ModelContext context);
}
