package com.lexsched.lexsched_api.solver.objective;

import java.time.LocalTime;

import com.lexsched.lexsched_api.solver.domain.KeyPredicates;
import com.lexsched.lexsched_api.solver.model.LinearExpression;
import com.lexsched.lexsched_api.solver.model.ModelContext;
import com.lexsched.lexsched_api.solver.model.ObjectiveSense;

public class MinimizeClassesAfter extends AbstractSchedulingObjective {

    private final LocalTime threshold;

    public MinimizeClassesAfter(LocalTime threshold, double tolerance, ObjectiveScope scope) {
        this(threshold, ObjectiveSense.MINIMIZE, tolerance, scope);
    }

    /**
     * With {@code MAXIMIZE} the same count is pushed up instead, e.g. to pack classes after the threshold.
     */
    public MinimizeClassesAfter(LocalTime threshold, ObjectiveSense sense, double tolerance, ObjectiveScope scope) {
        super((sense == ObjectiveSense.MAXIMIZE ? "MaximizeClassesAfter(" : "MinimizeClassesAfter(") + threshold + ")",
                sense, tolerance, scope);
        this.threshold = threshold;
    }

    public MinimizeClassesAfter(LocalTime threshold) {
        this(threshold, 0.0, ObjectiveScope.ALL);
    }

    @Override
    public LinearExpression evaluate(ModelContext context) {
        return context.sum(scopedKeys(context, KeyPredicates.startsAfter(context.catalog(), threshold)));
    }
}
