package com.lexsched.lexsched_api.solver.objective;

import java.time.LocalTime;

import com.lexsched.lexsched_api.solver.domain.KeyPredicates;
import com.lexsched.lexsched_api.solver.model.LinearExpression;
import com.lexsched.lexsched_api.solver.model.ModelContext;
import com.lexsched.lexsched_api.solver.model.ObjectiveSense;

/**
 * Number of scheduled classes that start strictly before a threshold.
 */
public class MinimizeClassesBefore extends AbstractSchedulingObjective {

    private final LocalTime threshold;

    public MinimizeClassesBefore(LocalTime threshold, double tolerance, ObjectiveScope scope) {
        this(threshold, ObjectiveSense.MINIMIZE, tolerance, scope);
    }

    /**
     * With {@code MAXIMIZE} the same count is pushed up instead, e.g. to pack classes before the threshold.
     */
    public MinimizeClassesBefore(LocalTime threshold, ObjectiveSense sense, double tolerance, ObjectiveScope scope) {
        super((sense == ObjectiveSense.MAXIMIZE ? "MaximizeClassesBefore(" : "MinimizeClassesBefore(") + threshold + ")",
                sense, tolerance, scope);
        this.threshold = threshold;
    }

    public MinimizeClassesBefore(LocalTime threshold) {
        this(threshold, 0.0, ObjectiveScope.ALL);
    }

    @Override
    public LinearExpression evaluate(ModelContext context) {
        return context.sum(scopedKeys(context, KeyPredicates.startsBefore(context.catalog(), threshold)));
    }
}
