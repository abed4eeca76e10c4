package com.lexsched.lexsched_api.solver.objective;

import java.util.List;

import com.lexsched.lexsched_api.solver.domain.AssignmentKey;
import com.lexsched.lexsched_api.solver.domain.KeyPredicate;
import com.lexsched.lexsched_api.solver.model.ModelContext;
import com.lexsched.lexsched_api.solver.model.ObjectiveSense;

import lombok.Getter;

@Getter
public abstract class AbstractSchedulingObjective implements SchedulingObjective {

    private final String name;
    private final ObjectiveSense sense;
    private final double tolerance;
    private final ObjectiveScope scope;

    protected AbstractSchedulingObjective(String name, ObjectiveSense sense, double tolerance, ObjectiveScope scope) {
        if (!Double.isFinite(tolerance) || tolerance < 0) {
            throw new IllegalArgumentException("Tolerance of '" + name + "' must be a non-negative number, got " + tolerance);
        }
        this.scope = scope == null ? ObjectiveScope.ALL : scope;
        this.name = this.scope.isUnrestricted() ? name : name + "[" + this.scope + "]";
        this.sense = sense;
        this.tolerance = tolerance;
    }

    /** Keys matching {@code selector} within this objective's scope. */
    protected List<AssignmentKey> scopedKeys(ModelContext context, KeyPredicate selector) {
        return context.filterKeys(scope.predicate(context.catalog()).and(selector));
    }

    @Override
    public String toString() {
        return name + " (" + sense + ", tolerance " + tolerance + ")";
    }
}
