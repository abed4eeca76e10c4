package com.lexsched.lexsched_api.solver.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.ToDoubleFunction;

import com.lexsched.lexsched_api.solver.domain.AssignmentKey;
import com.lexsched.lexsched_api.solver.domain.AssignmentSpace;
import com.lexsched.lexsched_api.solver.domain.EntityCatalog;
import com.lexsched.lexsched_api.solver.domain.KeyPredicate;
import com.lexsched.lexsched_api.solver.domain.KeyPredicates;

/**
 * Everything a constraint or objective plugin may read, plus the one sanctioned way to
 * extend the model: {@link #anyOf(String, Collection)} indicator variables.
 */
public final class ModelContext {

    private final AssignmentSpace space;
    private final ScheduleModel model;
    private final int overlapBufferMinutes;

    ModelContext(AssignmentSpace space, ScheduleModel model, int overlapBufferMinutes) {
        this.space = space;
        this.model = model;
        this.overlapBufferMinutes = overlapBufferMinutes;
    }

    public EntityCatalog catalog() {
        return space.getCatalog();
    }

    public AssignmentSpace space() {
        return space;
    }

    public int overlapBufferMinutes() {
        return overlapBufferMinutes;
    }

    public List<AssignmentKey> filterKeys(KeyPredicate predicate) {
        return space.filterKeys(predicate);
    }

    public DecisionVariable variable(AssignmentKey key) {
        return space.variable(key);
    }

    /** Keys whose slot blocks {@code timeSlotId}, using the configured buffer. */
    public KeyPredicate overlapping(String timeSlotId) {
        return KeyPredicates.overlapping(catalog(), timeSlotId, overlapBufferMinutes);
    }

    public LinearExpression sum(Collection<AssignmentKey> keys) {
        LinearExpression.Builder builder = LinearExpression.builder();
        for (AssignmentKey key : keys) {
            builder.add(space.variable(key));
        }
        return builder.build();
    }

    public LinearExpression weightedSum(Collection<AssignmentKey> keys, ToDoubleFunction<AssignmentKey> weight) {
        LinearExpression.Builder builder = LinearExpression.builder();
        for (AssignmentKey key : keys) {
            builder.add(space.variable(key), weight.applyAsDouble(key));
        }
        return builder.build();
    }

    /**
     * Auxiliary binary that is 1 whenever any of {@code keys} is selected. See {@link ScheduleModel#indicator}.
     */
    public DecisionVariable anyOf(String name, Collection<AssignmentKey> keys) {
        List<DecisionVariable> sources = new ArrayList<>(keys.size());
        for (AssignmentKey key : keys) {
            sources.add(space.variable(key));
        }
        return model.indicator(name, sources);
    }
}
