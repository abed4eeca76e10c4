package com.lexsched.lexsched_api.solver.constraint;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.lexsched.lexsched_api.model.TimeSlot;
import com.lexsched.lexsched_api.solver.domain.AssignmentKey;
import com.lexsched.lexsched_api.solver.domain.AssignmentSpace;
import com.lexsched.lexsched_api.solver.domain.KeyPredicate;
import com.lexsched.lexsched_api.solver.model.LinearConstraint;
import com.lexsched.lexsched_api.solver.model.ModelContext;

/**
 * At most one selected key per resource among the keys that block each time slot.
 * Subclasses name the resources and how keys are grouped by resource.
 */
abstract class OverlapConstraint implements SchedulingConstraint {

    protected abstract String rowPrefix();

    protected abstract Iterable<String> resources(ModelContext context);

    protected abstract KeyPredicate ofResource(ModelContext context, String resourceId);

    @Override
    public List<LinearConstraint> generate(ModelContext context) {
        List<LinearConstraint> rows = new ArrayList<>();
        for (String resource : resources(context)) {
            List<AssignmentKey> group = context.filterKeys(ofResource(context, resource));
            if (group.size() < 2) {
                continue;
            }
            Set<List<AssignmentKey>> seen = new LinkedHashSet<>();
            for (TimeSlot slot : context.catalog().timeSlots()) {
                List<AssignmentKey> blocking = AssignmentSpace.filter(group, context.overlapping(slot.getId()));
                if (blocking.size() < 2 || !seen.add(blocking)) {
                    continue;
                }
                rows.add(LinearConstraint.lessOrEqual(
                        rowPrefix() + "[" + resource + "," + slot.getId() + "]", context.sum(blocking), 1));
            }
        }
        return rows;
    }
}
