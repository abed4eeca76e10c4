package com.lexsched.lexsched_api.solver.objective;

import java.util.List;

import com.lexsched.lexsched_api.solver.domain.KeyPredicates;
import com.lexsched.lexsched_api.solver.model.LinearExpression;
import com.lexsched.lexsched_api.solver.model.ModelContext;
import com.lexsched.lexsched_api.solver.model.ObjectiveSense;

public class MaximizePreferredTimeSlots extends AbstractSchedulingObjective {

    private final List<String> timeSlotIds;

    public MaximizePreferredTimeSlots(List<String> timeSlotIds, double tolerance, ObjectiveScope scope) {
        super("MaximizePreferredTimeSlots" + timeSlotIds, ObjectiveSense.MAXIMIZE, tolerance, scope);
        this.timeSlotIds = List.copyOf(timeSlotIds);
    }

    @Override
    public LinearExpression evaluate(ModelContext context) {
        // reject unknown slot ids
        timeSlotIds.forEach(context.catalog()::timeSlot);
        return context.sum(scopedKeys(context, KeyPredicates.timeSlots(timeSlotIds)));
    }
}
