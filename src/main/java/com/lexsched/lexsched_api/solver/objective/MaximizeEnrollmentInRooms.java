package com.lexsched.lexsched_api.solver.objective;

import java.util.List;

import com.lexsched.lexsched_api.solver.domain.KeyPredicates;
import com.lexsched.lexsched_api.solver.model.LinearExpression;
import com.lexsched.lexsched_api.solver.model.ModelContext;
import com.lexsched.lexsched_api.solver.model.ObjectiveSense;

/**
 * Total enrollment seated in the given rooms, e.g. to fill the large lecture halls first.
 */
public class MaximizeEnrollmentInRooms extends AbstractSchedulingObjective {

    private final List<String> roomIds;

    public MaximizeEnrollmentInRooms(List<String> roomIds, double tolerance, ObjectiveScope scope) {
        super("MaximizeEnrollmentInRooms" + roomIds, ObjectiveSense.MAXIMIZE, tolerance, scope);
        this.roomIds = List.copyOf(roomIds);
    }

    @Override
    public LinearExpression evaluate(ModelContext context) {
        roomIds.forEach(context.catalog()::room);
        return context.weightedSum(scopedKeys(context, KeyPredicates.rooms(roomIds)),
                key -> context.catalog().enrollment(key.getCourseId()));
    }
}
