package com.lexsched.lexsched_api.solver.objective;

import java.util.List;

import com.lexsched.lexsched_api.solver.domain.KeyPredicates;
import com.lexsched.lexsched_api.solver.model.LinearExpression;
import com.lexsched.lexsched_api.solver.model.ModelContext;
import com.lexsched.lexsched_api.solver.model.ObjectiveSense;

public class MaximizePreferredRooms extends AbstractSchedulingObjective {

    private final List<String> roomIds;

    public MaximizePreferredRooms(List<String> roomIds, double tolerance, ObjectiveScope scope) {
        super("MaximizePreferredRooms" + roomIds, ObjectiveSense.MAXIMIZE, tolerance, scope);
        this.roomIds = List.copyOf(roomIds);
    }

    @Override
    public LinearExpression evaluate(ModelContext context) {
        roomIds.forEach(context.catalog()::room);
        return context.sum(scopedKeys(context, KeyPredicates.rooms(roomIds)));
    }
}
