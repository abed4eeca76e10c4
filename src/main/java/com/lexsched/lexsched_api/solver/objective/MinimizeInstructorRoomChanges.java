package com.lexsched.lexsched_api.solver.objective;

import java.util.List;

import com.lexsched.lexsched_api.model.Room;
import com.lexsched.lexsched_api.solver.domain.AssignmentKey;
import com.lexsched.lexsched_api.solver.domain.KeyPredicates;
import com.lexsched.lexsched_api.solver.model.LinearExpression;
import com.lexsched.lexsched_api.solver.model.ModelContext;
import com.lexsched.lexsched_api.solver.model.ObjectiveSense;

/**
 * Sum over instructors of the number of distinct rooms they teach in. Each (instructor, room)
 * pair gets one "room used" indicator; minimizing the sum drives unused indicators to 0.
 */
public class MinimizeInstructorRoomChanges extends AbstractSchedulingObjective {

    public MinimizeInstructorRoomChanges(double tolerance, ObjectiveScope scope) {
        super("MinimizeInstructorRoomChanges", ObjectiveSense.MINIMIZE, tolerance, scope);
    }

    public MinimizeInstructorRoomChanges() {
        this(0.0, ObjectiveScope.ALL);
    }

    @Override
    public LinearExpression evaluate(ModelContext context) {
        LinearExpression.Builder builder = LinearExpression.builder();
        String suffix = getScope().getCourseType() == null ? "" : "|" + getScope().getCourseType();
        for (String instructor : context.catalog().instructors()) {
            if (getScope().getInstructorId() != null && !getScope().getInstructorId().equals(instructor)) {
                continue;
            }
            for (Room room : context.catalog().rooms()) {
                List<AssignmentKey> keys = scopedKeys(context, KeyPredicates.instructor(context.catalog(), instructor)
                        .and(KeyPredicates.room(room.getId())));
                if (!keys.isEmpty()) {
                    builder.add(context.anyOf("uses_room[" + instructor + "," + room.getId() + suffix + "]", keys));
                }
            }
        }
        return builder.build();
    }
}
