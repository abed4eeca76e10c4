package com.lexsched.lexsched_api.solver.constraint;

import java.util.ArrayList;
import java.util.List;

import com.lexsched.lexsched_api.model.Course;
import com.lexsched.lexsched_api.solver.domain.KeyPredicates;
import com.lexsched.lexsched_api.solver.model.LinearConstraint;
import com.lexsched.lexsched_api.solver.model.ModelContext;

/**
 * Pins courses that name a forced room to that room. If the room cannot host the course the
 * row has no terms and the model is infeasible.
 */
public class ForceRooms implements SchedulingConstraint {

    @Override
    public String getName() {
        return "ForceRooms";
    }

    @Override
    public List<LinearConstraint> generate(ModelContext context) {
        List<LinearConstraint> rows = new ArrayList<>();
        for (Course course : context.catalog().courses()) {
            if (course.getForcedRoomId() == null) {
                continue;
            }
            rows.add(LinearConstraint.equal("force_room[" + course.getId() + "," + course.getForcedRoomId() + "]",
                    context.sum(context.filterKeys(KeyPredicates.course(course.getId())
                            .and(KeyPredicates.room(course.getForcedRoomId())))), 1));
        }
        return rows;
    }
}
