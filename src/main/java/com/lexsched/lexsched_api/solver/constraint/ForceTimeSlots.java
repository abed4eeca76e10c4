package com.lexsched.lexsched_api.solver.constraint;

import java.util.ArrayList;
import java.util.List;

import com.lexsched.lexsched_api.model.Course;
import com.lexsched.lexsched_api.solver.domain.KeyPredicates;
import com.lexsched.lexsched_api.solver.model.LinearConstraint;
import com.lexsched.lexsched_api.solver.model.ModelContext;

public class ForceTimeSlots implements SchedulingConstraint {

    @Override
    public String getName() {
        return "ForceTimeSlots";
    }

    @Override
    public List<LinearConstraint> generate(ModelContext context) {
        List<LinearConstraint> rows = new ArrayList<>();
        for (Course course : context.catalog().courses()) {
            String slotId = course.getForcedTimeSlotId();
            if (slotId == null) {
                continue;
            }
            rows.add(LinearConstraint.equal("force_slot[" + course.getId() + "," + slotId + "]",
                    context.sum(context.filterKeys(KeyPredicates.course(course.getId())
                            .and(KeyPredicates.timeSlot(slotId)))), 1));
        }
        return rows;
    }
}
