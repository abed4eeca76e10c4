package com.lexsched.lexsched_api.solver.constraint;

import java.util.ArrayList;
import java.util.List;

import com.lexsched.lexsched_api.model.Course;
import com.lexsched.lexsched_api.solver.domain.KeyPredicates;
import com.lexsched.lexsched_api.solver.model.LinearConstraint;
import com.lexsched.lexsched_api.solver.model.ModelContext;

/**
 * Every course gets exactly one (room, slot). A course with no admissible key yields
 * {@code 0 == 1}, which makes the model infeasible.
 */
public class AssignAllCourses implements SchedulingConstraint {

    @Override
    public String getName() {
        return "AssignAllCourses";
    }

    @Override
    public List<LinearConstraint> generate(ModelContext context) {
        List<LinearConstraint> rows = new ArrayList<>();
        for (Course course : context.catalog().courses()) {
            rows.add(LinearConstraint.equal("assign_once[" + course.getId() + "]",
                    context.sum(context.filterKeys(KeyPredicates.course(course.getId()))), 1));
        }
        return rows;
    }
}
