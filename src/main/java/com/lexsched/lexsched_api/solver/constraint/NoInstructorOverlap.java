package com.lexsched.lexsched_api.solver.constraint;

import com.lexsched.lexsched_api.solver.domain.KeyPredicate;
import com.lexsched.lexsched_api.solver.domain.KeyPredicates;
import com.lexsched.lexsched_api.solver.model.ModelContext;

public class NoInstructorOverlap extends OverlapConstraint {

    @Override
    public String getName() {
        return "NoInstructorOverlap";
    }

    @Override
    protected String rowPrefix() {
        return "instructor_overlap";
    }

    @Override
    protected Iterable<String> resources(ModelContext context) {
        return context.catalog().instructors();
    }

    @Override
    protected KeyPredicate ofResource(ModelContext context, String instructorId) {
        return KeyPredicates.instructor(context.catalog(), instructorId);
    }
}
