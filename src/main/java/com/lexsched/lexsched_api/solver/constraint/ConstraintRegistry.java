package com.lexsched.lexsched_api.solver.constraint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered set of hard-constraint plugins applied when building the base model.
 */
public class ConstraintRegistry {

    private final List<SchedulingConstraint> constraints = new ArrayList<>();

    public static ConstraintRegistry defaults() {
        return new ConstraintRegistry()
                .register(new AssignAllCourses())
                .register(new NoInstructorOverlap())
                .register(new NoRoomOverlap())
                .register(new ForceRooms())
                .register(new ForceTimeSlots());
    }

    public ConstraintRegistry register(SchedulingConstraint constraint) {
        for (SchedulingConstraint existing : constraints) {
            if (existing.getName().equals(constraint.getName())) {
                throw new IllegalArgumentException("Constraint '" + constraint.getName() + "' is already registered");
            }
        }
        constraints.add(constraint);
        return this;
    }

    public List<SchedulingConstraint> getConstraints() {
        return Collections.unmodifiableList(constraints);
    }
}
