package com.lexsched.lexsched_api.solver.domain;

import lombok.Value;

/**
 * Ordered (course, room, time slot) triple. Only keys that pass the structural
 * feasibility filter of {@link AssignmentSpace} are ever created.
 */
@Value
public class AssignmentKey {
    String courseId;
    String roomId;
    String timeSlotId;

    @Override
    public String toString() {
        return "(" + courseId + ", " + roomId + ", " + timeSlotId + ")";
    }
}
