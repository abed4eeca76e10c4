package com.lexsched.lexsched_api.solver.domain;

import java.util.Objects;

/**
 * Boolean test over a (course, room, time slot) triple, used to scope constraints and objectives.
 */
@FunctionalInterface
public interface KeyPredicate {

    boolean test(String courseId, String roomId, String timeSlotId);

    default boolean test(AssignmentKey key) {
        return test(key.getCourseId(), key.getRoomId(), key.getTimeSlotId());
    }

    default KeyPredicate and(KeyPredicate other) {
        Objects.requireNonNull(other);
        return (c, r, t) -> test(c, r, t) && other.test(c, r, t);
    }

    default KeyPredicate or(KeyPredicate other) {
        Objects.requireNonNull(other);
        return (c, r, t) -> test(c, r, t) || other.test(c, r, t);
    }

    default KeyPredicate negate() {
        return (c, r, t) -> !test(c, r, t);
    }
}
