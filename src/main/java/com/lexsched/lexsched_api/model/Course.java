package com.lexsched.lexsched_api.model;

import lombok.Builder;
import lombok.Value;

/**
 * A course offering that must be placed exactly once.
 * Type, forced room and forced time slot are optional (null when absent).
 */
@Value
@Builder
public class Course {
    String id;
    String instructorId;
    int enrollment;
    String type;
    String forcedRoomId;
    String forcedTimeSlotId;
}
