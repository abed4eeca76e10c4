package com.lexsched.lexsched_api.support;

import com.lexsched.lexsched_api.model.ClockTime;
import com.lexsched.lexsched_api.model.Course;
import com.lexsched.lexsched_api.model.Room;
import com.lexsched.lexsched_api.model.TimeSlot;

public final class Fixtures {

    private Fixtures() {
    }

    public static Course course(String id, String instructorId, int enrollment) {
        return Course.builder().id(id).instructorId(instructorId).enrollment(enrollment).build();
    }

    public static Course typedCourse(String id, String instructorId, int enrollment, String type) {
        return Course.builder().id(id).instructorId(instructorId).enrollment(enrollment).type(type).build();
    }

    public static Room room(String id, int capacity) {
        return Room.builder().id(id).capacity(capacity).build();
    }

    public static TimeSlot slot(String id, String days, String start, String end) {
        return TimeSlot.builder().id(id).dayPattern(days)
                .startTime(ClockTime.parse(start)).endTime(ClockTime.parse(end)).build();
    }

    public static TimeSlot typedSlot(String id, String days, String start, String end, String type) {
        return TimeSlot.builder().id(id).dayPattern(days)
                .startTime(ClockTime.parse(start)).endTime(ClockTime.parse(end)).type(type).build();
    }
}
