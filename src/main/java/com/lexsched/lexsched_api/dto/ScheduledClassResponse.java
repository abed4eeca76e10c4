package com.lexsched.lexsched_api.dto;

import com.lexsched.lexsched_api.model.ClockTime;
import com.lexsched.lexsched_api.model.ScheduledClass;

public record ScheduledClassResponse(String courseId, String instructorId, int enrollment, String roomId,
                                     String timeSlotId, String days, String startTime, String endTime) {

    public static ScheduledClassResponse from(ScheduledClass row) {
        return new ScheduledClassResponse(row.getCourseId(), row.getInstructorId(), row.getEnrollment(),
                row.getRoomId(), row.getTimeSlotId(), row.getDayPattern(),
                ClockTime.DISPLAY.format(row.getStartTime()), ClockTime.DISPLAY.format(row.getEndTime()));
    }
}
