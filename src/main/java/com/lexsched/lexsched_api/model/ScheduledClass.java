package com.lexsched.lexsched_api.model;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.Set;

import lombok.Builder;
import lombok.Value;

/**
 * One row of a solved schedule: a course with its room, meeting days and times.
 */
@Value
@Builder
public class ScheduledClass {
    String courseId;
    String courseType;
    String instructorId;
    int enrollment;
    String roomId;
    int roomCapacity;
    String timeSlotId;
    String dayPattern;
    Set<DayOfWeek> days;
    LocalTime startTime;
    LocalTime endTime;

    public DayOfWeek firstDay() {
        return days.stream().min(DayOfWeek::compareTo).orElse(DayOfWeek.MONDAY);
    }
}
