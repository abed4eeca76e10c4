package com.lexsched.lexsched_api.model;

import java.time.LocalTime;

import lombok.Builder;
import lombok.Value;

/**
 * A recurring meeting pattern, e.g. {@code MWF 08:00-08:50}.
 * {@code type} restricts which course types may use the slot; null accepts any course.
 */
@Value
@Builder
public class TimeSlot {
    String id;
    String dayPattern;
    LocalTime startTime;
    LocalTime endTime;
    String type;

    public int getStartMinutes() {
        return startTime.getHour() * 60 + startTime.getMinute();
    }

    public int getEndMinutes() {
        return endTime.getHour() * 60 + endTime.getMinute();
    }

    @Override
    public String toString() {
        return id + " (" + dayPattern + " " + startTime + "-" + endTime + ")";
    }
}
