package com.lexsched.lexsched_api.dto;

/**
 * Times accept {@code 8:00}, {@code 13:30} or {@code 08:00 AM}.
 */
public record TimeSlotInput(String id, String days, String startTime, String endTime, String type) {
}
