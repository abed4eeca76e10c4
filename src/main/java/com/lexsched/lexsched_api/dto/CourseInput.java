package com.lexsched.lexsched_api.dto;

public record CourseInput(String id, String instructorId, Integer enrollment, String type,
                          String forcedRoomId, String forcedTimeSlotId) {
}
