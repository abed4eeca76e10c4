package com.lexsched.lexsched_api.dto;

import java.util.List;

/**
 * Body of {@code POST /api/schedules/optimize}. {@code instructors} is optional; when present
 * every course must name one of them.
 */
public record OptimizationRequest(List<CourseInput> courses, List<RoomInput> rooms, List<TimeSlotInput> timeSlots,
                                  List<String> instructors, List<ObjectiveInput> objectives) {
}
