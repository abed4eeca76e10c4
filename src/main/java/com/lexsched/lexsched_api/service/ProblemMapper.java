package com.lexsched.lexsched_api.service;

import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Component;

import com.lexsched.lexsched_api.dto.CourseInput;
import com.lexsched.lexsched_api.dto.OptimizationRequest;
import com.lexsched.lexsched_api.dto.RoomInput;
import com.lexsched.lexsched_api.dto.TimeSlotInput;
import com.lexsched.lexsched_api.model.ClockTime;
import com.lexsched.lexsched_api.model.Course;
import com.lexsched.lexsched_api.model.Room;
import com.lexsched.lexsched_api.model.TimeSlot;
import com.lexsched.lexsched_api.solver.domain.EntityCatalog;

/**
 * Turns request payloads into a validated {@link EntityCatalog}.
 */
@Component
public class ProblemMapper {

    public EntityCatalog toCatalog(OptimizationRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Request body is required.");
        }
        if (request.courses() == null || request.courses().isEmpty()) {
            throw new IllegalArgumentException("At least one course is required.");
        }
        if (request.rooms() == null || request.rooms().isEmpty()) {
            throw new IllegalArgumentException("At least one room is required.");
        }
        if (request.timeSlots() == null || request.timeSlots().isEmpty()) {
            throw new IllegalArgumentException("At least one time slot is required.");
        }

        List<Course> courses = new ArrayList<>();
        for (CourseInput input : request.courses()) {
            courses.add(Course.builder()
                    .id(input.id())
                    .instructorId(input.instructorId())
                    .enrollment(input.enrollment() == null ? 0 : input.enrollment())
                    .type(blankToNull(input.type()))
                    .forcedRoomId(blankToNull(input.forcedRoomId()))
                    .forcedTimeSlotId(blankToNull(input.forcedTimeSlotId()))
                    .build());
        }
        List<Room> rooms = new ArrayList<>();
        for (RoomInput input : request.rooms()) {
            rooms.add(Room.builder().id(input.id()).capacity(input.capacity() == null ? 0 : input.capacity()).build());
        }
        List<TimeSlot> slots = new ArrayList<>();
        for (TimeSlotInput input : request.timeSlots()) {
            slots.add(TimeSlot.builder()
                    .id(input.id())
                    .dayPattern(input.days())
                    .startTime(ClockTime.parse(input.startTime()))
                    .endTime(ClockTime.parse(input.endTime()))
                    .type(blankToNull(input.type()))
                    .build());
        }
        return EntityCatalog.load(courses, rooms, slots, request.instructors());
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
