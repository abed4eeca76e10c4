package com.lexsched.lexsched_api.dto;

import java.util.List;

/**
 * One objective in priority order. {@code type} names a built-in objective; {@code time},
 * {@code rooms} and {@code timeSlots} are read only by the types that need them. {@code sense}
 * optionally flips the direction of the class-time objectives.
 */
public record ObjectiveInput(String type, Double tolerance, String time, List<String> rooms,
                             List<String> timeSlots, String instructorId, String courseType, String sense) {
}
