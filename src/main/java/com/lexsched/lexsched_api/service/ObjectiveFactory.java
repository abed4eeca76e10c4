package com.lexsched.lexsched_api.service;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.springframework.stereotype.Component;

import com.lexsched.lexsched_api.dto.ObjectiveInput;
import com.lexsched.lexsched_api.model.ClockTime;
import com.lexsched.lexsched_api.solver.model.ObjectiveSense;
import com.lexsched.lexsched_api.solver.objective.MaximizeEnrollmentInRooms;
import com.lexsched.lexsched_api.solver.objective.MaximizePreferredRooms;
import com.lexsched.lexsched_api.solver.objective.MaximizePreferredTimeSlots;
import com.lexsched.lexsched_api.solver.objective.MinimizeClassesAfter;
import com.lexsched.lexsched_api.solver.objective.MinimizeClassesBefore;
import com.lexsched.lexsched_api.solver.objective.MinimizeInstructorRoomChanges;
import com.lexsched.lexsched_api.solver.objective.ObjectiveScope;
import com.lexsched.lexsched_api.solver.objective.SchedulingObjective;

/**
 * Builds objective plugins from request descriptors. Type names are matched ignoring case,
 * dashes and underscores, so {@code minimize_classes_before} and {@code MinimizeClassesBefore} agree.
 */
@Component
public class ObjectiveFactory {

    public List<SchedulingObjective> create(List<ObjectiveInput> inputs) {
        List<SchedulingObjective> objectives = new ArrayList<>();
        if (inputs == null) {
            return objectives;
        }
        for (ObjectiveInput input : inputs) {
            objectives.add(create(input));
        }
        return objectives;
    }

    public SchedulingObjective create(ObjectiveInput input) {
        if (input == null || input.type() == null || input.type().isBlank()) {
            throw new IllegalArgumentException("Every objective needs a type.");
        }
        double tolerance = input.tolerance() == null ? 0.0 : input.tolerance();
        ObjectiveScope scope = ObjectiveScope.of(input.instructorId(), input.courseType());
        String type = input.type().replaceAll("[-_\\s]", "").toLowerCase(Locale.ROOT);
        switch (type) {
            case "minimizeclassesbefore":
                return new MinimizeClassesBefore(requireTime(input), senseOf(input), tolerance, scope);
            case "minimizeclassesafter":
                return new MinimizeClassesAfter(requireTime(input), senseOf(input), tolerance, scope);
            case "maximizepreferredrooms":
                return new MaximizePreferredRooms(requireList(input.rooms(), input.type(), "rooms"), tolerance, scope);
            case "maximizepreferredtimeslots":
                return new MaximizePreferredTimeSlots(requireList(input.timeSlots(), input.type(), "timeSlots"), tolerance, scope);
            case "minimizeinstructorroomchanges":
                return new MinimizeInstructorRoomChanges(tolerance, scope);
            case "maximizeenrollmentinrooms":
                return new MaximizeEnrollmentInRooms(requireList(input.rooms(), input.type(), "rooms"), tolerance, scope);
            default:
                throw new IllegalArgumentException("Unknown objective type '" + input.type() + "'.");
        }
    }

    private static LocalTime requireTime(ObjectiveInput input) {
        if (input.time() == null) {
            throw new IllegalArgumentException("Objective '" + input.type() + "' needs a 'time'.");
        }
        return ClockTime.parse(input.time());
    }

    private static ObjectiveSense senseOf(ObjectiveInput input) {
        return input.sense() == null ? ObjectiveSense.MINIMIZE : ObjectiveSense.parse(input.sense());
    }

    private static List<String> requireList(List<String> values, String type, String field) {
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("Objective '" + type + "' needs a non-empty '" + field + "'.");
        }
        return values;
    }
}
