package com.lexsched.lexsched_api.model;

import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

import lombok.Value;

/**
 * Solved schedule as handed to renderers, rows ordered by first meeting day, then start time.
 */
@Value
public class ScheduleView {

    private static final Comparator<ScheduledClass> ORDER = Comparator
            .comparing(ScheduledClass::firstDay)
            .thenComparing(ScheduledClass::getStartTime)
            .thenComparing(ScheduledClass::getRoomId)
            .thenComparing(ScheduledClass::getCourseId);

    List<ScheduledClass> rows;

    public static ScheduleView of(List<ScheduledClass> rows) {
        return new ScheduleView(rows.stream().sorted(ORDER).collect(Collectors.toUnmodifiableList()));
    }

    public List<ScheduledClass> forInstructor(String instructorId) {
        return rows.stream().filter(r -> instructorId.equals(r.getInstructorId())).collect(Collectors.toList());
    }

    /** Rows meeting on each day, a class appearing under every day of its pattern. */
    public Map<DayOfWeek, List<ScheduledClass>> byDay() {
        Map<DayOfWeek, List<ScheduledClass>> byDay = new TreeMap<>();
        for (ScheduledClass row : rows) {
            for (DayOfWeek day : row.getDays()) {
                byDay.computeIfAbsent(day, d -> new ArrayList<>()).add(row);
            }
        }
        byDay.values().forEach(list -> list.sort(Comparator.comparing(ScheduledClass::getStartTime)));
        return byDay;
    }
}
