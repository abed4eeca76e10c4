package com.lexsched.lexsched_api.solver.domain;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.Collection;
import java.util.Collections;
import java.util.Set;

import com.lexsched.lexsched_api.model.TimeSlot;

/**
 * Factory methods for the predicates the built-in plugins filter keys with.
 */
public final class KeyPredicates {

    private KeyPredicates() {}

    public static KeyPredicate all() {
        return (c, r, t) -> true;
    }

    public static KeyPredicate course(String courseId) {
        return (c, r, t) -> c.equals(courseId);
    }

    public static KeyPredicate room(String roomId) {
        return (c, r, t) -> r.equals(roomId);
    }

    public static KeyPredicate rooms(Collection<String> roomIds) {
        Set<String> wanted = Set.copyOf(roomIds);
        return (c, r, t) -> wanted.contains(r);
    }

    public static KeyPredicate timeSlot(String timeSlotId) {
        return (c, r, t) -> t.equals(timeSlotId);
    }

    public static KeyPredicate timeSlots(Collection<String> timeSlotIds) {
        Set<String> wanted = Set.copyOf(timeSlotIds);
        return (c, r, t) -> wanted.contains(t);
    }

    public static KeyPredicate instructor(EntityCatalog catalog, String instructorId) {
        return (c, r, t) -> instructorId.equals(catalog.instructor(c));
    }

    public static KeyPredicate courseType(EntityCatalog catalog, String type) {
        return (c, r, t) -> type.equalsIgnoreCase(String.valueOf(catalog.courseType(c)));
    }

    /** Slot starts strictly before {@code time}. */
    public static KeyPredicate startsBefore(EntityCatalog catalog, LocalTime time) {
        return (c, r, t) -> catalog.timeSlot(t).getStartTime().isBefore(time);
    }

    /** Slot starts strictly after {@code time}. */
    public static KeyPredicate startsAfter(EntityCatalog catalog, LocalTime time) {
        return (c, r, t) -> catalog.timeSlot(t).getStartTime().isAfter(time);
    }

    /**
     * Keys whose slot blocks the reference slot: they share a day, start no later than the
     * reference start, and are still running {@code bufferMinutes} before it starts.
     */
    public static KeyPredicate overlapping(EntityCatalog catalog, String referenceSlotId, int bufferMinutes) {
        TimeSlot reference = catalog.timeSlot(referenceSlotId);
        Set<DayOfWeek> referenceDays = catalog.days(referenceSlotId);
        int referenceStart = reference.getStartMinutes();
        return (c, r, t) -> {
            if (Collections.disjoint(catalog.days(t), referenceDays)) {
                return false;
            }
            TimeSlot slot = catalog.timeSlot(t);
            return slot.getStartMinutes() <= referenceStart
                    && slot.getEndMinutes() > referenceStart - bufferMinutes;
        };
    }
}
