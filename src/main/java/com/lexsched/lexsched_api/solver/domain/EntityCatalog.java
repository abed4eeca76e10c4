package com.lexsched.lexsched_api.solver.domain;

import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.lexsched.lexsched_api.exception.CatalogLoadException;
import com.lexsched.lexsched_api.model.Course;
import com.lexsched.lexsched_api.model.DayPattern;
import com.lexsched.lexsched_api.model.Room;
import com.lexsched.lexsched_api.model.TimeSlot;

/**
 * Read-only problem facts for one scheduling session: courses, rooms, time slots and the
 * instructor-to-course association. Iteration order always follows the input order.
 */
public final class EntityCatalog {

    private static final Logger logger = LoggerFactory.getLogger(EntityCatalog.class);

    private final Map<String, Course> courses;
    private final Map<String, Room> rooms;
    private final Map<String, TimeSlot> timeSlots;
    private final Map<String, Set<DayOfWeek>> slotDays;
    private final Map<String, List<Course>> coursesByInstructor;

    private EntityCatalog(Map<String, Course> courses, Map<String, Room> rooms, Map<String, TimeSlot> timeSlots,
                          Map<String, Set<DayOfWeek>> slotDays, Map<String, List<Course>> coursesByInstructor) {
        this.courses = courses;
        this.rooms = rooms;
        this.timeSlots = timeSlots;
        this.slotDays = slotDays;
        this.coursesByInstructor = coursesByInstructor;
    }

    /**
     * Loads a catalog whose instructors are exactly those named by the courses.
     */
    public static EntityCatalog load(Collection<Course> courses, Collection<Room> rooms, Collection<TimeSlot> timeSlots) {
        return load(courses, rooms, timeSlots, null);
    }

    /**
     * Loads and validates a catalog. When {@code instructors} is non-null every course must
     * reference one of them; instructors without courses are kept so they show up in lookups.
     *
     * @throws CatalogLoadException listing every violation found
     */
    public static EntityCatalog load(Collection<Course> courses, Collection<Room> rooms, Collection<TimeSlot> timeSlots,
                                     Collection<String> instructors) {
        List<String> violations = new ArrayList<>();

        Map<String, Room> roomMap = new LinkedHashMap<>();
        for (Room room : rooms) {
            if (isBlank(room.getId())) {
                violations.add("Room with blank id");
                continue;
            }
            if (roomMap.putIfAbsent(room.getId(), room) != null) {
                violations.add("Duplicate room: " + room.getId());
            }
            if (room.getCapacity() < 0) {
                violations.add("Room " + room.getId() + " has negative capacity " + room.getCapacity());
            }
        }

        Map<String, TimeSlot> slotMap = new LinkedHashMap<>();
        Map<String, Set<DayOfWeek>> dayMap = new LinkedHashMap<>();
        for (TimeSlot slot : timeSlots) {
            if (isBlank(slot.getId())) {
                violations.add("Time slot with blank id");
                continue;
            }
            if (slotMap.putIfAbsent(slot.getId(), slot) != null) {
                violations.add("Duplicate time slot: " + slot.getId());
                continue;
            }
            if (slot.getStartTime() == null || slot.getEndTime() == null) {
                violations.add("Time slot " + slot.getId() + " is missing its start or end time");
            } else if (!slot.getStartTime().isBefore(slot.getEndTime())) {
                violations.add("Time slot " + slot.getId() + " starts at " + slot.getStartTime()
                        + " but ends at " + slot.getEndTime());
            }
            try {
                dayMap.put(slot.getId(), DayPattern.parse(slot.getDayPattern()));
            } catch (IllegalArgumentException e) {
                violations.add("Time slot " + slot.getId() + ": " + e.getMessage());
            }
        }

        Set<String> roster = instructors == null ? null : new LinkedHashSet<>();
        if (instructors != null) {
            for (String instructor : instructors) {
                if (isBlank(instructor)) {
                    violations.add("Instructor with blank id");
                } else if (!roster.add(instructor)) {
                    violations.add("Duplicate instructor: " + instructor);
                }
            }
        }

        Map<String, Course> courseMap = new LinkedHashMap<>();
        Map<String, List<Course>> byInstructor = new LinkedHashMap<>();
        if (roster != null) {
            roster.forEach(i -> byInstructor.put(i, new ArrayList<>()));
        }
        for (Course course : courses) {
            if (isBlank(course.getId())) {
                violations.add("Course with blank id");
                continue;
            }
            if (courseMap.putIfAbsent(course.getId(), course) != null) {
                violations.add("Duplicate course: " + course.getId());
                continue;
            }
            if (course.getEnrollment() < 0) {
                violations.add("Course " + course.getId() + " has negative enrollment " + course.getEnrollment());
            }
            String instructor = course.getInstructorId();
            if (isBlank(instructor)) {
                violations.add("Course " + course.getId() + " has no instructor");
            } else if (roster != null && !roster.contains(instructor)) {
                violations.add("Course " + course.getId() + " references unknown instructor " + instructor);
            } else {
                byInstructor.computeIfAbsent(instructor, i -> new ArrayList<>()).add(course);
            }
            if (course.getForcedRoomId() != null && !roomMap.containsKey(course.getForcedRoomId())) {
                violations.add("Course " + course.getId() + " is forced into unknown room " + course.getForcedRoomId());
            }
            if (course.getForcedTimeSlotId() != null && !slotMap.containsKey(course.getForcedTimeSlotId())) {
                violations.add("Course " + course.getId() + " is forced into unknown time slot " + course.getForcedTimeSlotId());
            }
        }

        if (!violations.isEmpty()) {
            logger.warn("Catalog load failed with {} violation(s): {}", violations.size(), violations);
            throw new CatalogLoadException(violations);
        }

        Map<String, List<Course>> frozenByInstructor = new LinkedHashMap<>();
        byInstructor.forEach((k, v) -> frozenByInstructor.put(k, List.copyOf(v)));
        logger.info("Loaded catalog: {} courses, {} rooms, {} time slots, {} instructors",
                courseMap.size(), roomMap.size(), slotMap.size(), frozenByInstructor.size());
        return new EntityCatalog(
                Collections.unmodifiableMap(courseMap),
                Collections.unmodifiableMap(roomMap),
                Collections.unmodifiableMap(slotMap),
                Collections.unmodifiableMap(dayMap),
                Collections.unmodifiableMap(frozenByInstructor));
    }

    public Collection<Course> courses() {
        return courses.values();
    }

    public Collection<Room> rooms() {
        return rooms.values();
    }

    public Collection<TimeSlot> timeSlots() {
        return timeSlots.values();
    }

    public Set<String> instructors() {
        return coursesByInstructor.keySet();
    }

    public Course course(String courseId) {
        return require(courses, courseId, "course");
    }

    public Room room(String roomId) {
        return require(rooms, roomId, "room");
    }

    public TimeSlot timeSlot(String timeSlotId) {
        return require(timeSlots, timeSlotId, "time slot");
    }

    public int enrollment(String courseId) {
        return course(courseId).getEnrollment();
    }

    public int capacity(String roomId) {
        return room(roomId).getCapacity();
    }

    public String instructor(String courseId) {
        return course(courseId).getInstructorId();
    }

    public String courseType(String courseId) {
        return course(courseId).getType();
    }

    public List<Course> coursesOf(String instructorId) {
        return require(coursesByInstructor, instructorId, "instructor");
    }

    public Set<DayOfWeek> days(String timeSlotId) {
        return require(slotDays, timeSlotId, "time slot");
    }

    /**
     * A course may use a slot when either side leaves its type unset or both types match, ignoring case.
     */
    public boolean isTypeCompatible(String courseId, String timeSlotId) {
        String courseType = courseType(courseId);
        String slotType = timeSlot(timeSlotId).getType();
        return isBlank(courseType) || isBlank(slotType) || courseType.equalsIgnoreCase(slotType);
    }

    private static <V> V require(Map<String, V> map, String id, String what) {
        V value = map.get(id);
        if (value == null) {
            throw new NoSuchElementException("Unknown " + what + ": " + id);
        }
        return value;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
