package com.lexsched.lexsched_api.solver.domain;

import static com.lexsched.lexsched_api.support.Fixtures.course;
import static com.lexsched.lexsched_api.support.Fixtures.room;
import static com.lexsched.lexsched_api.support.Fixtures.slot;
import static com.lexsched.lexsched_api.support.Fixtures.typedCourse;
import static com.lexsched.lexsched_api.support.Fixtures.typedSlot;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.List;
import java.util.NoSuchElementException;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.lexsched.lexsched_api.exception.CatalogLoadException;
import com.lexsched.lexsched_api.model.Course;
import com.lexsched.lexsched_api.model.TimeSlot;

class EntityCatalogTest {

    @Test
    @DisplayName("lookups return the loaded records")
    void lookups() {
        EntityCatalog catalog = EntityCatalog.load(
                List.of(course("c1", "smith", 20), course("c2", "smith", 35), course("c3", "jones", 10)),
                List.of(room("r1", 40)),
                List.of(slot("s1", "MWF", "8:00", "8:50")));

        assertThat(catalog.enrollment("c2")).isEqualTo(35);
        assertThat(catalog.capacity("r1")).isEqualTo(40);
        assertThat(catalog.instructor("c3")).isEqualTo("jones");
        assertThat(catalog.instructors()).containsExactly("smith", "jones");
        assertThat(catalog.coursesOf("smith")).extracting(Course::getId).containsExactly("c1", "c2");
        assertThat(catalog.days("s1")).containsExactly(DayOfWeek.MONDAY, DayOfWeek.WEDNESDAY, DayOfWeek.FRIDAY);
        assertThat(catalog.timeSlot("s1").getStartTime()).isEqualTo(LocalTime.of(8, 0));
    }

    @Test
    @DisplayName("unknown ids raise NoSuchElementException")
    void unknownIds() {
        EntityCatalog catalog = EntityCatalog.load(List.of(course("c1", "i", 1)), List.of(room("r1", 5)),
                List.of(slot("s1", "M", "8:00", "9:00")));

        assertThatThrownBy(() -> catalog.course("nope")).isInstanceOf(NoSuchElementException.class);
        assertThatThrownBy(() -> catalog.capacity("nope")).isInstanceOf(NoSuchElementException.class);
        assertThatThrownBy(() -> catalog.coursesOf("nobody")).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    @DisplayName("every violation is collected before failing")
    void collectsViolations() {
        TimeSlot backwards = slot("s2", "MW", "10:00", "9:00");
        TimeSlot badDays = slot("s3", "XYZ", "8:00", "9:00");
        Course forced = Course.builder().id("c3").instructorId("i1").enrollment(5).forcedRoomId("ghost").build();

        CatalogLoadException ex = catchThrowableOfType(() -> EntityCatalog.load(
                List.of(course("c1", "i1", -3), course("c1", "i1", 4), forced, course("c4", " ", 1)),
                List.of(room("r1", 10), room("r1", 12), room("r2", -1)),
                List.of(slot("s1", "MWF", "8:00", "8:50"), backwards, badDays)), CatalogLoadException.class);

        assertThat(ex.getViolations()).containsExactlyInAnyOrder(
                "Duplicate room: r1",
                "Room r2 has negative capacity -1",
                "Time slot s2 starts at 10:00 but ends at 09:00",
                "Time slot s3: Unrecognized day code at position 0 in 'XYZ'.",
                "Course c1 has negative enrollment -3",
                "Duplicate course: c1",
                "Course c3 is forced into unknown room ghost",
                "Course c4 has no instructor");
    }

    @Test
    @DisplayName("with a roster, courses must name a listed instructor")
    void rosterIsEnforced() {
        assertThatThrownBy(() -> EntityCatalog.load(List.of(course("c1", "stranger", 5)), List.of(room("r1", 5)),
                List.of(slot("s1", "M", "8:00", "9:00")), List.of("smith")))
                .isInstanceOf(CatalogLoadException.class)
                .hasMessageContaining("unknown instructor stranger");

        EntityCatalog catalog = EntityCatalog.load(List.of(course("c1", "smith", 5)), List.of(room("r1", 5)),
                List.of(slot("s1", "M", "8:00", "9:00")), List.of("smith", "idle"));
        assertThat(catalog.instructors()).containsExactly("smith", "idle");
        assertThat(catalog.coursesOf("idle")).isEmpty();
    }

    @Test
    @DisplayName("type compatibility ignores case and treats a missing type as a wildcard")
    void typeCompatibility() {
        EntityCatalog catalog = EntityCatalog.load(
                List.of(typedCourse("lab", "i", 5, "Lab"), typedCourse("lec", "i", 5, "Lecture"), course("any", "i", 5)),
                List.of(room("r1", 10)),
                List.of(typedSlot("labSlot", "T", "13:00", "15:50", "lab"), slot("open", "M", "8:00", "9:00")));

        assertThat(catalog.isTypeCompatible("lab", "labSlot")).isTrue();
        assertThat(catalog.isTypeCompatible("lec", "labSlot")).isFalse();
        assertThat(catalog.isTypeCompatible("any", "labSlot")).isTrue();
        assertThat(catalog.isTypeCompatible("lec", "open")).isTrue();
    }
}
