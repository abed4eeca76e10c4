package com.lexsched.lexsched_api.solver.domain;

import static com.lexsched.lexsched_api.support.Fixtures.course;
import static com.lexsched.lexsched_api.support.Fixtures.room;
import static com.lexsched.lexsched_api.support.Fixtures.slot;
import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalTime;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class KeyPredicatesTest {

    private final EntityCatalog catalog = EntityCatalog.load(
            List.of(course("c1", "i1", 10)),
            List.of(room("r1", 30)),
            List.of(
                    slot("mwf9", "MWF", "9:00", "9:50"),
                    slot("mwf8", "MWF", "8:00", "8:50"),
                    slot("mw830", "MW", "8:30", "9:45"),
                    slot("m845", "M", "7:45", "8:45"),
                    slot("f7", "F", "7:00", "7:50"),
                    slot("tth9", "TTH", "9:00", "10:15")));

    private boolean overlaps(String candidate, String reference, int buffer) {
        return KeyPredicates.overlapping(catalog, reference, buffer).test("c1", "r1", candidate);
    }

    @Test
    @DisplayName("a slot always overlaps itself")
    void selfOverlap() {
        assertThat(overlaps("mwf9", "mwf9", 0)).isTrue();
        assertThat(overlaps("tth9", "tth9", 15)).isTrue();
    }

    @Test
    @DisplayName("a class ending inside the buffer before the reference start blocks it")
    void bufferBeforeStart() {
        // mwf8 ends 8:50, ten minutes before 9:00
        assertThat(overlaps("mwf8", "mwf9", 15)).isTrue();
        assertThat(overlaps("mwf8", "mwf9", 5)).isFalse();
        assertThat(overlaps("mw830", "mwf9", 0)).isTrue();
        assertThat(overlaps("f7", "mwf8", 15)).isTrue();
        assertThat(overlaps("f7", "mwf8", 5)).isFalse();
    }

    @Test
    @DisplayName("slots on disjoint days or starting later never overlap")
    void disjointDaysAndLaterStarts() {
        assertThat(overlaps("tth9", "mwf9", 15)).isFalse();
        assertThat(overlaps("mwf9", "mwf8", 15)).isFalse();
        assertThat(overlaps("m845", "mwf9", 15)).isFalse();
        assertThat(overlaps("m845", "mw830", 0)).isTrue();
    }

    @Test
    @DisplayName("time thresholds are strict")
    void startThresholds() {
        assertThat(KeyPredicates.startsBefore(catalog, LocalTime.of(9, 0)).test("c1", "r1", "mwf9")).isFalse();
        assertThat(KeyPredicates.startsBefore(catalog, LocalTime.of(9, 0)).test("c1", "r1", "mwf8")).isTrue();
        assertThat(KeyPredicates.startsAfter(catalog, LocalTime.of(9, 0)).test("c1", "r1", "tth9")).isFalse();
        assertThat(KeyPredicates.startsAfter(catalog, LocalTime.of(8, 59)).test("c1", "r1", "tth9")).isTrue();
    }
}
