package com.lexsched.lexsched_api.solver.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.lexsched.lexsched_api.model.Course;
import com.lexsched.lexsched_api.model.Room;
import com.lexsched.lexsched_api.model.TimeSlot;
import com.lexsched.lexsched_api.solver.model.DecisionVariable;

/**
 * The fixed universe of (course, room, slot) keys and their binary variables.
 *
 * <p>A key exists only if the room can seat the course and the course type fits the slot type.
 * Room capacity is therefore never expressed as an explicit inequality: capacity-violating
 * assignments have no variable to take the value 1.
 */
public final class AssignmentSpace {

    private static final Logger logger = LoggerFactory.getLogger(AssignmentSpace.class);

    private final EntityCatalog catalog;
    private final List<AssignmentKey> keys;
    private final Map<AssignmentKey, DecisionVariable> variables;

    private AssignmentSpace(EntityCatalog catalog, List<AssignmentKey> keys, Map<AssignmentKey, DecisionVariable> variables) {
        this.catalog = catalog;
        this.keys = keys;
        this.variables = variables;
    }

    public static AssignmentSpace build(EntityCatalog catalog) {
        List<AssignmentKey> keys = new ArrayList<>();
        Map<AssignmentKey, DecisionVariable> variables = new LinkedHashMap<>();
        int pruned = 0;
        for (Course course : catalog.courses()) {
            for (Room room : catalog.rooms()) {
                for (TimeSlot slot : catalog.timeSlots()) {
                    if (course.getEnrollment() > room.getCapacity()
                            || !catalog.isTypeCompatible(course.getId(), slot.getId())) {
                        pruned++;
                        continue;
                    }
                    AssignmentKey key = new AssignmentKey(course.getId(), room.getId(), slot.getId());
                    DecisionVariable variable = new DecisionVariable(keys.size(),
                            "x[" + course.getId() + "," + room.getId() + "," + slot.getId() + "]", key);
                    keys.add(key);
                    variables.put(key, variable);
                }
            }
        }
        logger.info("Assignment space built: {} keys ({} combinations pruned by capacity/type)", keys.size(), pruned);
        return new AssignmentSpace(catalog, Collections.unmodifiableList(keys), Collections.unmodifiableMap(variables));
    }

    public EntityCatalog getCatalog() {
        return catalog;
    }

    public List<AssignmentKey> keys() {
        return keys;
    }

    public int size() {
        return keys.size();
    }

    public boolean contains(AssignmentKey key) {
        return variables.containsKey(key);
    }

    public DecisionVariable variable(AssignmentKey key) {
        DecisionVariable variable = variables.get(key);
        if (variable == null) {
            throw new NoSuchElementException("No decision variable for " + key + " (pruned or unknown)");
        }
        return variable;
    }

    public List<DecisionVariable> variables() {
        return List.copyOf(variables.values());
    }

    public List<AssignmentKey> filterKeys(KeyPredicate predicate) {
        return filter(keys, predicate);
    }

    /**
     * Pure filter over any key collection; keeps the input order.
     */
    public static List<AssignmentKey> filter(Iterable<AssignmentKey> keys, KeyPredicate predicate) {
        List<AssignmentKey> matched = new ArrayList<>();
        for (AssignmentKey key : keys) {
            if (predicate.test(key)) {
                matched.add(key);
            }
        }
        return matched;
    }
}
