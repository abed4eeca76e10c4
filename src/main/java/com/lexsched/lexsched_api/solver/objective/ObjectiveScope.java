package com.lexsched.lexsched_api.solver.objective;

import com.lexsched.lexsched_api.solver.domain.EntityCatalog;
import com.lexsched.lexsched_api.solver.domain.KeyPredicate;
import com.lexsched.lexsched_api.solver.domain.KeyPredicates;

import lombok.Value;

/**
 * Optional restriction of an objective to one instructor and/or one course type.
 */
@Value
public class ObjectiveScope {

    public static final ObjectiveScope ALL = new ObjectiveScope(null, null);

    String instructorId;
    String courseType;

    public static ObjectiveScope of(String instructorId, String courseType) {
        if (isBlank(instructorId) && isBlank(courseType)) {
            return ALL;
        }
        return new ObjectiveScope(isBlank(instructorId) ? null : instructorId, isBlank(courseType) ? null : courseType);
    }

    public boolean isUnrestricted() {
        return instructorId == null && courseType == null;
    }

    public KeyPredicate predicate(EntityCatalog catalog) {
        KeyPredicate predicate = KeyPredicates.all();
        if (instructorId != null) {
            predicate = predicate.and(KeyPredicates.instructor(catalog, instructorId));
        }
        if (courseType != null) {
            predicate = predicate.and(KeyPredicates.courseType(catalog, courseType));
        }
        return predicate;
    }

    @Override
    public String toString() {
        if (isUnrestricted()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        if (instructorId != null) {
            sb.append("instructor=").append(instructorId);
        }
        if (courseType != null) {
            if (sb.length() > 0) sb.append(',');
            sb.append("type=").append(courseType);
        }
        return sb.toString();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
