package com.lexsched.lexsched_api.exception;

import java.util.List;

/**
 * Catalog records violate referential integrity or basic sanity. Raised before any model is built.
 */
public class CatalogLoadException extends SchedulingException {

    private final List<String> violations;

    public CatalogLoadException(List<String> violations) {
        super("Catalog rejected with " + violations.size() + " violation(s): " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
