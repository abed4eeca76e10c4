package com.lexsched.lexsched_api.solver.model;

import com.lexsched.lexsched_api.solver.domain.AssignmentKey;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * A binary model variable. Variables backing an {@link AssignmentKey} carry that key;
 * auxiliary variables created by objectives carry none.
 */
@Getter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public final class DecisionVariable {

    @EqualsAndHashCode.Include
    private final int index;
    private final String name;
    private final AssignmentKey key;

    public DecisionVariable(int index, String name, AssignmentKey key) {
        this.index = index;
        this.name = name;
        this.key = key;
    }

    public boolean isAuxiliary() {
        return key == null;
    }

    @Override
    public String toString() {
        return name;
    }
}
