package com.lexsched.lexsched_api.solver.adapter;

import com.lexsched.lexsched_api.solver.model.ModelSnapshot;

/**
 * Opaque integer-programming capability. Implementations must not retain or mutate the snapshot.
 */
public interface SolverAdapter {

    SolveResult solve(ModelSnapshot snapshot);
}
