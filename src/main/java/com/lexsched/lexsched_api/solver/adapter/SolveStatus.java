package com.lexsched.lexsched_api.solver.adapter;

public enum SolveStatus {
    OPTIMAL,
    INFEASIBLE,
    UNBOUNDED,
    TIMEOUT
}
