package com.lexsched.lexsched_api.solver.engine;

public enum EngineState {
    IDLE,
    SOLVING,
    CONSTRAINING,
    DONE,
    FAILED
}
