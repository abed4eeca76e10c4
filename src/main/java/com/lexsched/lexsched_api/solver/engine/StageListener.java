package com.lexsched.lexsched_api.solver.engine;

/**
 * Observer of engine state transitions. {@code stageIndex} is 0 for IDLE and 1-based afterwards.
 */
@FunctionalInterface
public interface StageListener {

    StageListener NONE = (state, stageIndex, objectiveName) -> { };

    void onTransition(EngineState state, int stageIndex, String objectiveName);
}
