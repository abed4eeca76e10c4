package com.lexsched.lexsched_api.solver.engine;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.lexsched.lexsched_api.solver.domain.AssignmentKey;
import com.lexsched.lexsched_api.solver.domain.AssignmentSpace;
import com.lexsched.lexsched_api.solver.model.DecisionVariable;

import lombok.Value;

@Value
public class OptimizationResult {
    Map<DecisionVariable, Integer> assignment;
    List<StageResult> stages;
    AssignmentSpace space;

    /** Keys set to 1 in the final assignment, in key order. */
    public List<AssignmentKey> selectedKeys() {
        return space.keys().stream()
                .filter(key -> assignment.getOrDefault(space.variable(key), 0) == 1)
                .collect(Collectors.toList());
    }

    public StageResult lastStage() {
        return stages.get(stages.size() - 1);
    }
}
