package com.lexsched.lexsched_api.model;

import java.time.Instant;
import java.util.List;

import com.lexsched.lexsched_api.solver.engine.StageResult;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * In-memory record of one optimization request. Replaced, never mutated, as the run progresses.
 */
@Value
@Builder
@With
public class ScheduleRun {
    String problemId;
    RunStatus status;
    Instant startedAt;
    Instant finishedAt;
    ScheduleView view;
    @Builder.Default
    List<StageResult> stages = List.of();
    RunFailure failure;

    public static ScheduleRun started(String problemId) {
        return ScheduleRun.builder().problemId(problemId).status(RunStatus.SOLVING).startedAt(Instant.now()).build();
    }
}
