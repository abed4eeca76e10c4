package com.lexsched.lexsched_api.dto;

import java.util.List;
import java.util.stream.Collectors;

import com.lexsched.lexsched_api.model.ScheduleRun;

/**
 * JSON view of a run. {@code schedule} is empty unless the run finished successfully.
 */
public record ScheduleResponse(String problemId, String status, List<StageSummary> stages,
                               List<ScheduledClassResponse> schedule, String failure) {

    public static ScheduleResponse from(ScheduleRun run) {
        List<StageSummary> stages = (run.getFailure() != null ? run.getFailure().getCompletedStages() : run.getStages())
                .stream().map(StageSummary::from).collect(Collectors.toList());
        List<ScheduledClassResponse> rows = run.getView() == null ? List.of()
                : run.getView().getRows().stream().map(ScheduledClassResponse::from).collect(Collectors.toList());
        String failure = run.getFailure() == null ? null : run.getFailure().getMessage();
        return new ScheduleResponse(run.getProblemId(), run.getStatus().name(), stages, rows, failure);
    }
}
