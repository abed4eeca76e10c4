package com.lexsched.lexsched_api.service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.lexsched.lexsched_api.dto.OptimizationRequest;
import com.lexsched.lexsched_api.exception.OptimizationFailureException;
import com.lexsched.lexsched_api.exception.SchedulingException;
import com.lexsched.lexsched_api.model.RunFailure;
import com.lexsched.lexsched_api.model.RunStatus;
import com.lexsched.lexsched_api.model.ScheduleRun;
import com.lexsched.lexsched_api.model.ScheduleView;
import com.lexsched.lexsched_api.model.ScheduledClass;
import com.lexsched.lexsched_api.model.TimeSlot;
import com.lexsched.lexsched_api.solver.constraint.ConstraintRegistry;
import com.lexsched.lexsched_api.solver.domain.AssignmentKey;
import com.lexsched.lexsched_api.solver.domain.AssignmentSpace;
import com.lexsched.lexsched_api.solver.domain.EntityCatalog;
import com.lexsched.lexsched_api.solver.engine.LexicographicOptimizer;
import com.lexsched.lexsched_api.solver.engine.OptimizationResult;
import com.lexsched.lexsched_api.solver.model.BaseModel;
import com.lexsched.lexsched_api.solver.model.ModelBuilder;
import com.lexsched.lexsched_api.solver.objective.SchedulingObjective;

/**
 * Runs the pipeline catalog, key space, base model, lexicographic engine, schedule view,
 * and keeps every run in memory under its problem id.
 */
@Service
public class SchedulingService {

    private static final Logger logger = LoggerFactory.getLogger(SchedulingService.class);

    private final ConcurrentMap<String, ScheduleRun> runs = new ConcurrentHashMap<>();

    private final ProblemMapper problemMapper;
    private final ObjectiveFactory objectiveFactory;
    private final ModelBuilder modelBuilder;
    private final ConstraintRegistry constraintRegistry;
    private final LexicographicOptimizer optimizer;

    public SchedulingService(ProblemMapper problemMapper, ObjectiveFactory objectiveFactory, ModelBuilder modelBuilder,
                             ConstraintRegistry constraintRegistry, LexicographicOptimizer optimizer) {
        this.problemMapper = problemMapper;
        this.objectiveFactory = objectiveFactory;
        this.modelBuilder = modelBuilder;
        this.constraintRegistry = constraintRegistry;
        this.optimizer = optimizer;
    }

    /**
     * Solves the request synchronously and records the outcome. Failures are recorded as a
     * FAILED run and then rethrown; unexpected errors are rethrown wrapped in a
     * {@link SchedulingException} that carries the problem id.
     */
    public ScheduleRun optimize(OptimizationRequest request) {
        String problemId = UUID.randomUUID().toString();
        logger.info("Received optimization request, problemId: {}", problemId);
        ScheduleRun run = ScheduleRun.started(problemId);
        runs.put(problemId, run);
        try {
            EntityCatalog catalog = problemMapper.toCatalog(request);
            List<SchedulingObjective> objectives = objectiveFactory.create(request.objectives());
            OptimizationResult result = optimize(catalog, objectives);
            ScheduleRun done = run.withStatus(RunStatus.DONE)
                    .withFinishedAt(Instant.now())
                    .withView(toView(catalog, result))
                    .withStages(result.getStages());
            runs.put(problemId, done);
            logger.info("Run {} finished with {} classes in {} stage(s)", problemId,
                    done.getView().getRows().size(), done.getStages().size());
            return done;
        } catch (OptimizationFailureException e) {
            runs.put(problemId, run.withStatus(RunStatus.FAILED).withFinishedAt(Instant.now())
                    .withFailure(new RunFailure(e.getKind(), e.getMessage(), e.getStageIndex(), e.getObjectiveName(),
                            e.getCompletedStages())));
            logger.warn("Run {} failed at stage {}: {}", problemId, e.getStageIndex(), e.getKind());
            e.setProblemId(problemId);
            throw e;
        } catch (SchedulingException e) {
            recordRejection(run, e);
            e.setProblemId(problemId);
            throw e;
        } catch (IllegalArgumentException e) {
            recordRejection(run, e);
            throw e;
        } catch (RuntimeException e) {
            runs.put(problemId, run.withStatus(RunStatus.FAILED).withFinishedAt(Instant.now())
                    .withFailure(new RunFailure("INTERNAL", String.valueOf(e.getMessage()), 0, null, List.of())));
            logger.error("Run {} aborted by an unexpected error:", problemId, e);
            SchedulingException wrapped = new SchedulingException("Run " + problemId + " failed unexpectedly.", e);
            wrapped.setProblemId(problemId);
            throw wrapped;
        }
    }

    private void recordRejection(ScheduleRun run, RuntimeException e) {
        runs.put(run.getProblemId(), run.withStatus(RunStatus.FAILED).withFinishedAt(Instant.now())
                .withFailure(new RunFailure("INVALID_INPUT", e.getMessage(), 0, null, List.of())));
        logger.warn("Run {} rejected: {}", run.getProblemId(), e.getMessage());
    }

    /**
     * Core pipeline, independent of any request format.
     */
    public OptimizationResult optimize(EntityCatalog catalog, List<? extends SchedulingObjective> objectives) {
        AssignmentSpace space = AssignmentSpace.build(catalog);
        logger.info("Assignment space: {} keys for {} courses, {} rooms, {} time slots", space.size(),
                catalog.courses().size(), catalog.rooms().size(), catalog.timeSlots().size());
        BaseModel baseModel = modelBuilder.build(space, constraintRegistry);
        return optimizer.optimize(baseModel, objectives,
                (state, stage, objective) -> logger.debug("Engine {} at stage {} ({})", state, stage, objective));
    }

    public ScheduleView toView(EntityCatalog catalog, OptimizationResult result) {
        List<ScheduledClass> rows = new ArrayList<>();
        for (AssignmentKey key : result.selectedKeys()) {
            TimeSlot slot = catalog.timeSlot(key.getTimeSlotId());
            rows.add(ScheduledClass.builder()
                    .courseId(key.getCourseId())
                    .courseType(catalog.courseType(key.getCourseId()))
                    .instructorId(catalog.instructor(key.getCourseId()))
                    .enrollment(catalog.enrollment(key.getCourseId()))
                    .roomId(key.getRoomId())
                    .roomCapacity(catalog.capacity(key.getRoomId()))
                    .timeSlotId(slot.getId())
                    .dayPattern(slot.getDayPattern())
                    .days(catalog.days(slot.getId()))
                    .startTime(slot.getStartTime())
                    .endTime(slot.getEndTime())
                    .build());
        }
        return ScheduleView.of(rows);
    }

    public ScheduleRun getRun(String problemId) {
        ScheduleRun run = runs.get(problemId);
        if (run == null) {
            throw new NoSuchElementException("No schedule run with problemId " + problemId);
        }
        return run;
    }

    public RunStatus getRunStatus(String problemId) {
        return getRun(problemId).getStatus();
    }
}
