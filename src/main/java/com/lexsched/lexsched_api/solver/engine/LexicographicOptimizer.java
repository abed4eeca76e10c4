package com.lexsched.lexsched_api.solver.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.lexsched.lexsched_api.exception.InfeasibleModelException;
import com.lexsched.lexsched_api.exception.PluginEvaluationException;
import com.lexsched.lexsched_api.exception.SolverTimeoutException;
import com.lexsched.lexsched_api.exception.StagedInfeasibilityException;
import com.lexsched.lexsched_api.exception.UnboundedObjectiveException;
import com.lexsched.lexsched_api.solver.adapter.SolveResult;
import com.lexsched.lexsched_api.solver.adapter.SolverAdapter;
import com.lexsched.lexsched_api.solver.model.BaseModel;
import com.lexsched.lexsched_api.solver.model.ConstraintOrigin;
import com.lexsched.lexsched_api.solver.model.DecisionVariable;
import com.lexsched.lexsched_api.solver.model.LinearConstraint;
import com.lexsched.lexsched_api.solver.model.LinearExpression;
import com.lexsched.lexsched_api.solver.model.ModelContext;
import com.lexsched.lexsched_api.solver.model.ModelSnapshot;
import com.lexsched.lexsched_api.solver.model.ObjectiveSense;
import com.lexsched.lexsched_api.solver.model.Relation;
import com.lexsched.lexsched_api.solver.model.ScheduleModel;
import com.lexsched.lexsched_api.solver.objective.SchedulingObjective;

/**
 * Solves objectives one at a time in priority order. After each stage except the last the
 * achieved value, relaxed by the objective's tolerance, is appended to the working model
 * as a {@link ConstraintOrigin#FROZEN} row, so later stages can never undo earlier ones.
 */
public class LexicographicOptimizer {

    private static final Logger logger = LoggerFactory.getLogger(LexicographicOptimizer.class);

    static final String FEASIBILITY_STAGE = "feasibility";

    private final SolverAdapter solverAdapter;

    public LexicographicOptimizer(SolverAdapter solverAdapter) {
        this.solverAdapter = solverAdapter;
    }

    public OptimizationResult optimize(BaseModel baseModel, List<? extends SchedulingObjective> objectives) {
        return optimize(baseModel, objectives, StageListener.NONE);
    }

    public OptimizationResult optimize(BaseModel baseModel, List<? extends SchedulingObjective> objectives,
                                       StageListener listener) {
        ScheduleModel model = baseModel.newWorkingModel();
        ModelContext context = baseModel.newContext(model);
        List<StageResult> completed = new ArrayList<>();
        listener.onTransition(EngineState.IDLE, 0, null);

        if (objectives.isEmpty()) {
            return solveFeasibility(baseModel, model, listener);
        }

        Map<DecisionVariable, Integer> best = null;
        FrozenBound lastFrozen = null;
        int n = objectives.size();
        for (int i = 1; i <= n; i++) {
            SchedulingObjective objective = objectives.get(i - 1);
            String name = objective.getName();
            listener.onTransition(EngineState.SOLVING, i, name);

            LinearExpression expression;
            try {
                expression = objective.evaluate(context);
            } catch (RuntimeException e) {
                fail(listener, i, name);
                logger.error("Objective '{}' failed to evaluate at stage {}", name, i, e);
                throw new PluginEvaluationException(name, i, completed, e);
            }
            model.setObjective(expression, objective.getSense());
            ModelSnapshot input = model.snapshot();
            logger.info("Stage {}/{}: {} '{}' over {} variables and {} constraints ({} frozen)",
                    i, n, objective.getSense(), name, input.getVariables().size(),
                    input.getConstraints().size(), input.countConstraints(ConstraintOrigin.FROZEN));

            SolveResult result = solverAdapter.solve(input);
            switch (result.getStatus()) {
                case INFEASIBLE:
                    fail(listener, i, name);
                    if (i == 1) {
                        logger.error("Hard constraints are infeasible (stage 1, '{}')", name);
                        throw new InfeasibleModelException(name);
                    }
                    logger.error("Stage {} '{}' infeasible after freezing {}", i, name, lastFrozen);
                    throw new StagedInfeasibilityException(i, name, lastFrozen, completed);
                case TIMEOUT:
                    fail(listener, i, name);
                    logger.error("Stage {} '{}' hit the solver time limit", i, name);
                    throw new SolverTimeoutException(i, name, completed);
                case UNBOUNDED:
                    fail(listener, i, name);
                    logger.error("Stage {} '{}' is unbounded", i, name);
                    throw new UnboundedObjectiveException(i, name, completed);
                case OPTIMAL:
                default:
                    break;
            }

            double value = result.getObjectiveValue();
            best = result.getAssignment();
            FrozenBound frozen = null;
            if (i < n) {
                listener.onTransition(EngineState.CONSTRAINING, i, name);
                frozen = freeze(model, expression, objective, i, value);
                lastFrozen = frozen;
            }
            completed.add(new StageResult(i, name, objective.getSense(), value, objective.getTolerance(), frozen, input));
            logger.info("Stage {}/{} '{}' optimal: {}", i, n, name, value);
        }

        listener.onTransition(EngineState.DONE, n, objectives.get(n - 1).getName());
        return new OptimizationResult(best, List.copyOf(completed), baseModel.getSpace());
    }

    private OptimizationResult solveFeasibility(BaseModel baseModel, ScheduleModel model, StageListener listener) {
        listener.onTransition(EngineState.SOLVING, 1, FEASIBILITY_STAGE);
        model.clearObjective();
        ModelSnapshot input = model.snapshot();
        logger.info("No objectives given; feasibility solve over {} variables and {} constraints",
                input.getVariables().size(), input.getConstraints().size());
        SolveResult result = solverAdapter.solve(input);
        switch (result.getStatus()) {
            case INFEASIBLE:
                fail(listener, 1, FEASIBILITY_STAGE);
                throw new InfeasibleModelException(null);
            case TIMEOUT:
                fail(listener, 1, FEASIBILITY_STAGE);
                throw new SolverTimeoutException(1, FEASIBILITY_STAGE, List.of());
            case UNBOUNDED:
                fail(listener, 1, FEASIBILITY_STAGE);
                throw new UnboundedObjectiveException(1, FEASIBILITY_STAGE, List.of());
            case OPTIMAL:
            default:
                break;
        }
        StageResult stage = new StageResult(1, FEASIBILITY_STAGE, ObjectiveSense.MINIMIZE, 0.0, 0.0, null, input);
        listener.onTransition(EngineState.DONE, 1, FEASIBILITY_STAGE);
        return new OptimizationResult(result.getAssignment(), List.of(stage), baseModel.getSpace());
    }

    private FrozenBound freeze(ScheduleModel model, LinearExpression expression, SchedulingObjective objective,
                               int stageIndex, double value) {
        double bound = ToleranceBounds.bound(objective.getSense(), value, objective.getTolerance());
        Relation relation = objective.getSense() == ObjectiveSense.MINIMIZE
                ? Relation.LESS_OR_EQUAL : Relation.GREATER_OR_EQUAL;
        model.addConstraint(new LinearConstraint("lock_objective_" + stageIndex, expression, relation, bound,
                ConstraintOrigin.FROZEN));
        logger.debug("Froze '{}' {} {}", objective.getName(), relation.getSymbol(), bound);
        return new FrozenBound(stageIndex, objective.getName(), relation, bound, value, objective.getTolerance());
    }

    private static void fail(StageListener listener, int stageIndex, String objectiveName) {
        listener.onTransition(EngineState.FAILED, stageIndex, objectiveName);
    }
}
