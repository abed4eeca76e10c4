package com.lexsched.lexsched_api.solver.engine;

import static com.lexsched.lexsched_api.support.Fixtures.course;
import static com.lexsched.lexsched_api.support.Fixtures.room;
import static com.lexsched.lexsched_api.support.Fixtures.slot;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.lexsched.lexsched_api.exception.InfeasibleModelException;
import com.lexsched.lexsched_api.exception.PluginEvaluationException;
import com.lexsched.lexsched_api.exception.SolverTimeoutException;
import com.lexsched.lexsched_api.exception.StagedInfeasibilityException;
import com.lexsched.lexsched_api.exception.UnboundedObjectiveException;
import com.lexsched.lexsched_api.solver.adapter.SolveResult;
import com.lexsched.lexsched_api.solver.adapter.SolverAdapter;
import com.lexsched.lexsched_api.solver.constraint.ConstraintRegistry;
import com.lexsched.lexsched_api.solver.domain.AssignmentSpace;
import com.lexsched.lexsched_api.solver.domain.EntityCatalog;
import com.lexsched.lexsched_api.solver.model.BaseModel;
import com.lexsched.lexsched_api.solver.model.ConstraintOrigin;
import com.lexsched.lexsched_api.solver.model.LinearConstraint;
import com.lexsched.lexsched_api.solver.model.LinearExpression;
import com.lexsched.lexsched_api.solver.model.ModelBuilder;
import com.lexsched.lexsched_api.solver.model.ModelContext;
import com.lexsched.lexsched_api.solver.model.ModelSnapshot;
import com.lexsched.lexsched_api.solver.model.ObjectiveSense;
import com.lexsched.lexsched_api.solver.model.Relation;
import com.lexsched.lexsched_api.solver.objective.MaximizePreferredRooms;
import com.lexsched.lexsched_api.solver.objective.MinimizeClassesAfter;
import com.lexsched.lexsched_api.solver.objective.MinimizeClassesBefore;
import com.lexsched.lexsched_api.solver.objective.ObjectiveScope;
import com.lexsched.lexsched_api.solver.objective.SchedulingObjective;

@ExtendWith(MockitoExtension.class)
class LexicographicOptimizerTest {

    @Mock
    private SolverAdapter solverAdapter;

    private LexicographicOptimizer optimizer;
    private BaseModel baseModel;

    @BeforeEach
    void setUp() {
        optimizer = new LexicographicOptimizer(solverAdapter);
        EntityCatalog catalog = EntityCatalog.load(
                List.of(course("c1", "i1", 10), course("c2", "i2", 10)),
                List.of(room("r1", 30), room("r2", 30)),
                List.of(slot("s1", "MWF", "8:00", "8:50"), slot("s2", "MWF", "13:00", "13:50")));
        baseModel = new ModelBuilder(15).build(AssignmentSpace.build(catalog), ConstraintRegistry.defaults());
    }

    private static SolveResult optimal(double value) {
        return SolveResult.optimal(Map.of(), value);
    }

    private List<ModelSnapshot> capturedSnapshots(int calls) {
        ArgumentCaptor<ModelSnapshot> captor = ArgumentCaptor.forClass(ModelSnapshot.class);
        verify(solverAdapter, times(calls)).solve(captor.capture());
        return captor.getAllValues();
    }

    @Test
    @DisplayName("an objective optimal at 0 with zero tolerance is frozen as expr <= 0 for the next stage")
    void freezesExactOptimum() {
        MinimizeClassesBefore first = new MinimizeClassesBefore(LocalTime.of(9, 0));
        MaximizePreferredRooms second = new MaximizePreferredRooms(List.of("r2"), 0.0, ObjectiveScope.ALL);
        when(solverAdapter.solve(any())).thenReturn(optimal(0.0), optimal(2.0));

        OptimizationResult result = optimizer.optimize(baseModel, List.of(first, second));

        List<ModelSnapshot> inputs = capturedSnapshots(2);
        LinearConstraint frozen = inputs.get(1).getConstraints().get(inputs.get(1).getConstraints().size() - 1);
        assertThat(frozen.getName()).isEqualTo("lock_objective_1");
        assertThat(frozen.getOrigin()).isEqualTo(ConstraintOrigin.FROZEN);
        assertThat(frozen.getRelation()).isEqualTo(Relation.LESS_OR_EQUAL);
        assertThat(frozen.getRhs()).isZero();
        assertThat(frozen.getExpression()).isEqualTo(inputs.get(0).getObjective());
        assertThat(inputs.get(0).countConstraints(ConstraintOrigin.FROZEN)).isZero();

        assertThat(result.getStages()).hasSize(2);
        assertThat(result.getStages().get(0).getFrozenBound().getBound()).isZero();
        assertThat(result.getStages().get(1).isFrozen()).isFalse();
    }

    @Test
    @DisplayName("a maximized objective at 5 with 10% tolerance is frozen as expr >= 4.5")
    void maximizeToleranceBound() {
        MaximizePreferredRooms first = new MaximizePreferredRooms(List.of("r1"), 0.1, ObjectiveScope.ALL);
        MinimizeClassesAfter second = new MinimizeClassesAfter(LocalTime.NOON);
        when(solverAdapter.solve(any())).thenReturn(optimal(5.0), optimal(1.0));

        OptimizationResult result = optimizer.optimize(baseModel, List.of(first, second));

        FrozenBound bound = result.getStages().get(0).getFrozenBound();
        assertThat(bound.getRelation()).isEqualTo(Relation.GREATER_OR_EQUAL);
        assertThat(bound.getBound()).isEqualTo(4.5);
        assertThat(bound.getAchievedValue()).isEqualTo(5.0);
        ModelSnapshot secondInput = result.getStages().get(1).getInput();
        assertThat(secondInput.getConstraints()).filteredOn(c -> c.getOrigin() == ConstraintOrigin.FROZEN)
                .singleElement()
                .satisfies(c -> assertThat(c.getRhs()).isEqualTo(4.5));
        assertThat(secondInput.getSense()).isEqualTo(ObjectiveSense.MINIMIZE);
    }

    @Test
    @DisplayName("each stage input extends the previous one and the last objective is never frozen")
    void constraintLogIsAppendOnly() {
        List<SchedulingObjective> objectives = List.of(
                new MinimizeClassesBefore(LocalTime.of(9, 0)),
                new MinimizeClassesAfter(LocalTime.NOON),
                new MaximizePreferredRooms(List.of("r1"), 0.0, ObjectiveScope.ALL));
        when(solverAdapter.solve(any())).thenReturn(optimal(0.0), optimal(1.0), optimal(2.0));

        OptimizationResult result = optimizer.optimize(baseModel, objectives);

        List<StageResult> stages = result.getStages();
        for (int i = 1; i < stages.size(); i++) {
            List<LinearConstraint> previous = stages.get(i - 1).getInput().getConstraints();
            List<LinearConstraint> current = stages.get(i).getInput().getConstraints();
            assertThat(current.subList(0, previous.size())).isEqualTo(previous);
            assertThat(current).hasSize(previous.size() + 1);
        }
        assertThat(stages.get(0).getInputConstraintCount()).isEqualTo(baseModel.getConstraints().size());
        assertThat(stages.get(2).getInput().countConstraints(ConstraintOrigin.FROZEN)).isEqualTo(2);
        assertThat(stages).extracting(StageResult::isFrozen).containsExactly(true, true, false);
        assertThat(baseModel.getConstraints()).noneMatch(c -> c.getOrigin() == ConstraintOrigin.FROZEN);
    }

    @Test
    @DisplayName("infeasibility at stage 1 is a base-model failure")
    void baseInfeasibility() {
        when(solverAdapter.solve(any())).thenReturn(SolveResult.infeasible());

        InfeasibleModelException ex = catchThrowableOfType(() -> optimizer.optimize(baseModel,
                List.of(new MinimizeClassesBefore(LocalTime.NOON), new MinimizeClassesAfter(LocalTime.NOON))),
                InfeasibleModelException.class);

        assertThat(ex.getStageIndex()).isEqualTo(1);
        assertThat(ex.getCompletedStages()).isEmpty();
        verify(solverAdapter, times(1)).solve(any());
    }

    @Test
    @DisplayName("infeasibility after freezing reports the stage and the last frozen bound")
    void stagedInfeasibility() {
        when(solverAdapter.solve(any())).thenReturn(optimal(1.0), SolveResult.infeasible());

        StagedInfeasibilityException ex = catchThrowableOfType(() -> optimizer.optimize(baseModel,
                List.of(new MinimizeClassesBefore(LocalTime.NOON), new MinimizeClassesAfter(LocalTime.NOON),
                        new MaximizePreferredRooms(List.of("r1"), 0.0, ObjectiveScope.ALL))),
                StagedInfeasibilityException.class);

        assertThat(ex.getStageIndex()).isEqualTo(2);
        assertThat(ex.getObjectiveName()).isEqualTo("MinimizeClassesAfter(12:00)");
        assertThat(ex.getFrozenBound().getStageIndex()).isEqualTo(1);
        assertThat(ex.getFrozenBound().getBound()).isEqualTo(1.0);
        assertThat(ex.getCompletedStages()).extracting(StageResult::getAchievedValue).containsExactly(1.0);
        verify(solverAdapter, times(2)).solve(any());
    }

    @Test
    void timeoutAbortsRemainingStages() {
        when(solverAdapter.solve(any())).thenReturn(optimal(0.0), SolveResult.timeout());

        SolverTimeoutException ex = catchThrowableOfType(() -> optimizer.optimize(baseModel,
                List.of(new MinimizeClassesBefore(LocalTime.NOON), new MinimizeClassesAfter(LocalTime.NOON),
                        new MaximizePreferredRooms(List.of("r1"), 0.0, ObjectiveScope.ALL))),
                SolverTimeoutException.class);

        assertThat(ex.getStageIndex()).isEqualTo(2);
        assertThat(ex.getKind()).isEqualTo("SOLVER_TIMEOUT");
        verify(solverAdapter, times(2)).solve(any());
    }

    @Test
    void unboundedStage() {
        when(solverAdapter.solve(any())).thenReturn(SolveResult.unbounded());

        UnboundedObjectiveException ex = catchThrowableOfType(() -> optimizer.optimize(baseModel,
                List.of(new MinimizeClassesBefore(LocalTime.NOON))), UnboundedObjectiveException.class);

        assertThat(ex.getStageIndex()).isEqualTo(1);
    }

    @Test
    @DisplayName("an objective that throws is wrapped with its name and stage, and nothing is solved for it")
    void objectiveFailure() {
        SchedulingObjective broken = new SchedulingObjective() {
            @Override
            public String getName() {
                return "Broken";
            }

            @Override
            public ObjectiveSense getSense() {
                return ObjectiveSense.MINIMIZE;
            }

            @Override
            public double getTolerance() {
                return 0;
            }

            @Override
            public LinearExpression evaluate(ModelContext context) {
                throw new IllegalStateException("cannot evaluate");
            }
        };
        when(solverAdapter.solve(any())).thenReturn(optimal(0.0));

        PluginEvaluationException ex = catchThrowableOfType(() -> optimizer.optimize(baseModel,
                List.of(new MinimizeClassesBefore(LocalTime.NOON), broken)), PluginEvaluationException.class);

        assertThat(ex.getPluginName()).isEqualTo("Broken");
        assertThat(ex.getStageIndex()).isEqualTo(2);
        assertThat(ex.getCompletedStages()).hasSize(1);
        assertThat(ex.getCause()).isInstanceOf(IllegalStateException.class);
        verify(solverAdapter, times(1)).solve(any());
    }

    @Test
    @DisplayName("no objectives means a single feasibility solve without an objective")
    void feasibilityOnly() {
        when(solverAdapter.solve(any())).thenReturn(optimal(0.0));

        OptimizationResult result = optimizer.optimize(baseModel, List.of());

        assertThat(capturedSnapshots(1).get(0).hasObjective()).isFalse();
        assertThat(result.getStages()).singleElement()
                .satisfies(stage -> assertThat(stage.getObjectiveName()).isEqualTo("feasibility"));
    }

    @Test
    void feasibilityOnlyInfeasible() {
        when(solverAdapter.solve(any())).thenReturn(SolveResult.infeasible());

        InfeasibleModelException ex = catchThrowableOfType(() -> optimizer.optimize(baseModel, List.of()),
                InfeasibleModelException.class);

        assertThat(ex.getStageIndex()).isEqualTo(1);
    }

    @Test
    @DisplayName("listeners see every state transition in order")
    void listenerTransitions() {
        when(solverAdapter.solve(any())).thenReturn(optimal(0.0), optimal(0.0));
        List<String> transitions = new ArrayList<>();

        optimizer.optimize(baseModel, List.of(new MinimizeClassesBefore(LocalTime.NOON),
                        new MinimizeClassesAfter(LocalTime.NOON)),
                (state, stage, objective) -> transitions.add(state + ":" + stage));

        assertThat(transitions).containsExactly("IDLE:0", "SOLVING:1", "CONSTRAINING:1", "SOLVING:2", "DONE:2");
    }

    @Test
    void listenerSeesFailure() {
        when(solverAdapter.solve(any())).thenReturn(SolveResult.infeasible());
        List<EngineState> states = new ArrayList<>();

        catchThrowableOfType(() -> optimizer.optimize(baseModel, List.of(new MinimizeClassesBefore(LocalTime.NOON)),
                (state, stage, objective) -> states.add(state)), InfeasibleModelException.class);

        assertThat(states).containsExactly(EngineState.IDLE, EngineState.SOLVING, EngineState.FAILED);
    }
}
