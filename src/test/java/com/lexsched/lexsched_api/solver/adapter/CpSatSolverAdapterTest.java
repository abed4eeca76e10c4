package com.lexsched.lexsched_api.solver.adapter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.lexsched.lexsched_api.solver.model.ConstraintOrigin;
import com.lexsched.lexsched_api.solver.model.DecisionVariable;
import com.lexsched.lexsched_api.solver.model.LinearConstraint;
import com.lexsched.lexsched_api.solver.model.LinearExpression;
import com.lexsched.lexsched_api.solver.model.ModelSnapshot;
import com.lexsched.lexsched_api.solver.model.ObjectiveSense;
import com.lexsched.lexsched_api.solver.model.Relation;

class CpSatSolverAdapterTest {

    private final CpSatSolverAdapter adapter = new CpSatSolverAdapter(Duration.ofSeconds(10), 2, false);

    private static List<DecisionVariable> vars(int n) {
        List<DecisionVariable> vars = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            vars.add(new DecisionVariable(i, "v" + i, null));
        }
        return vars;
    }

    private static ModelSnapshot snapshot(List<DecisionVariable> vars, List<LinearConstraint> rows,
                                          LinearExpression objective, ObjectiveSense sense) {
        return new ModelSnapshot(vars, rows, objective, sense);
    }

    @Test
    @DisplayName("optimal assignment and objective value for a small model")
    void solvesSmallModel() {
        List<DecisionVariable> v = vars(3);
        LinearConstraint pickOne = LinearConstraint.equal("one", LinearExpression.sum(v), 1);
        LinearExpression cost = LinearExpression.builder().add(v.get(0), 3).add(v.get(1), 1).add(v.get(2), 2).build();

        SolveResult result = adapter.solve(snapshot(v, List.of(pickOne), cost, ObjectiveSense.MINIMIZE));

        assertThat(result.getStatus()).isEqualTo(SolveStatus.OPTIMAL);
        assertThat(result.getObjectiveValue()).isEqualTo(1.0);
        assertThat(result.getAssignment()).containsEntry(v.get(1), 1).containsEntry(v.get(0), 0).containsEntry(v.get(2), 0);
    }

    @Test
    @DisplayName("fractional bounds round toward the feasible side")
    void fractionalBounds() {
        List<DecisionVariable> v = vars(3);
        LinearConstraint atLeast = LinearConstraint.greaterOrEqual("atLeast", LinearExpression.sum(v), 1.5);

        SolveResult min = adapter.solve(snapshot(v, List.of(atLeast), LinearExpression.sum(v), ObjectiveSense.MINIMIZE));
        assertThat(min.getObjectiveValue()).isEqualTo(2.0);

        LinearConstraint atMost = LinearConstraint.lessOrEqual("atMost", LinearExpression.sum(v), 2.7);
        SolveResult max = adapter.solve(snapshot(v, List.of(atMost), LinearExpression.sum(v), ObjectiveSense.MAXIMIZE));
        assertThat(max.getObjectiveValue()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("decimal coefficients are scaled to integers")
    void decimalCoefficients() {
        List<DecisionVariable> v = vars(2);
        LinearConstraint oneOf = LinearConstraint.lessOrEqual("oneOf", LinearExpression.sum(v), 1);
        LinearExpression value = LinearExpression.builder().add(v.get(0), 0.5).add(v.get(1), 0.25).build();

        SolveResult result = adapter.solve(snapshot(v, List.of(oneOf), value, ObjectiveSense.MAXIMIZE));

        assertThat(result.getObjectiveValue()).isEqualTo(0.5);
        assertThat(CpSatSolverAdapter.scaleFactor(List.of(0.5, 0.25))).isEqualTo(100);
        assertThat(CpSatSolverAdapter.scaleFactor(List.of(3.0, 7.0))).isEqualTo(1);
        assertThatThrownBy(() -> CpSatSolverAdapter.scaleFactor(List.of(Math.PI)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("a row with no terms is checked against its constant")
    void emptyRows() {
        List<DecisionVariable> v = vars(1);
        LinearConstraint impossible = LinearConstraint.equal("impossible", LinearExpression.zero(), 1);
        LinearConstraint trivial = LinearConstraint.lessOrEqual("trivial", LinearExpression.zero(), 1);

        assertThat(adapter.solve(snapshot(v, List.of(impossible), null, null)).getStatus())
                .isEqualTo(SolveStatus.INFEASIBLE);
        assertThat(adapter.solve(snapshot(v, List.of(trivial), null, null)).getStatus())
                .isEqualTo(SolveStatus.OPTIMAL);
    }

    @Test
    void conflictingRowsAreInfeasible() {
        List<DecisionVariable> v = vars(2);
        List<LinearConstraint> rows = List.of(
                LinearConstraint.equal("both", LinearExpression.sum(v), 2),
                new LinearConstraint("cap", LinearExpression.sum(v), Relation.LESS_OR_EQUAL, 1, ConstraintOrigin.FROZEN));

        SolveResult result = adapter.solve(snapshot(v, rows, LinearExpression.sum(v), ObjectiveSense.MINIMIZE));

        assertThat(result.getStatus()).isEqualTo(SolveStatus.INFEASIBLE);
        assertThat(result.isOptimal()).isFalse();
    }

    @Test
    @DisplayName("a fractional equality target cannot be met by binaries")
    void fractionalEquality() {
        List<DecisionVariable> v = vars(2);

        SolveResult result = adapter.solve(snapshot(v,
                List.of(LinearConstraint.equal("half", LinearExpression.sum(v), 0.5)), null, null));

        assertThat(result.getStatus()).isEqualTo(SolveStatus.INFEASIBLE);
    }

    @Test
    @DisplayName("objective constants are included in the reported value")
    void objectiveConstant() {
        List<DecisionVariable> v = vars(1);
        LinearExpression shifted = LinearExpression.builder().add(v.get(0)).addConstant(-4).build();

        SolveResult result = adapter.solve(snapshot(v, List.of(), shifted, ObjectiveSense.MAXIMIZE));

        assertThat(result.getObjectiveValue()).isEqualTo(-3.0);
    }

    @Test
    void rejectsBadSettings() {
        assertThatThrownBy(() -> new CpSatSolverAdapter(Duration.ZERO, 1, false))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CpSatSolverAdapter(Duration.ofSeconds(1), 0, false))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
