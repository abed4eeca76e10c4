package com.lexsched.lexsched_api.solver.adapter;

import java.time.Duration;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.ortools.Loader;
import com.google.ortools.sat.BoolVar;
import com.google.ortools.sat.CpModel;
import com.google.ortools.sat.CpSolver;
import com.google.ortools.sat.CpSolverStatus;
import com.google.ortools.sat.LinearExpr;
import com.google.ortools.sat.LinearExprBuilder;
import com.lexsched.lexsched_api.solver.model.DecisionVariable;
import com.lexsched.lexsched_api.solver.model.LinearConstraint;
import com.lexsched.lexsched_api.solver.model.LinearExpression;
import com.lexsched.lexsched_api.solver.model.ModelSnapshot;

/**
 * {@link SolverAdapter} backed by OR-Tools CP-SAT. CP-SAT only accepts integer coefficients, so every
 * row is scaled by the smallest power of ten that makes its coefficients integral; right-hand sides are
 * then rounded in the direction that keeps the row equivalent over integer-valued expressions.
 */
public class CpSatSolverAdapter implements SolverAdapter {

    private static final Logger logger = LoggerFactory.getLogger(CpSatSolverAdapter.class);

    private static final int MAX_DECIMALS = 6;
    private static final double EPSILON = 1e-9;
    private static volatile boolean nativeLoaded;

    private final Duration timeLimit;
    private final int numWorkers;
    private final boolean logSearchProgress;

    public CpSatSolverAdapter(Duration timeLimit, int numWorkers, boolean logSearchProgress) {
        if (timeLimit == null || timeLimit.isNegative() || timeLimit.isZero()) {
            throw new IllegalArgumentException("Solver time limit must be positive, got " + timeLimit);
        }
        if (numWorkers < 1) {
            throw new IllegalArgumentException("Solver needs at least one worker, got " + numWorkers);
        }
        this.timeLimit = timeLimit;
        this.numWorkers = numWorkers;
        this.logSearchProgress = logSearchProgress;
    }

    private static void ensureNativeLibraries() {
        if (!nativeLoaded) {
            synchronized (CpSatSolverAdapter.class) {
                if (!nativeLoaded) {
                    Loader.loadNativeLibraries();
                    nativeLoaded = true;
                    logger.info("OR-Tools native libraries loaded");
                }
            }
        }
    }

    @Override
    public SolveResult solve(ModelSnapshot snapshot) {
        ensureNativeLibraries();
        CpModel model = new CpModel();
        List<DecisionVariable> variables = snapshot.getVariables();
        BoolVar[] vars = new BoolVar[variables.size()];
        for (DecisionVariable variable : variables) {
            vars[variable.getIndex()] = model.newBoolVar(variable.getName());
        }

        for (LinearConstraint constraint : snapshot.getConstraints()) {
            if (!addConstraint(model, vars, constraint)) {
                logger.debug("Constraint {} is unsatisfiable on its own", constraint);
                return SolveResult.infeasible();
            }
        }

        if (snapshot.hasObjective() && snapshot.getObjective().hasTerms()) {
            LinearExpression objective = snapshot.getObjective();
            long scale = scaleFactor(objective.getTerms().values());
            LinearExpr expr = toLinearExpr(vars, objective, scale);
            switch (snapshot.getSense()) {
                case MAXIMIZE:
                    model.maximize(expr);
                    break;
                case MINIMIZE:
                default:
                    model.minimize(expr);
                    break;
            }
        }

        CpSolver solver = new CpSolver();
        solver.getParameters()
                .setMaxTimeInSeconds(timeLimit.toMillis() / 1000.0)
                .setNumWorkers(numWorkers)
                .setLogSearchProgress(logSearchProgress);

        long started = System.currentTimeMillis();
        CpSolverStatus status = solver.solve(model);
        logger.debug("CP-SAT finished with {} in {} ms", status, System.currentTimeMillis() - started);

        switch (status) {
            case OPTIMAL:
                Map<DecisionVariable, Integer> assignment = new HashMap<>(variables.size() * 2);
                for (DecisionVariable variable : variables) {
                    assignment.put(variable, solver.booleanValue(vars[variable.getIndex()]) ? 1 : 0);
                }
                double value = snapshot.hasObjective() ? snapshot.getObjective().evaluate(assignment) : 0.0;
                return SolveResult.optimal(assignment, value);
            case INFEASIBLE:
                return SolveResult.infeasible();
            case FEASIBLE:
            case UNKNOWN:
                logger.warn("CP-SAT stopped with {} after the {} time limit", status, timeLimit);
                return SolveResult.timeout();
            case MODEL_INVALID:
            default:
                throw new IllegalStateException("CP-SAT rejected the model: " + status + " " + model.validate());
        }
    }

    /**
     * @return false when the row has no variables and its constant already violates it
     */
    private static boolean addConstraint(CpModel model, BoolVar[] vars, LinearConstraint constraint) {
        LinearExpression expression = constraint.getExpression();
        double rhs = constraint.getRhs() - expression.getConstant();
        if (!expression.hasTerms()) {
            return constraint.getRelation().holds(0.0, rhs);
        }
        long scale = scaleFactor(expression.getTerms().values());
        LinearExpr lhs = toLinearExpr(vars, expression, scale);
        double scaledRhs = rhs * scale;
        switch (constraint.getRelation()) {
            case LESS_OR_EQUAL:
                model.addLessOrEqual(lhs, (long) Math.floor(scaledRhs + EPSILON));
                return true;
            case GREATER_OR_EQUAL:
                model.addGreaterOrEqual(lhs, (long) Math.ceil(scaledRhs - EPSILON));
                return true;
            case EQUAL:
            default:
                long rounded = Math.round(scaledRhs);
                if (Math.abs(scaledRhs - rounded) > EPSILON * Math.max(1.0, Math.abs(scaledRhs))) {
                    // integral left side can never hit a fractional target
                    return false;
                }
                model.addEquality(lhs, rounded);
                return true;
        }
    }

    private static LinearExpr toLinearExpr(BoolVar[] vars, LinearExpression expression, long scale) {
        LinearExprBuilder builder = LinearExpr.newBuilder();
        for (Map.Entry<DecisionVariable, Double> term : expression.getTerms().entrySet()) {
            builder.addTerm(vars[term.getKey().getIndex()], Math.round(term.getValue() * scale));
        }
        return builder.build();
    }

    static long scaleFactor(Collection<Double> coefficients) {
        long scale = 1;
        for (int decimals = 0; decimals <= MAX_DECIMALS; decimals++, scale *= 10) {
            if (allIntegral(coefficients, scale)) {
                return scale;
            }
        }
        throw new IllegalArgumentException("Coefficients need more than " + MAX_DECIMALS + " decimals: " + coefficients);
    }

    private static boolean allIntegral(Collection<Double> coefficients, long scale) {
        for (double coefficient : coefficients) {
            double scaled = coefficient * scale;
            if (Math.abs(scaled - Math.rint(scaled)) > EPSILON * Math.max(1.0, Math.abs(scaled))) {
                return false;
            }
        }
        return true;
    }
}
