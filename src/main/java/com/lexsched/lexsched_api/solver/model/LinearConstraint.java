package com.lexsched.lexsched_api.solver.model;

import java.util.Map;

import lombok.Value;

@Value
public class LinearConstraint {
    String name;
    LinearExpression expression;
    Relation relation;
    double rhs;
    ConstraintOrigin origin;

    public static LinearConstraint equal(String name, LinearExpression expression, double rhs) {
        return new LinearConstraint(name, expression, Relation.EQUAL, rhs, ConstraintOrigin.BASE);
    }

    public static LinearConstraint lessOrEqual(String name, LinearExpression expression, double rhs) {
        return new LinearConstraint(name, expression, Relation.LESS_OR_EQUAL, rhs, ConstraintOrigin.BASE);
    }

    public static LinearConstraint greaterOrEqual(String name, LinearExpression expression, double rhs) {
        return new LinearConstraint(name, expression, Relation.GREATER_OR_EQUAL, rhs, ConstraintOrigin.BASE);
    }

    public boolean isSatisfiedBy(Map<DecisionVariable, Integer> assignment) {
        return relation.holds(expression.evaluate(assignment), rhs);
    }

    @Override
    public String toString() {
        return name + ": " + expression + " " + relation.getSymbol() + " " + rhs;
    }
}
