package com.lexsched.lexsched_api.solver.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable affine expression {@code sum(coefficient * variable) + constant}.
 * Terms keep insertion order so that rendered models are reproducible.
 */
public final class LinearExpression {

    private static final LinearExpression ZERO = new LinearExpression(Collections.emptyMap(), 0.0);

    private final Map<DecisionVariable, Double> terms;
    private final double constant;

    private LinearExpression(Map<DecisionVariable, Double> terms, double constant) {
        this.terms = terms;
        this.constant = constant;
    }

    public static LinearExpression zero() {
        return ZERO;
    }

    public static LinearExpression sum(Collection<DecisionVariable> variables) {
        Builder builder = builder();
        variables.forEach(builder::add);
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<DecisionVariable, Double> getTerms() {
        return terms;
    }

    public double getConstant() {
        return constant;
    }

    public boolean hasTerms() {
        return !terms.isEmpty();
    }

    public double coefficient(DecisionVariable variable) {
        return terms.getOrDefault(variable, 0.0);
    }

    /**
     * Value of the expression under a 0/1 assignment; variables missing from the map count as 0.
     */
    public double evaluate(Map<DecisionVariable, Integer> assignment) {
        double value = constant;
        for (Map.Entry<DecisionVariable, Double> term : terms.entrySet()) {
            Integer v = assignment.get(term.getKey());
            if (v != null && v != 0) {
                value += term.getValue() * v;
            }
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LinearExpression)) return false;
        LinearExpression that = (LinearExpression) o;
        return Double.compare(constant, that.constant) == 0 && terms.equals(that.terms);
    }

    @Override
    public int hashCode() {
        return Objects.hash(terms, constant);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<DecisionVariable, Double> term : terms.entrySet()) {
            if (sb.length() > 0) sb.append(" + ");
            double c = term.getValue();
            if (c != 1.0) sb.append(c).append('*');
            sb.append(term.getKey().getName());
        }
        if (constant != 0.0 || sb.length() == 0) {
            if (sb.length() > 0) sb.append(" + ");
            sb.append(constant);
        }
        return sb.toString();
    }

    public static final class Builder {
        private final Map<DecisionVariable, Double> terms = new LinkedHashMap<>();
        private double constant;

        private Builder() {}

        public Builder add(DecisionVariable variable) {
            return add(variable, 1.0);
        }

        public Builder add(DecisionVariable variable, double coefficient) {
            Objects.requireNonNull(variable, "variable");
            if (!Double.isFinite(coefficient)) {
                throw new IllegalArgumentException("Coefficient for " + variable.getName() + " must be finite, got " + coefficient);
            }
            terms.merge(variable, coefficient, Double::sum);
            return this;
        }

        public Builder addConstant(double value) {
            constant += value;
            return this;
        }

        public LinearExpression build() {
            terms.values().removeIf(c -> c == 0.0);
            if (terms.isEmpty() && constant == 0.0) {
                return ZERO;
            }
            return new LinearExpression(Collections.unmodifiableMap(new LinkedHashMap<>(terms)), constant);
        }
    }
}
