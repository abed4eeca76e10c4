package com.lexsched.lexsched_api.solver.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable model owned by a single build or optimization run. Constraints form an
 * append-only log: rows are added, never removed or rewritten.
 */
public final class ScheduleModel {

    private final List<DecisionVariable> variables;
    private final List<LinearConstraint> constraints;
    private final Map<String, DecisionVariable> indicators = new LinkedHashMap<>();
    private LinearExpression objective;
    private ObjectiveSense sense;

    ScheduleModel(Collection<DecisionVariable> variables, Collection<LinearConstraint> constraints) {
        this.variables = new ArrayList<>(variables);
        this.constraints = new ArrayList<>(constraints);
        for (int i = 0; i < this.variables.size(); i++) {
            if (this.variables.get(i).getIndex() != i) {
                throw new IllegalArgumentException("Variable indices must be dense; " + this.variables.get(i) + " at position " + i);
            }
        }
    }

    public List<DecisionVariable> getVariables() {
        return Collections.unmodifiableList(variables);
    }

    public List<LinearConstraint> getConstraints() {
        return Collections.unmodifiableList(constraints);
    }

    public int constraintCount() {
        return constraints.size();
    }

    public LinearExpression getObjective() {
        return objective;
    }

    public ObjectiveSense getSense() {
        return sense;
    }

    public void addConstraint(LinearConstraint constraint) {
        for (DecisionVariable variable : constraint.getExpression().getTerms().keySet()) {
            if (variable.getIndex() >= variables.size() || variables.get(variable.getIndex()) != variable) {
                throw new IllegalArgumentException("Constraint " + constraint.getName() + " references foreign variable " + variable);
            }
        }
        constraints.add(constraint);
    }

    public void setObjective(LinearExpression objective, ObjectiveSense sense) {
        this.objective = objective;
        this.sense = sense;
    }

    public void clearObjective() {
        this.objective = null;
        this.sense = null;
    }

    /**
     * Binary variable forced to 1 whenever any of {@code sources} is 1, via rows {@code y >= x}.
     * Minimizing (or upper-bounding) a sum of indicators makes each one equal to the OR of its sources.
     * Repeated calls with the same name return the same variable and add no rows.
     */
    public DecisionVariable indicator(String name, Collection<DecisionVariable> sources) {
        DecisionVariable existing = indicators.get(name);
        if (existing != null) {
            return existing;
        }
        DecisionVariable indicator = new DecisionVariable(variables.size(), name, null);
        variables.add(indicator);
        indicators.put(name, indicator);
        for (DecisionVariable source : sources) {
            LinearExpression link = LinearExpression.builder().add(indicator).add(source, -1.0).build();
            addConstraint(new LinearConstraint("link_" + name + "_" + source.getName(), link,
                    Relation.GREATER_OR_EQUAL, 0.0, ConstraintOrigin.AUXILIARY));
        }
        return indicator;
    }

    public ModelSnapshot snapshot() {
        return new ModelSnapshot(List.copyOf(variables), List.copyOf(constraints), objective, sense);
    }
}
