package com.lexsched.lexsched_api.solver.model;

public enum Relation {
    LESS_OR_EQUAL("<="),
    GREATER_OR_EQUAL(">="),
    EQUAL("==");

    private static final double EPSILON = 1e-6;

    private final String symbol;

    Relation(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean holds(double lhs, double rhs) {
        switch (this) {
            case LESS_OR_EQUAL: return lhs <= rhs + EPSILON;
            case GREATER_OR_EQUAL: return lhs >= rhs - EPSILON;
            default: return Math.abs(lhs - rhs) <= EPSILON;
        }
    }
}
