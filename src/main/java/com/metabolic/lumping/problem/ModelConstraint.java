package com.metabolic.lumping.problem;

import lombok.Getter;

import java.util.Map;

/**
 * A linear constraint {@code lowerBound <= expression <= upperBound}. Use infinite
 * bounds for one-sided constraints.
 */
@Getter
public abstract class ModelConstraint extends ProblemElement {

    private final LinearExpression expression;
    private final double lowerBound;
    private final double upperBound;

    protected ModelConstraint(String id, LinearExpression expression, double lowerBound, double upperBound) {
        super(id);
        this.expression = expression;
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
    }

    /**
     * Checks the constraint against a primal assignment, with the given tolerance.
     */
    public boolean isSatisfied(Map<String, Double> primals, double tolerance) {
        double value = expression.evaluate(primals);
        return value >= lowerBound - tolerance && value <= upperBound + tolerance;
    }
}
