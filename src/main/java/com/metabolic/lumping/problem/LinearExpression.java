package com.metabolic.lumping.problem;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable linear combination of model variables plus a constant.
 */
public final class LinearExpression {

    private static final LinearExpression ZERO = new LinearExpression(Collections.emptyMap(), 0.0);

    private final Map<ModelVariable, Double> terms;
    private final double constant;

    private LinearExpression(Map<ModelVariable, Double> terms, double constant) {
        this.terms = Collections.unmodifiableMap(terms);
        this.constant = constant;
    }

    public static LinearExpression zero() {
        return ZERO;
    }

    public static LinearExpression of(ModelVariable variable) {
        return ZERO.plus(variable, 1.0);
    }

    /**
     * @return the sum of the variables, or the empty sum (zero) when there are none
     */
    public static LinearExpression sum(Collection<? extends ModelVariable> variables) {
        Map<ModelVariable, Double> sum = new LinkedHashMap<>();
        for (ModelVariable variable : variables) {
            sum.merge(variable, 1.0, Double::sum);
        }
        return new LinearExpression(sum, 0.0);
    }

    public LinearExpression plus(ModelVariable variable, double coefficient) {
        Map<ModelVariable, Double> next = new LinkedHashMap<>(terms);
        next.merge(variable, coefficient, Double::sum);
        return new LinearExpression(next, constant);
    }

    public LinearExpression plus(LinearExpression other) {
        Map<ModelVariable, Double> next = new LinkedHashMap<>(terms);
        other.terms.forEach((var, coef) -> next.merge(var, coef, Double::sum));
        return new LinearExpression(next, constant + other.constant);
    }

    public LinearExpression plusConstant(double value) {
        return new LinearExpression(terms, constant + value);
    }

    public LinearExpression times(double factor) {
        Map<ModelVariable, Double> next = new LinkedHashMap<>();
        terms.forEach((var, coef) -> next.put(var, coef * factor));
        return new LinearExpression(next, constant * factor);
    }

    public Map<ModelVariable, Double> getTerms() {
        return terms;
    }

    public double getCoefficient(ModelVariable variable) {
        return terms.getOrDefault(variable, 0.0);
    }

    public double getConstant() {
        return constant;
    }

    /**
     * Evaluates the expression; variables missing from the assignment count as zero.
     */
    public double evaluate(Map<String, Double> primals) {
        double value = constant;
        for (Map.Entry<ModelVariable, Double> term : terms.entrySet()) {
            value += term.getValue() * primals.getOrDefault(term.getKey().getName(), 0.0);
        }
        return value;
    }

    @Override
    public String toString() {
        StringBuilder text = new StringBuilder();
        terms.forEach((var, coef) -> {
            if (text.length() > 0) {
                text.append(coef < 0 ? " - " : " + ");
            } else if (coef < 0) {
                text.append("-");
            }
            text.append(Math.abs(coef)).append('*').append(var.getName());
        });
        if (constant != 0.0 || text.length() == 0) {
            if (text.length() > 0) {
                text.append(constant < 0 ? " - " : " + ").append(Math.abs(constant));
            } else {
                text.append(constant);
            }
        }
        return text.toString();
    }
}
