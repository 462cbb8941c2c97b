package com.metabolic.lumping.problem;

import lombok.Getter;

@Getter
public abstract class ModelVariable extends ProblemElement {

    private final double lowerBound;
    private final double upperBound;
    private final boolean integer;

    protected ModelVariable(String id, double lowerBound, double upperBound, boolean integer) {
        super(id);
        if (lowerBound > upperBound) {
            throw new IllegalArgumentException("Variable " + id + " has lower bound " + lowerBound
                    + " above upper bound " + upperBound);
        }
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
        this.integer = integer;
    }

    public boolean isBinary() {
        return integer && lowerBound == 0.0 && upperBound == 1.0;
    }
}
