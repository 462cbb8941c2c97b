package com.metabolic.lumping.problem;

import lombok.Value;

@Value
public class Objective {

    public enum Direction {
        MAX,
        MIN
    }

    LinearExpression expression;
    Direction direction;

    public static Objective maximize(LinearExpression expression) {
        return new Objective(expression, Direction.MAX);
    }

    public static Objective minimize(LinearExpression expression) {
        return new Objective(expression, Direction.MIN);
    }
}
