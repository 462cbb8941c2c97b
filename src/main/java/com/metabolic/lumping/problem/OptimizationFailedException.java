package com.metabolic.lumping.problem;

import lombok.Getter;

/**
 * Raised when the solver does not return a usable primal solution: infeasible,
 * unbounded, abnormal termination, time limit without a feasible point, or the
 * requested backend is not available.
 */
@Getter
public class OptimizationFailedException extends RuntimeException {

    private final String status;

    public OptimizationFailedException(String status, String message) {
        super(message);
        this.status = status;
    }
}
