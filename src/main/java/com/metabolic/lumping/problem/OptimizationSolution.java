package com.metabolic.lumping.problem;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Primal solution returned by a solve. Lookups of unknown reactions or variables
 * return zero.
 */
@Value
@Builder(toBuilder = true)
public class OptimizationSolution {
    String status;
    double objectiveValue;

    @Singular
    Map<String, Double> fluxes;   // Reaction ID -> net flux
    @Singular
    Map<String, Double> primals;  // Variable name -> value

    public double getFlux(String reactionId) {
        return fluxes.getOrDefault(reactionId, 0.0);
    }

    public double getPrimal(String variableName) {
        return primals.getOrDefault(variableName, 0.0);
    }

    public double getPrimal(ModelVariable variable) {
        return getPrimal(variable.getName());
    }
}
