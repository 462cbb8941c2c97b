package com.metabolic.lumping.problem;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class SolverSettings {
    // OR-Tools backend id, e.g. "SCIP" or "CBC"
    @Builder.Default
    String solverId = "SCIP";

    @Builder.Default
    double timeLimitSec = 300.0;

    public static SolverSettings defaults() {
        return SolverSettings.builder().build();
    }
}
