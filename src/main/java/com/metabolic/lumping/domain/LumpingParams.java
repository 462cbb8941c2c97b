package com.metabolic.lumping.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class LumpingParams {
    // Carbon atoms per unit time an active non-core reaction may move
    private double carbonUptake;

    // Minimal biomass flux (1/h). Null means auto: a fraction of the maximal feasible growth
    private Double growthRate;

    // Fraction of the maximal growth used when the growth rate is auto
    @Builder.Default
    private double autoGrowthFraction = 0.95;

    // Advanced solver settings
    @Builder.Default
    private String solverId = "SCIP";
    @Builder.Default
    private double solverTimeoutSec = 300.0;

    public boolean isAutoGrowthRate() {
        return growthRate == null;
    }

    public static LumpingParams defaults() {
        return LumpingParams.builder()
                .carbonUptake(10.0)
                .build();
    }
}
