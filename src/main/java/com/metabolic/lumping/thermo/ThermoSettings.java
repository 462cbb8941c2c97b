package com.metabolic.lumping.thermo;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class ThermoSettings {
    // Big-M for the coupling of reaction direction to the sign of the free energy
    @Builder.Default
    double bigM = 1000.0;

    // Strictness of the sign: a used direction needs deltaG <= -epsilon
    @Builder.Default
    double epsilon = 1e-6;

    // Default metabolite concentration range (mol/L)
    @Builder.Default
    double minConcentration = 1e-5;
    @Builder.Default
    double maxConcentration = 2e-2;

    @Builder.Default
    double temperature = 298.15; // K

    public static ThermoSettings defaults() {
        return ThermoSettings.builder().build();
    }
}
