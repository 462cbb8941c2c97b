package com.metabolic.lumping.domain;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;
import lombok.ToString;

import java.util.Map;

/**
 * A reaction of the metabolic network. Everything except the thermodynamic info is
 * fixed once the model is loaded.
 */
@Getter
@Builder
@ToString(of = {"id", "subsystem", "lowerBound", "upperBound"})
@EqualsAndHashCode(of = "id")
public class Reaction {

    public static final double DEFAULT_BOUND = 1000.0;

    @NonNull
    private final String id;
    private final String name;
    private final String subsystem;

    // Metabolite id -> coefficient (negative for reactants)
    @Singular
    private final Map<String, Double> metabolites;

    @Builder.Default
    private final double lowerBound = 0.0;
    @Builder.Default
    private final double upperBound = DEFAULT_BOUND;

    @Builder.Default
    private final ThermoInfo thermo = ThermoInfo.notComputed();

    public Stoichiometry getStoichiometry() {
        return Stoichiometry.of(metabolites);
    }

    public double getCoefficient(String metaboliteId) {
        return metabolites.getOrDefault(metaboliteId, 0.0);
    }

    public boolean isReversible() {
        return lowerBound < 0 && upperBound > 0;
    }

    // Bounds of the split flux variables: flux = forward - reverse
    public double getForwardUpperBound() {
        return Math.max(0.0, upperBound);
    }

    public double getForwardLowerBound() {
        return Math.max(0.0, lowerBound);
    }

    public double getReverseUpperBound() {
        return Math.max(0.0, -lowerBound);
    }

    public double getReverseLowerBound() {
        return Math.max(0.0, -upperBound);
    }
}
