package com.metabolic.lumping.engine;

import com.metabolic.lumping.domain.Reaction;
import com.metabolic.lumping.problem.CouplingConstraint;
import com.metabolic.lumping.problem.IndicatorVariable;
import com.metabolic.lumping.thermo.ThermoFormulation;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Ties the flux of each non-core reaction to its indicator and the carbon uptake
 * bound C: {@code forward + reverse + C * indicator <= C}.
 */
public class CouplingConstraintBuilder {

    private final double carbonUptake;

    public CouplingConstraintBuilder(double carbonUptake) {
        if (carbonUptake < 0) {
            throw new IllegalArgumentException("Carbon uptake must not be negative: " + carbonUptake);
        }
        this.carbonUptake = carbonUptake;
    }

    public List<CouplingConstraint> build(Map<Reaction, IndicatorVariable> indicators, ThermoFormulation formulation) {
        List<CouplingConstraint> constraints = new ArrayList<>(indicators.size());
        indicators.forEach((reaction, indicator) -> {
            CouplingConstraint constraint = new CouplingConstraint(reaction,
                    formulation.getForwardVariable(reaction), formulation.getReverseVariable(reaction),
                    indicator, carbonUptake);
            formulation.addConsVars(constraint);
            constraints.add(constraint);
        });
        return constraints;
    }
}
