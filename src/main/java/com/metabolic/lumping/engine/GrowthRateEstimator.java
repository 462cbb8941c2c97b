package com.metabolic.lumping.engine;

import com.metabolic.lumping.domain.Reaction;
import com.metabolic.lumping.problem.Objective;
import com.metabolic.lumping.thermo.ThermoFormulation;
import lombok.extern.slf4j.Slf4j;

/**
 * Finds the maximal thermodynamically feasible flux of a biomass reaction. Replaces
 * the objective of the formulation it is given, so use a dedicated one.
 */
@Slf4j
public class GrowthRateEstimator {

    public double maximalGrowth(ThermoFormulation formulation, Reaction biomassReaction) {
        formulation.setObjective(Objective.maximize(formulation.getFluxExpression(biomassReaction)));
        formulation.prepare();
        formulation.convert();
        double growth = formulation.optimize().getObjectiveValue();
        log.info("Maximal feasible growth through {} is {}", biomassReaction.getId(), growth);
        return growth;
    }
}
