package com.metabolic.lumping.engine;

import com.metabolic.lumping.domain.LumpedReaction;
import com.metabolic.lumping.domain.Partition;
import com.metabolic.lumping.domain.Reaction;
import com.metabolic.lumping.domain.Stoichiometry;
import com.metabolic.lumping.problem.GrowthConstraint;
import com.metabolic.lumping.problem.IndicatorVariable;
import com.metabolic.lumping.problem.OptimizationSolution;
import com.metabolic.lumping.thermo.ThermoFormulation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Computes the lumped reaction of one biomass reaction: force growth through it,
 * solve, and add up the flux-weighted stoichiometries of the core reactions and of
 * the non-core reactions weighted by their indicators.
 */
@Slf4j
@RequiredArgsConstructor
public class Lumper {

    private final ThermoFormulation formulation;
    private final OptimizationDriver driver;
    private final Partition partition;
    private final Map<Reaction, IndicatorVariable> indicators;
    private final double growthRate;

    /**
     * The growth constraint added for the solve is removed again on every exit path,
     * so a failed solve leaves the problem as it was.
     *
     * @throws IllegalStateException if another growth constraint is active in the problem
     * @throws com.metabolic.lumping.problem.OptimizationFailedException if the solve fails
     */
    public LumpedReaction lumpReaction(Reaction biomassReaction) {
        if (!formulation.getProblem().getConstraints(GrowthConstraint.class).isEmpty()) {
            throw new IllegalStateException("A growth constraint is already active; lumping calls must not overlap");
        }
        GrowthConstraint growth = new GrowthConstraint(biomassReaction,
                formulation.getFluxExpression(biomassReaction), growthRate);
        formulation.addConsVars(growth);
        try {
            OptimizationSolution solution = driver.runOptimisation();
            return aggregate(biomassReaction, solution);
        } finally {
            formulation.removeConsVars(growth);
        }
    }

    private LumpedReaction aggregate(Reaction biomassReaction, OptimizationSolution solution) {
        Map<String, Double> fluxes = new LinkedHashMap<>();
        Map<String, Double> indicatorValues = new LinkedHashMap<>();

        Stoichiometry lumpedCore = Stoichiometry.empty();
        for (Reaction reaction : partition.getCore()) {
            double flux = solution.getFlux(reaction.getId());
            fluxes.put(reaction.getId(), flux);
            lumpedCore = lumpedCore.plus(reaction.getStoichiometry().scale(flux));
        }

        Stoichiometry lumpedNonCore = Stoichiometry.empty();
        for (Reaction reaction : partition.getNonCore()) {
            double flux = solution.getFlux(reaction.getId());
            IndicatorVariable indicator = indicators.get(reaction);
            double active = indicator == null ? 0.0 : solution.getPrimal(indicator);
            fluxes.put(reaction.getId(), flux);
            indicatorValues.put(reaction.getId(), active);
            lumpedNonCore = lumpedNonCore.plus(reaction.getStoichiometry().scale(flux * active));
        }

        Stoichiometry lumped = lumpedCore.plus(lumpedNonCore);
        log.info("Lumped {}: {}", biomassReaction.getId(), lumped.toFormula());
        return LumpedReaction.builder()
                .biomassReactionId(biomassReaction.getId())
                .stoichiometry(lumped)
                .fluxes(fluxes)
                .indicatorValues(indicatorValues)
                .objectiveValue(solution.getObjectiveValue())
                .solverStatus(solution.getStatus())
                .build();
    }
}
