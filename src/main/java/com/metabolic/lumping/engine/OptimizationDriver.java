package com.metabolic.lumping.engine;

import com.metabolic.lumping.domain.Reaction;
import com.metabolic.lumping.problem.OptimizationSolution;
import com.metabolic.lumping.thermo.ThermoFormulation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;

/**
 * Runs one thermodynamic solve with the non-core reactions exempt from the
 * thermodynamic constraints. Nothing is cached: every call prepares, converts and
 * solves again.
 */
@Slf4j
@RequiredArgsConstructor
public class OptimizationDriver {

    private final ThermoFormulation formulation;
    private final Collection<Reaction> nonCore;

    /**
     * @throws com.metabolic.lumping.problem.OptimizationFailedException if the solve fails
     */
    public OptimizationSolution runOptimisation() {
        long startTime = System.currentTimeMillis();

        formulation.prepare();
        for (Reaction reaction : nonCore) {
            reaction.getThermo().setComputed(false);
        }
        formulation.convert();

        OptimizationSolution solution = formulation.optimize();
        log.debug("Optimization finished with {} (objective {}) in {} ms", solution.getStatus(),
                solution.getObjectiveValue(), System.currentTimeMillis() - startTime);
        return solution;
    }
}
