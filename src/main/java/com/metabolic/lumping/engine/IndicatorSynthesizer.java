package com.metabolic.lumping.engine;

import com.metabolic.lumping.domain.Reaction;
import com.metabolic.lumping.problem.IndicatorVariable;
import com.metabolic.lumping.thermo.ThermoFormulation;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Registers one binary indicator per non-core reaction.
 */
public class IndicatorSynthesizer {

    /**
     * @return the indicator of each reaction, in the order of the input
     */
    public Map<Reaction, IndicatorVariable> synthesize(Collection<Reaction> nonCore, ThermoFormulation formulation) {
        Map<Reaction, IndicatorVariable> indicators = new LinkedHashMap<>();
        for (Reaction reaction : nonCore) {
            IndicatorVariable indicator = new IndicatorVariable(reaction);
            formulation.addConsVars(indicator);
            indicators.put(reaction, indicator);
        }
        return Collections.unmodifiableMap(indicators);
    }
}
