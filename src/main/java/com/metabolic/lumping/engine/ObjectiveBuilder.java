package com.metabolic.lumping.engine;

import com.metabolic.lumping.problem.IndicatorVariable;
import com.metabolic.lumping.problem.LinearExpression;
import com.metabolic.lumping.problem.Objective;
import com.metabolic.lumping.thermo.ThermoFormulation;

import java.util.Collection;

public class ObjectiveBuilder {

    /**
     * Sets and returns {@code maximize sum(indicators)}; zero when there are none.
     */
    public Objective build(Collection<IndicatorVariable> indicators, ThermoFormulation formulation) {
        Objective objective = Objective.maximize(LinearExpression.sum(indicators));
        formulation.setObjective(objective);
        return objective;
    }
}
