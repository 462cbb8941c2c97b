package com.metabolic.lumping.problem;

import com.metabolic.lumping.domain.Reaction;

/**
 * Lower bound on the net flux of a biomass reaction. Only lives for one lumping call.
 */
public class GrowthConstraint extends ReactionConstraint {

    public GrowthConstraint(Reaction biomassReaction, LinearExpression fluxExpression, double growthRate) {
        super(biomassReaction, fluxExpression, growthRate, Double.POSITIVE_INFINITY);
    }

    @Override
    protected String getPrefix() {
        return "GR_";
    }
}
