package com.metabolic.lumping.problem;

import com.metabolic.lumping.domain.Reaction;
import lombok.Getter;

/**
 * {@code forward + reverse + C * indicator <= C} for a non-core reaction, C being the
 * carbon uptake bound.
 */
@Getter
public class CouplingConstraint extends ReactionConstraint {

    private final IndicatorVariable indicator;
    private final double carbonUptake;

    public CouplingConstraint(Reaction reaction, ForwardFluxVariable forward, ReverseFluxVariable reverse,
                              IndicatorVariable indicator, double carbonUptake) {
        super(reaction,
                LinearExpression.of(forward)
                        .plus(reverse, 1.0)
                        .plus(indicator, carbonUptake),
                Double.NEGATIVE_INFINITY, carbonUptake);
        this.indicator = indicator;
        this.carbonUptake = carbonUptake;
    }

    @Override
    protected String getPrefix() {
        return "CU_";
    }
}
