package com.metabolic.lumping.problem;

import com.metabolic.lumping.domain.Metabolite;
import lombok.Getter;

/**
 * Steady state for one metabolite: the net production over all reactions is zero.
 */
@Getter
public class MassBalance extends ModelConstraint {

    private final Metabolite metabolite;

    public MassBalance(Metabolite metabolite, LinearExpression expression) {
        super(metabolite.getId(), expression, 0.0, 0.0);
        this.metabolite = metabolite;
    }

    @Override
    protected String getPrefix() {
        return "MB_";
    }
}
