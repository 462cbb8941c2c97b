package com.metabolic.lumping.problem;

import com.metabolic.lumping.domain.Metabolite;
import lombok.Getter;

@Getter
public abstract class MetaboliteVariable extends ModelVariable {

    private final Metabolite metabolite;

    protected MetaboliteVariable(Metabolite metabolite, double lowerBound, double upperBound, boolean integer) {
        super(metabolite.getId(), lowerBound, upperBound, integer);
        this.metabolite = metabolite;
    }
}
