package com.metabolic.lumping.problem;

import com.metabolic.lumping.domain.Reaction;

public class ReverseFluxVariable extends ReactionVariable {

    public ReverseFluxVariable(Reaction reaction) {
        super(reaction, reaction.getReverseLowerBound(), reaction.getReverseUpperBound(), false);
    }

    @Override
    protected String getPrefix() {
        return "REV_";
    }
}
