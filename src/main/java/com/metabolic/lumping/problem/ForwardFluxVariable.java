package com.metabolic.lumping.problem;

import com.metabolic.lumping.domain.Reaction;

public class ForwardFluxVariable extends ReactionVariable {

    public ForwardFluxVariable(Reaction reaction) {
        super(reaction, reaction.getForwardLowerBound(), reaction.getForwardUpperBound(), false);
    }

    @Override
    protected String getPrefix() {
        return "FWD_";
    }
}
