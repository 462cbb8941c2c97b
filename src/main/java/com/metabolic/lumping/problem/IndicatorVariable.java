package com.metabolic.lumping.problem;

import com.metabolic.lumping.domain.Reaction;

/**
 * Binary variable gating whether a non-core reaction counts towards a lump.
 */
public class IndicatorVariable extends ReactionVariable {

    public IndicatorVariable(Reaction reaction) {
        super(reaction, 0.0, 1.0, true);
    }

    @Override
    protected String getPrefix() {
        return "IND_";
    }
}
