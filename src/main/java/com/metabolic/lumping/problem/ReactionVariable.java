package com.metabolic.lumping.problem;

import com.metabolic.lumping.domain.Reaction;
import lombok.Getter;

/**
 * A variable attached to one reaction and named after it.
 */
@Getter
public abstract class ReactionVariable extends ModelVariable {

    private final Reaction reaction;

    protected ReactionVariable(Reaction reaction, double lowerBound, double upperBound, boolean integer) {
        super(reaction.getId(), lowerBound, upperBound, integer);
        this.reaction = reaction;
    }
}
