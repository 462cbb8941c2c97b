package com.metabolic.lumping.problem;

import com.metabolic.lumping.domain.Reaction;
import lombok.Getter;

@Getter
public abstract class ReactionConstraint extends ModelConstraint {

    private final Reaction reaction;

    protected ReactionConstraint(Reaction reaction, LinearExpression expression, double lowerBound,
                                 double upperBound) {
        super(reaction.getId(), expression, lowerBound, upperBound);
        this.reaction = reaction;
    }
}
