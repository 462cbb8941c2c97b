package com.metabolic.lumping.thermo;

import com.metabolic.lumping.domain.Reaction;
import com.metabolic.lumping.problem.LinearExpression;
import com.metabolic.lumping.problem.ReactionConstraint;

/**
 * Constraints added by the thermodynamic conversion. All of them are attached to a
 * reaction and named after it.
 */
public final class ThermoConstraints {

    private ThermoConstraints() {
    }

    /** {@code DG - RT * sum(nu * LC)} within the standard energy and its error */
    public static class DeltaGDefinition extends ReactionConstraint {
        public DeltaGDefinition(Reaction reaction, LinearExpression expression, double lowerBound, double upperBound) {
            super(reaction, expression, lowerBound, upperBound);
        }

        @Override
        protected String getPrefix() {
            return "G_";
        }
    }

    /** {@code DG - K + K * FU <= -epsilon} */
    public static class ForwardDeltaGCoupling extends ReactionConstraint {
        public ForwardDeltaGCoupling(Reaction reaction, LinearExpression expression, double upperBound) {
            super(reaction, expression, Double.NEGATIVE_INFINITY, upperBound);
        }

        @Override
        protected String getPrefix() {
            return "FG_";
        }
    }

    /** {@code -DG - K + K * BU <= -epsilon} */
    public static class BackwardDeltaGCoupling extends ReactionConstraint {
        public BackwardDeltaGCoupling(Reaction reaction, LinearExpression expression, double upperBound) {
            super(reaction, expression, Double.NEGATIVE_INFINITY, upperBound);
        }

        @Override
        protected String getPrefix() {
            return "BG_";
        }
    }

    /** {@code FU + BU <= 1} */
    public static class SimultaneousUse extends ReactionConstraint {
        public SimultaneousUse(Reaction reaction, LinearExpression expression) {
            super(reaction, expression, Double.NEGATIVE_INFINITY, 1.0);
        }

        @Override
        protected String getPrefix() {
            return "SU_";
        }
    }

    /** {@code forward - ub * FU <= 0} */
    public static class ForwardDirectionCoupling extends ReactionConstraint {
        public ForwardDirectionCoupling(Reaction reaction, LinearExpression expression) {
            super(reaction, expression, Double.NEGATIVE_INFINITY, 0.0);
        }

        @Override
        protected String getPrefix() {
            return "UF_";
        }
    }

    /** {@code reverse - ub * BU <= 0} */
    public static class BackwardDirectionCoupling extends ReactionConstraint {
        public BackwardDirectionCoupling(Reaction reaction, LinearExpression expression) {
            super(reaction, expression, Double.NEGATIVE_INFINITY, 0.0);
        }

        @Override
        protected String getPrefix() {
            return "UR_";
        }
    }
}
