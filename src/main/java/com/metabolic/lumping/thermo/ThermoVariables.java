package com.metabolic.lumping.thermo;

import com.metabolic.lumping.domain.Metabolite;
import com.metabolic.lumping.domain.Reaction;
import com.metabolic.lumping.problem.MetaboliteVariable;
import com.metabolic.lumping.problem.ReactionVariable;

/**
 * Variables added by the thermodynamic conversion.
 */
public final class ThermoVariables {

    private ThermoVariables() {
    }

    /** Natural log of a metabolite concentration */
    public static class LogConcentration extends MetaboliteVariable {
        public LogConcentration(Metabolite metabolite, double lnMin, double lnMax) {
            super(metabolite, lnMin, lnMax, false);
        }

        @Override
        protected String getPrefix() {
            return "LC_";
        }
    }

    /** Transformed Gibbs free energy of a reaction */
    public static class DeltaG extends ReactionVariable {
        public DeltaG(Reaction reaction, double bigM) {
            super(reaction, -bigM, bigM, false);
        }

        @Override
        protected String getPrefix() {
            return "DG_";
        }
    }

    /** 1 when the reaction is allowed to run forward */
    public static class ForwardUse extends ReactionVariable {
        public ForwardUse(Reaction reaction) {
            super(reaction, 0.0, 1.0, true);
        }

        @Override
        protected String getPrefix() {
            return "FU_";
        }
    }

    /** 1 when the reaction is allowed to run backward */
    public static class BackwardUse extends ReactionVariable {
        public BackwardUse(Reaction reaction) {
            super(reaction, 0.0, 1.0, true);
        }

        @Override
        protected String getPrefix() {
            return "BU_";
        }
    }
}
