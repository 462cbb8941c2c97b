package com.metabolic.lumping.thermo;

import com.metabolic.lumping.domain.MetabolicModel;
import com.metabolic.lumping.domain.Reaction;
import com.metabolic.lumping.problem.ForwardFluxVariable;
import com.metabolic.lumping.problem.LinearExpression;
import com.metabolic.lumping.problem.Objective;
import com.metabolic.lumping.problem.OptimizationProblem;
import com.metabolic.lumping.problem.OptimizationSolution;
import com.metabolic.lumping.problem.ProblemElement;
import com.metabolic.lumping.problem.ReverseFluxVariable;

import java.util.Collection;
import java.util.List;

/**
 * A flux balance problem extended with thermodynamic feasibility constraints.
 *
 * <p>The expected cycle is {@link #prepare()}, adjusting the per-reaction thermodynamic
 * flags, {@link #convert()}, then {@link #optimize()}.</p>
 */
public interface ThermoFormulation {

    /**
     * Computes the thermodynamic data of every reaction and marks the computable ones.
     */
    void prepare();

    /**
     * Turns the thermodynamic data of the reactions still marked as computed into
     * variables and constraints, replacing those of any previous conversion.
     */
    void convert();

    /**
     * @throws com.metabolic.lumping.problem.OptimizationFailedException when no feasible solution is found
     */
    OptimizationSolution optimize();

    void addConsVars(Collection<? extends ProblemElement> elements);

    void removeConsVars(Collection<? extends ProblemElement> elements);

    default void addConsVars(ProblemElement... elements) {
        addConsVars(List.of(elements));
    }

    default void removeConsVars(ProblemElement... elements) {
        removeConsVars(List.of(elements));
    }

    OptimizationProblem getProblem();

    MetabolicModel getModel();

    ForwardFluxVariable getForwardVariable(Reaction reaction);

    ReverseFluxVariable getReverseVariable(Reaction reaction);

    /**
     * @return forward minus reverse flux of the reaction
     */
    default LinearExpression getFluxExpression(Reaction reaction) {
        return LinearExpression.of(getForwardVariable(reaction)).plus(getReverseVariable(reaction), -1.0);
    }

    default void setObjective(Objective objective) {
        getProblem().setObjective(objective);
    }
}
