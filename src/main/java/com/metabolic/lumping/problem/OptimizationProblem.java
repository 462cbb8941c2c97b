package com.metabolic.lumping.problem;

import com.google.ortools.Loader;
import com.google.ortools.linearsolver.MPConstraint;
import com.google.ortools.linearsolver.MPObjective;
import com.google.ortools.linearsolver.MPSolver;
import com.google.ortools.linearsolver.MPVariable;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Registry of the variables and constraints of a mixed-integer problem. Elements can
 * be added and removed freely; every {@link #solve(SolverSettings)} materializes the
 * current registry into a fresh OR-Tools solver, so removals take effect on the next
 * solve and nothing is carried over between solves.
 *
 * <p>Not thread-safe. Callers sharing one instance must serialize their mutations and
 * solves.</p>
 */
@Slf4j
public class OptimizationProblem {

    static {
        Loader.loadNativeLibraries();
    }

    private final Map<String, ModelVariable> variables = new LinkedHashMap<>();
    private final Map<String, ModelConstraint> constraints = new LinkedHashMap<>();
    private Objective objective;

    public void addVariable(ModelVariable variable) {
        if (variables.putIfAbsent(variable.getName(), variable) != null) {
            throw new IllegalArgumentException("Variable " + variable.getName() + " is already registered");
        }
    }

    public void addConstraint(ModelConstraint constraint) {
        if (constraints.putIfAbsent(constraint.getName(), constraint) != null) {
            throw new IllegalArgumentException("Constraint " + constraint.getName() + " is already registered");
        }
    }

    /**
     * Registers variables and constraints in the given order.
     */
    public void addConsVars(Collection<? extends ProblemElement> elements) {
        for (ProblemElement element : elements) {
            if (element instanceof ModelVariable) {
                addVariable((ModelVariable) element);
            } else if (element instanceof ModelConstraint) {
                addConstraint((ModelConstraint) element);
            } else {
                throw new IllegalArgumentException("Unsupported problem element " + element.getName());
            }
        }
    }

    /**
     * Unregisters the given elements. Elements that are not registered are ignored.
     */
    public void removeConsVars(Collection<? extends ProblemElement> elements) {
        for (ProblemElement element : elements) {
            if (element instanceof ModelVariable) {
                variables.remove(element.getName(), element);
            } else {
                constraints.remove(element.getName(), element);
            }
        }
    }

    public ModelVariable getVariable(String name) {
        return variables.get(name);
    }

    public ModelConstraint getConstraint(String name) {
        return constraints.get(name);
    }

    public Collection<ModelVariable> getVariables() {
        return Collections.unmodifiableCollection(variables.values());
    }

    public Collection<ModelConstraint> getConstraints() {
        return Collections.unmodifiableCollection(constraints.values());
    }

    public <T extends ModelConstraint> List<T> getConstraints(Class<T> type) {
        return constraints.values().stream()
                .filter(type::isInstance)
                .map(type::cast)
                .collect(Collectors.toList());
    }

    public <T extends ModelVariable> List<T> getVariables(Class<T> type) {
        return variables.values().stream()
                .filter(type::isInstance)
                .map(type::cast)
                .collect(Collectors.toList());
    }

    public int getVariableCount() {
        return variables.size();
    }

    public int getConstraintCount() {
        return constraints.size();
    }

    public Objective getObjective() {
        return objective;
    }

    public void setObjective(Objective objective) {
        this.objective = objective;
    }

    /**
     * Builds the registered problem in a new solver and solves it.
     *
     * @param settings backend and time limit
     * @return the primal solution (fluxes are left empty, see the thermodynamic model)
     * @throws OptimizationFailedException if no feasible solution is returned
     */
    public OptimizationSolution solve(SolverSettings settings) {
        long startTime = System.currentTimeMillis();

        MPSolver solver = MPSolver.createSolver(settings.getSolverId());
        if (solver == null) {
            log.error("Could not create solver {}", settings.getSolverId());
            throw new OptimizationFailedException("SOLVER_NOT_FOUND",
                    "Solver backend " + settings.getSolverId() + " is not available");
        }
        try {
            solver.setTimeLimit((long) (settings.getTimeLimitSec() * 1000));

            // 1. Variables
            Map<ModelVariable, MPVariable> mpVariables = new HashMap<>();
            for (ModelVariable variable : variables.values()) {
                MPVariable mpVariable = variable.isInteger()
                        ? solver.makeIntVar(variable.getLowerBound(), variable.getUpperBound(), variable.getName())
                        : solver.makeNumVar(variable.getLowerBound(), variable.getUpperBound(), variable.getName());
                mpVariables.put(variable, mpVariable);
            }

            // 2. Constraints, with the expression constant moved into the bounds
            for (ModelConstraint constraint : constraints.values()) {
                LinearExpression expression = constraint.getExpression();
                MPConstraint mpConstraint = solver.makeConstraint(
                        constraint.getLowerBound() - expression.getConstant(),
                        constraint.getUpperBound() - expression.getConstant(),
                        constraint.getName());
                expression.getTerms().forEach((var, coef) ->
                        mpConstraint.setCoefficient(lookup(mpVariables, var, constraint.getName()), coef));
            }

            // 3. Objective
            MPObjective mpObjective = solver.objective();
            if (objective != null) {
                LinearExpression expression = objective.getExpression();
                expression.getTerms().forEach((var, coef) ->
                        mpObjective.setCoefficient(lookup(mpVariables, var, "objective"), coef));
                mpObjective.setOffset(expression.getConstant());
                if (objective.getDirection() == Objective.Direction.MAX) {
                    mpObjective.setMaximization();
                } else {
                    mpObjective.setMinimization();
                }
            }

            log.debug("Solving {} variables and {} constraints with {}", variables.size(), constraints.size(),
                    settings.getSolverId());
            final MPSolver.ResultStatus status = solver.solve();
            long elapsed = System.currentTimeMillis() - startTime;

            if (status != MPSolver.ResultStatus.OPTIMAL && status != MPSolver.ResultStatus.FEASIBLE) {
                log.warn("Solver returned {} after {} ms", status, elapsed);
                throw new OptimizationFailedException(status.name(), "Optimization failed with status " + status);
            }

            OptimizationSolution.OptimizationSolutionBuilder solution = OptimizationSolution.builder()
                    .status(status.name())
                    .objectiveValue(mpObjective.value());
            mpVariables.forEach((var, mpVar) -> solution.primal(var.getName(), mpVar.solutionValue()));
            log.debug("Solver returned {} (objective {}) in {} ms", status, mpObjective.value(), elapsed);
            return solution.build();
        } finally {
            solver.delete();
        }
    }

    private MPVariable lookup(Map<ModelVariable, MPVariable> mpVariables, ModelVariable variable, String owner) {
        MPVariable mpVariable = mpVariables.get(variable);
        if (mpVariable == null) {
            throw new IllegalStateException(owner + " references unregistered variable " + variable.getName());
        }
        return mpVariable;
    }

    /**
     * @return the registered constraints violated by the primal assignment
     */
    public List<ModelConstraint> findViolations(Map<String, Double> primals, double tolerance) {
        List<ModelConstraint> violated = new ArrayList<>();
        for (ModelConstraint constraint : constraints.values()) {
            if (!constraint.isSatisfied(primals, tolerance)) {
                violated.add(constraint);
            }
        }
        return violated;
    }
}
