package com.metabolic.lumping.thermo;

import com.metabolic.lumping.domain.MetabolicModel;
import com.metabolic.lumping.domain.Metabolite;
import com.metabolic.lumping.domain.Reaction;
import com.metabolic.lumping.domain.ThermoInfo;
import com.metabolic.lumping.problem.ForwardFluxVariable;
import com.metabolic.lumping.problem.LinearExpression;
import com.metabolic.lumping.problem.MassBalance;
import com.metabolic.lumping.problem.OptimizationProblem;
import com.metabolic.lumping.problem.OptimizationSolution;
import com.metabolic.lumping.problem.ProblemElement;
import com.metabolic.lumping.problem.ReverseFluxVariable;
import com.metabolic.lumping.problem.SolverSettings;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Thermodynamics-based flux analysis on top of a flux balance problem.
 *
 * <p>On construction every reaction gets a forward and a reverse flux variable and
 * every non-boundary metabolite a mass balance. {@link #convert()} adds, for each
 * reaction flagged as computed, a free energy variable tied to log concentrations
 * and the binaries that only let the reaction run in the direction of negative
 * free energy.</p>
 *
 * <p>One instance owns one {@link OptimizationProblem}; it is not thread-safe.</p>
 */
@Slf4j
public class ThermoModel implements ThermoFormulation {

    @Getter
    private final MetabolicModel model;
    @Getter
    private final ThermoDatabase database;
    @Getter
    private final OptimizationProblem problem = new OptimizationProblem();
    private final ThermoSettings settings;
    private final SolverSettings solverSettings;

    private final Map<Reaction, ForwardFluxVariable> forwardVariables = new LinkedHashMap<>();
    private final Map<Reaction, ReverseFluxVariable> reverseVariables = new LinkedHashMap<>();

    // Elements added by the last conversion
    private final List<ProblemElement> thermoElements = new ArrayList<>();

    public ThermoModel(MetabolicModel model, ThermoDatabase database, ThermoSettings settings,
                       SolverSettings solverSettings) {
        this.model = model;
        this.database = database;
        this.settings = settings;
        this.solverSettings = solverSettings;
        buildFluxBalance();
    }

    public ThermoModel(MetabolicModel model, ThermoDatabase database) {
        this(model, database, ThermoSettings.defaults(), SolverSettings.defaults());
    }

    private void buildFluxBalance() {
        for (Reaction reaction : model.getReactions()) {
            ForwardFluxVariable forward = new ForwardFluxVariable(reaction);
            ReverseFluxVariable reverse = new ReverseFluxVariable(reaction);
            problem.addVariable(forward);
            problem.addVariable(reverse);
            forwardVariables.put(reaction, forward);
            reverseVariables.put(reaction, reverse);
        }

        Map<String, LinearExpression> balances = new LinkedHashMap<>();
        for (Reaction reaction : model.getReactions()) {
            LinearExpression flux = getFluxExpression(reaction);
            reaction.getMetabolites().forEach((metId, coef) ->
                    balances.merge(metId, flux.times(coef), LinearExpression::plus));
        }
        int count = 0;
        for (Map.Entry<String, LinearExpression> balance : balances.entrySet()) {
            Metabolite metabolite = model.getMetabolite(balance.getKey());
            if (!metabolite.isBoundary()) {
                problem.addConstraint(new MassBalance(metabolite, balance.getValue()));
                count++;
            }
        }
        log.debug("Flux balance for model {}: {} reactions, {} mass balances", model.getId(),
                forwardVariables.size(), count);
    }

    @Override
    public void prepare() {
        int computed = 0;
        for (Reaction reaction : model.getReactions()) {
            ThermoInfo info = reaction.getThermo();
            Optional<double[]> deltaGr = computeDeltaGr(reaction);
            if (deltaGr.isPresent()) {
                info.setComputed(true);
                info.setDeltaGrStd(deltaGr.get()[0]);
                info.setDeltaGrErr(deltaGr.get()[1]);
                computed++;
            } else {
                info.setComputed(false);
                info.setDeltaGrStd(0.0);
                info.setDeltaGrErr(0.0);
            }
        }
        log.debug("Thermodynamic data computed for {} of {} reactions", computed, model.getReactionCount());
    }

    /**
     * @return standard free energy and its error, or empty when the reaction is an
     * exchange or one of its metabolites has no formation energy
     */
    private Optional<double[]> computeDeltaGr(Reaction reaction) {
        if (reaction.getMetabolites().size() < 2) {
            return Optional.empty();
        }
        double deltaG = 0.0;
        double variance = 0.0;
        for (Map.Entry<String, Double> term : reaction.getMetabolites().entrySet()) {
            Optional<ThermoDatabase.Entry> entry = database.find(model.getMetabolite(term.getKey()));
            if (entry.isEmpty()) {
                return Optional.empty();
            }
            deltaG += term.getValue() * entry.get().getDeltaGfStd();
            double err = term.getValue() * entry.get().getDeltaGfErr();
            variance += err * err;
        }
        return Optional.of(new double[] {deltaG, Math.sqrt(variance)});
    }

    @Override
    public void convert() {
        problem.removeConsVars(thermoElements);
        thermoElements.clear();

        double rt = database.getGasConstant() * settings.getTemperature();
        double bigM = settings.getBigM();
        double lnMin = Math.log(settings.getMinConcentration());
        double lnMax = Math.log(settings.getMaxConcentration());
        Map<String, ThermoVariables.LogConcentration> logConcentrations = new LinkedHashMap<>();

        int converted = 0;
        for (Reaction reaction : model.getReactions()) {
            ThermoInfo info = reaction.getThermo();
            if (!info.isComputed()) {
                continue;
            }
            List<ProblemElement> elements = new ArrayList<>();

            // DG - RT * sum(nu * LC) = DG0 +/- err
            ThermoVariables.DeltaG deltaG = new ThermoVariables.DeltaG(reaction, bigM);
            elements.add(deltaG);
            LinearExpression definition = LinearExpression.of(deltaG);
            for (Map.Entry<String, Double> term : reaction.getMetabolites().entrySet()) {
                ThermoVariables.LogConcentration lc = logConcentrations.get(term.getKey());
                if (lc == null) {
                    lc = new ThermoVariables.LogConcentration(model.getMetabolite(term.getKey()), lnMin, lnMax);
                    logConcentrations.put(term.getKey(), lc);
                    elements.add(lc);
                }
                definition = definition.plus(lc, -rt * term.getValue());
            }
            elements.add(new ThermoConstraints.DeltaGDefinition(reaction, definition,
                    info.getDeltaGrStd() - info.getDeltaGrErr(), info.getDeltaGrStd() + info.getDeltaGrErr()));

            // Direction use binaries
            ThermoVariables.ForwardUse fu = new ThermoVariables.ForwardUse(reaction);
            ThermoVariables.BackwardUse bu = new ThermoVariables.BackwardUse(reaction);
            elements.add(fu);
            elements.add(bu);
            elements.add(new ThermoConstraints.ForwardDeltaGCoupling(reaction,
                    LinearExpression.of(deltaG).plus(fu, bigM).plusConstant(-bigM), -settings.getEpsilon()));
            elements.add(new ThermoConstraints.BackwardDeltaGCoupling(reaction,
                    LinearExpression.of(deltaG).times(-1.0).plus(bu, bigM).plusConstant(-bigM),
                    -settings.getEpsilon()));
            elements.add(new ThermoConstraints.SimultaneousUse(reaction, LinearExpression.of(fu).plus(bu, 1.0)));

            ForwardFluxVariable forward = getForwardVariable(reaction);
            ReverseFluxVariable reverse = getReverseVariable(reaction);
            elements.add(new ThermoConstraints.ForwardDirectionCoupling(reaction,
                    LinearExpression.of(forward).plus(fu, -forward.getUpperBound())));
            elements.add(new ThermoConstraints.BackwardDirectionCoupling(reaction,
                    LinearExpression.of(reverse).plus(bu, -reverse.getUpperBound())));

            problem.addConsVars(elements);
            thermoElements.addAll(elements);
            converted++;
        }
        log.debug("Converted {} reactions into thermodynamic constraints ({} log concentrations)",
                converted, logConcentrations.size());
    }

    @Override
    public OptimizationSolution optimize() {
        OptimizationSolution raw = problem.solve(solverSettings);
        OptimizationSolution.OptimizationSolutionBuilder solution = raw.toBuilder();
        for (Reaction reaction : model.getReactions()) {
            double flux = raw.getPrimal(getForwardVariable(reaction)) - raw.getPrimal(getReverseVariable(reaction));
            solution.flux(reaction.getId(), flux);
        }
        return solution.build();
    }

    @Override
    public void addConsVars(Collection<? extends ProblemElement> elements) {
        problem.addConsVars(elements);
    }

    @Override
    public void removeConsVars(Collection<? extends ProblemElement> elements) {
        problem.removeConsVars(elements);
    }

    @Override
    public ForwardFluxVariable getForwardVariable(Reaction reaction) {
        ForwardFluxVariable variable = forwardVariables.get(reaction);
        if (variable == null) {
            throw new IllegalArgumentException("Reaction " + reaction.getId() + " is not part of model " + model.getId());
        }
        return variable;
    }

    @Override
    public ReverseFluxVariable getReverseVariable(Reaction reaction) {
        ReverseFluxVariable variable = reverseVariables.get(reaction);
        if (variable == null) {
            throw new IllegalArgumentException("Reaction " + reaction.getId() + " is not part of model " + model.getId());
        }
        return variable;
    }

    /**
     * @return the number of problem elements added by the last conversion
     */
    public int getThermoElementCount() {
        return thermoElements.size();
    }
}
