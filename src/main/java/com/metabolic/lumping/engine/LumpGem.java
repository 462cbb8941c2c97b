package com.metabolic.lumping.engine;

import com.metabolic.lumping.domain.LumpedReaction;
import com.metabolic.lumping.domain.MetabolicModel;
import com.metabolic.lumping.domain.Partition;
import com.metabolic.lumping.domain.Reaction;
import com.metabolic.lumping.io.ModelLoaders;
import com.metabolic.lumping.io.ThermoDatabaseLoader;
import com.metabolic.lumping.problem.CouplingConstraint;
import com.metabolic.lumping.problem.IndicatorVariable;
import com.metabolic.lumping.problem.Objective;
import com.metabolic.lumping.problem.OptimizationSolution;
import com.metabolic.lumping.problem.SolverSettings;
import com.metabolic.lumping.thermo.ThermoDatabase;
import com.metabolic.lumping.thermo.ThermoFormulation;
import com.metabolic.lumping.thermo.ThermoModel;
import com.metabolic.lumping.thermo.ThermoSettings;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Lumping of a metabolic network around its core subsystems.
 *
 * <p>Construction partitions the network, registers one indicator and one coupling
 * constraint per non-core reaction and sets the objective (maximize the number of
 * active indicators). Each {@link #lumpReaction(Reaction)} then solves the shared
 * problem with a growth requirement on one biomass reaction.</p>
 *
 * <p>All components work on the one problem owned by the formulation. Lumping calls on
 * an instance are serialized.</p>
 */
@Slf4j
public class LumpGem {

    @Getter
    private final ThermoFormulation formulation;
    @Getter
    private final Partition partition;
    @Getter
    private final Map<Reaction, IndicatorVariable> indicators;
    @Getter
    private final List<CouplingConstraint> couplingConstraints;
    @Getter
    private final Objective objective;
    @Getter
    private final double carbonUptake;
    @Getter
    private final double growthRate;

    private final OptimizationDriver driver;
    private final Lumper lumper;

    public LumpGem(ThermoFormulation formulation, Set<String> biomassReactions, Set<String> coreSubsystems,
                   double carbonUptake, double growthRate) {
        this.formulation = formulation;
        this.carbonUptake = carbonUptake;
        this.growthRate = growthRate;

        this.partition = new NetworkPartitioner().partition(formulation.getModel().getReactions(),
                biomassReactions, coreSubsystems);
        log.info("Model {}: {}", formulation.getModel().getId(), partition);

        this.indicators = new IndicatorSynthesizer().synthesize(partition.getNonCore(), formulation);
        this.couplingConstraints = new CouplingConstraintBuilder(carbonUptake).build(indicators, formulation);
        this.objective = new ObjectiveBuilder().build(indicators.values(), formulation);

        this.driver = new OptimizationDriver(formulation, partition.getNonCore());
        this.lumper = new Lumper(formulation, driver, partition, indicators, growthRate);
    }

    public LumpGem(MetabolicModel model, ThermoDatabase database, Set<String> biomassReactions,
                   Set<String> coreSubsystems, double carbonUptake, double growthRate,
                   ThermoSettings thermoSettings, SolverSettings solverSettings) {
        this(new ThermoModel(model, database, thermoSettings, solverSettings), biomassReactions, coreSubsystems,
                carbonUptake, growthRate);
    }

    /**
     * Loads the model (format chosen by extension) and the thermodynamic database,
     * with default thermodynamic and solver settings.
     *
     * @throws com.metabolic.lumping.io.ModelLoadException if either file cannot be loaded
     */
    public LumpGem(Path pathToModel, Set<String> biomassReactions, Set<String> coreSubsystems,
                   double carbonUptake, double growthRate, Path thermoDataPath) {
        this(ModelLoaders.load(pathToModel), new ThermoDatabaseLoader().load(thermoDataPath), biomassReactions,
                coreSubsystems, carbonUptake, growthRate, ThermoSettings.defaults(), SolverSettings.defaults());
    }

    public synchronized OptimizationSolution runOptimisation() {
        return driver.runOptimisation();
    }

    /**
     * @param biomassReaction the biomass reaction whose growth is enforced
     * @return the lumped reaction; the problem is left as it was before the call
     */
    public synchronized LumpedReaction lumpReaction(Reaction biomassReaction) {
        return lumper.lumpReaction(biomassReaction);
    }

    public LumpedReaction lumpReaction(String biomassReactionId) {
        Reaction reaction = partition.getBiomass().stream()
                .filter(r -> r.getId().equals(biomassReactionId))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(biomassReactionId + " is not a biomass reaction"));
        return lumpReaction(reaction);
    }
}
