package com.metabolic.lumping.engine;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.metabolic.lumping.ToyNetworks;
import com.metabolic.lumping.domain.LumpedReaction;
import com.metabolic.lumping.domain.MetabolicModel;
import com.metabolic.lumping.domain.Reaction;
import com.metabolic.lumping.domain.Stoichiometry;
import com.metabolic.lumping.problem.CouplingConstraint;
import com.metabolic.lumping.problem.GrowthConstraint;
import com.metabolic.lumping.problem.IndicatorVariable;
import com.metabolic.lumping.problem.LinearExpression;
import com.metabolic.lumping.problem.Objective;
import com.metabolic.lumping.problem.OptimizationFailedException;
import com.metabolic.lumping.problem.OptimizationSolution;
import com.metabolic.lumping.problem.SolverSettings;
import com.metabolic.lumping.thermo.ThermoDatabase;
import com.metabolic.lumping.thermo.ThermoSettings;

public class LumpGemTest {

    private static final double TOL = 1e-6;

    private static LumpGem build(MetabolicModel model, double growthRate) {
        return new LumpGem(model, ThermoDatabase.empty(), Set.of("B"), Set.of(ToyNetworks.CORE), 10.0, growthRate,
                ThermoSettings.defaults(), SolverSettings.defaults());
    }

    @Test
    public void testConstruction() {
        MetabolicModel model = ToyNetworks.lumpingToyWithSecretion();
        LumpGem lumpGem = build(model, 0.1);
        assertThat(lumpGem.getPartition().getNonCore().size(), equalTo(2));
        assertThat(lumpGem.getIndicators().size(), equalTo(lumpGem.getPartition().getNonCore().size()));
        assertThat(lumpGem.getIndicators().keySet(), equalTo(lumpGem.getPartition().getNonCore()));
        for (Map.Entry<Reaction, IndicatorVariable> entry : lumpGem.getIndicators().entrySet()) {
            assertThat(entry.getValue().getReaction(), sameInstance(entry.getKey()));
            assertThat(entry.getValue().getName(), equalTo("IND_" + entry.getKey().getId()));
            assertThat(lumpGem.getFormulation().getProblem().getVariable(entry.getValue().getName()),
                    sameInstance(entry.getValue()));
        }
        assertThat(lumpGem.getCouplingConstraints().size(), equalTo(2));
        CouplingConstraint coupling = (CouplingConstraint) lumpGem.getFormulation().getProblem().getConstraint("CU_R3");
        Reaction r3 = model.getReaction("R3");
        LinearExpression expr = coupling.getExpression();
        assertThat(expr.getCoefficient(lumpGem.getFormulation().getForwardVariable(r3)), equalTo(1.0));
        assertThat(expr.getCoefficient(lumpGem.getFormulation().getReverseVariable(r3)), equalTo(1.0));
        assertThat(expr.getCoefficient(lumpGem.getIndicators().get(r3)), equalTo(10.0));
        assertThat(coupling.getUpperBound(), equalTo(10.0));
        assertThat(coupling.getLowerBound(), equalTo(Double.NEGATIVE_INFINITY));
        Objective objective = lumpGem.getObjective();
        assertThat(objective.getDirection(), equalTo(Objective.Direction.MAX));
        assertThat(objective.getExpression().getTerms().size(), equalTo(2));
        assertThat(lumpGem.getFormulation().getProblem().getObjective(), sameInstance(objective));
    }

    @Test
    public void testToyScenario() {
        MetabolicModel model = ToyNetworks.lumpingToy();
        LumpGem lumpGem = build(model, 0.1);
        assertThat(lumpGem.getPartition().getBiomass(), contains(model.getReaction("B")));
        assertThat(lumpGem.getPartition().getCore(), containsInAnyOrder(model.getReaction("R1"), model.getReaction("R2")));
        assertThat(lumpGem.getPartition().getNonCore(), contains(model.getReaction("R3")));
        int baseline = lumpGem.getFormulation().getProblem().getConstraintCount();

        LumpedReaction lump = lumpGem.lumpReaction("B");
        assertThat(lumpGem.getFormulation().getProblem().getConstraintCount(), equalTo(baseline));
        assertThat(lumpGem.getFormulation().getProblem().getConstraints(GrowthConstraint.class), empty());

        Map<String, Double> fluxes = lump.getFluxes();
        double f1 = fluxes.get("R1");
        double f2 = fluxes.get("R2");
        double f3 = fluxes.get("R3");
        double ind3 = lump.getIndicatorValues().get("R3");
        assertThat(f1, greaterThanOrEqualTo(0.1 - TOL));
        assertThat(f2, closeTo(f1, TOL));
        assertThat(f3, closeTo(f1 + f2, TOL));
        // Carrying flux through R3 forces its indicator to zero
        assertThat(ind3, closeTo(0.0, TOL));
        Stoichiometry stoich = lump.getStoichiometry();
        assertThat(stoich.get("M1"), closeTo(-f1 - f2 + f3 * ind3, TOL));
        assertThat(stoich.get("M2"), closeTo(f1, TOL));
        assertThat(stoich.get("M3"), closeTo(f2, TOL));
        assertThat(stoich.get("S"), closeTo(-f3 * ind3, TOL));
        assertThat(lump.getBiomassReactionId(), equalTo("B"));
        assertThat(lump.getObjectiveValue(), closeTo(0.0, TOL));
    }

    @Test
    public void testRepeatedLumping() {
        LumpGem lumpGem = build(ToyNetworks.lumpingToy(), 0.5);
        int baseline = lumpGem.getFormulation().getProblem().getConstraintCount();
        LumpedReaction first = lumpGem.lumpReaction("B");
        assertThat(lumpGem.getFormulation().getProblem().getConstraintCount(), equalTo(baseline));
        LumpedReaction second = lumpGem.lumpReaction("B");
        assertThat(lumpGem.getFormulation().getProblem().getConstraintCount(), equalTo(baseline));
        assertThat(lumpGem.getFormulation().getProblem().getConstraints(GrowthConstraint.class), empty());
        for (String met : first.getStoichiometry().getCoefficients().keySet()) {
            assertThat(met, second.getStoichiometry().get(met), closeTo(first.getStoichiometry().get(met), TOL));
        }
        assertThat(second.getStoichiometry().getCoefficients().keySet(),
                equalTo(first.getStoichiometry().getCoefficients().keySet()));
    }

    @Test
    public void testFailedSolveRemovesGrowthConstraint() {
        // R3 can carry at most 10 with its indicator off, so growth above 5 is infeasible
        LumpGem lumpGem = build(ToyNetworks.lumpingToy(), 50.0);
        int baseline = lumpGem.getFormulation().getProblem().getConstraintCount();
        OptimizationFailedException e = assertThrows(OptimizationFailedException.class,
                () -> lumpGem.lumpReaction("B"));
        assertThat(e.getStatus(), is(oneOf("INFEASIBLE", "ABNORMAL")));
        assertThat(lumpGem.getFormulation().getProblem().getConstraintCount(), equalTo(baseline));
        assertThat(lumpGem.getFormulation().getProblem().getConstraints(GrowthConstraint.class), empty());
        // A second attempt fails the same way instead of tripping over a leftover constraint
        assertThrows(OptimizationFailedException.class, () -> lumpGem.lumpReaction("B"));
    }

    @Test
    public void testCouplingAndObjective() {
        LumpGem lumpGem = build(ToyNetworks.lumpingToyWithSecretion(), 0.1);
        OptimizationSolution solution = lumpGem.runOptimisation();
        for (CouplingConstraint coupling : lumpGem.getCouplingConstraints()) {
            assertThat(coupling.getName(), coupling.isSatisfied(solution.getPrimals(), TOL));
        }
        long active = lumpGem.getIndicators().values().stream()
                .filter(v -> solution.getPrimal(v) > 1.0 - TOL)
                .count();
        assertThat(solution.getObjectiveValue(), closeTo(active, TOL));
        assertThat(solution.getObjectiveValue(), lessThanOrEqualTo(2.0 + TOL));
        // Without a growth requirement nothing needs flux, so every indicator can be on
        assertThat(solution.getObjectiveValue(), closeTo(2.0, TOL));

        LumpedReaction lump = lumpGem.lumpReaction("B");
        // R4 is not needed for growth and stays active, R3 carries flux and is switched off
        assertThat(lump.getIndicatorValues().get("R4"), closeTo(1.0, TOL));
        assertThat(lump.getIndicatorValues().get("R3"), closeTo(0.0, TOL));
        assertThat(lump.getObjectiveValue(), closeTo(1.0, TOL));
    }

    @Test
    public void testNoNonCoreReactions() {
        MetabolicModel model = ToyNetworks.allCoreToy();
        LumpGem lumpGem = build(model, 0.1);
        assertThat(lumpGem.getPartition().getNonCore(), empty());
        assertThat(lumpGem.getIndicators().size(), equalTo(0));
        assertThat(lumpGem.getObjective().getExpression().getTerms().size(), equalTo(0));
        assertThat(lumpGem.getObjective().getExpression().getConstant(), equalTo(0.0));

        LumpedReaction lump = lumpGem.lumpReaction("B");
        assertThat(lump.getObjectiveValue(), closeTo(0.0, TOL));
        assertThat(lump.getIndicatorValues().size(), equalTo(0));
        Stoichiometry expected = Stoichiometry.empty();
        for (Reaction reaction : lumpGem.getPartition().getCore()) {
            expected = expected.plus(reaction.getStoichiometry().scale(lump.getFluxes().get(reaction.getId())));
        }
        for (String met : expected.getCoefficients().keySet()) {
            assertThat(met, lump.getStoichiometry().get(met), closeTo(expected.get(met), TOL));
        }
        double b = lump.getFluxes().get("R1");
        assertThat(lump.getStoichiometry().get("S"), closeTo(-2.0 * b, TOL));
        assertThat(lump.getStoichiometry().get("M1"), closeTo(0.0, TOL));
    }

    @Test
    public void testUnknownBiomassReaction() {
        LumpGem lumpGem = build(ToyNetworks.lumpingToy(), 0.1);
        assertThrows(IllegalArgumentException.class, () -> lumpGem.lumpReaction("R1"));
    }

    @Test
    public void testLumpFromSbmlFile() throws URISyntaxException {
        Path modelPath = Path.of(LumpGemTest.class.getResource("/toy_model.xml").toURI());
        Path thermoPath = Path.of(LumpGemTest.class.getResource("/thermo_db.json").toURI());
        LumpGem lumpGem = new LumpGem(modelPath, Set.of("SINK"), Set.of(ToyNetworks.CORE), 10.0, 1.0, thermoPath);
        assertThat(lumpGem.getPartition().getNonCore().size(), equalTo(1));
        assertThat(lumpGem.getPartition().getCore().size(), equalTo(1));

        LumpedReaction lump = lumpGem.lumpReaction("SINK");
        double r1 = lump.getFluxes().get("R1");
        assertThat(r1, greaterThanOrEqualTo(1.0 - TOL));
        assertThat(lump.getFluxes().get("R3"), closeTo(2.0 * r1, TOL));
        assertThat(lump.getIndicatorValues().get("R3"), closeTo(0.0, TOL));
        assertThat(lump.getStoichiometry().get("M1_c"), closeTo(-2.0 * r1, TOL));
        assertThat(lump.getStoichiometry().get("M2_c"), closeTo(r1, TOL));
    }
}
