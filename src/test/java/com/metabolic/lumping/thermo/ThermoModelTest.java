package com.metabolic.lumping.thermo;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

import java.util.Map;

import org.junit.jupiter.api.Test;

import com.metabolic.lumping.ToyNetworks;
import com.metabolic.lumping.domain.MetabolicModel;
import com.metabolic.lumping.domain.Metabolite;
import com.metabolic.lumping.domain.Reaction;
import com.metabolic.lumping.problem.MassBalance;
import com.metabolic.lumping.problem.Objective;
import com.metabolic.lumping.problem.OptimizationSolution;

public class ThermoModelTest {

    private static final double TOL = 1e-6;

    /**
     * A -> B between two boundary species, reversible within [-10, 10].
     */
    private static MetabolicModel transport() {
        MetabolicModel model = new MetabolicModel("transport");
        model.addMetabolite(Metabolite.builder().id("A").seedId("cpdA").boundary(true).build());
        model.addMetabolite(Metabolite.builder().id("B").boundary(true).build());
        model.addReaction(Reaction.builder().id("T").lowerBound(-10.0).upperBound(10.0)
                .metabolite("A", -1.0).metabolite("B", 1.0).build());
        model.addReaction(Reaction.builder().id("EX_A").lowerBound(-10.0).upperBound(10.0)
                .metabolite("A", -1.0).build());
        return model;
    }

    private static ThermoDatabase downhill() {
        return new ThermoDatabase("test", ThermoDatabase.KJ_PER_MOL, Map.of(
                "cpdA", new ThermoDatabase.Entry("cpdA", 0.0, 1.0),
                "B", new ThermoDatabase.Entry("B", -50.0, 2.0)));
    }

    @Test
    public void testFluxBalance() {
        MetabolicModel model = ToyNetworks.lumpingToy();
        ThermoModel thermo = new ThermoModel(model, ThermoDatabase.empty());
        // S is a boundary species
        assertThat(thermo.getProblem().getConstraints(MassBalance.class).size(), equalTo(3));
        assertThat(thermo.getProblem().getVariableCount(), equalTo(8));
        MassBalance m1 = (MassBalance) thermo.getProblem().getConstraint("MB_M1");
        Reaction r3 = model.getReaction("R3");
        assertThat(m1.getExpression().getCoefficient(thermo.getForwardVariable(r3)), equalTo(1.0));
        assertThat(m1.getExpression().getCoefficient(thermo.getReverseVariable(r3)), equalTo(-1.0));
        assertThat(m1.getExpression().getCoefficient(thermo.getForwardVariable(model.getReaction("R1"))),
                equalTo(-1.0));
    }

    @Test
    public void testPrepare() {
        MetabolicModel model = transport();
        ThermoModel thermo = new ThermoModel(model, downhill());
        thermo.prepare();
        Reaction t = model.getReaction("T");
        assertThat("Transport not computed.", t.getThermo().isComputed());
        assertThat(t.getThermo().getDeltaGrStd(), closeTo(-50.0, TOL));
        assertThat(t.getThermo().getDeltaGrErr(), closeTo(Math.sqrt(5.0), TOL));
        // Exchanges never get thermodynamic constraints
        assertThat("Exchange computed.", !model.getReaction("EX_A").getThermo().isComputed());
    }

    @Test
    public void testDirectionFollowsFreeEnergy() {
        MetabolicModel model = transport();
        Reaction t = model.getReaction("T");

        ThermoModel plain = new ThermoModel(model, ThermoDatabase.empty());
        plain.setObjective(Objective.minimize(plain.getFluxExpression(t)));
        plain.prepare();
        plain.convert();
        assertThat(plain.getThermoElementCount(), equalTo(0));
        assertThat(plain.optimize().getFlux("T"), closeTo(-10.0, TOL));

        ThermoModel thermo = new ThermoModel(model, downhill());
        thermo.setObjective(Objective.minimize(thermo.getFluxExpression(t)));
        thermo.prepare();
        thermo.convert();
        OptimizationSolution solution = thermo.optimize();
        // deltaG stays negative over the whole concentration range, so T cannot run backwards
        assertThat(solution.getFlux("T"), closeTo(0.0, TOL));
        assertThat(solution.getPrimal("DG_T"), lessThan(0.0));
        assertThat(thermo.getProblem().findViolations(solution.getPrimals(), TOL), empty());

        thermo.setObjective(Objective.maximize(thermo.getFluxExpression(t)));
        assertThat(thermo.optimize().getFlux("T"), closeTo(10.0, TOL));
    }

    @Test
    public void testExemptReactionIsUnconstrained() {
        MetabolicModel model = transport();
        Reaction t = model.getReaction("T");
        ThermoModel thermo = new ThermoModel(model, downhill());
        thermo.setObjective(Objective.minimize(thermo.getFluxExpression(t)));
        thermo.prepare();
        t.getThermo().setComputed(false);
        thermo.convert();
        assertThat(thermo.getProblem().getVariable("FU_T"), nullValue());
        assertThat(thermo.optimize().getFlux("T"), closeTo(-10.0, TOL));
    }

    @Test
    public void testConvertReplacesPreviousConversion() {
        MetabolicModel model = transport();
        ThermoModel thermo = new ThermoModel(model, downhill());
        int baseVariables = thermo.getProblem().getVariableCount();
        int baseConstraints = thermo.getProblem().getConstraintCount();
        thermo.prepare();
        thermo.convert();
        int variables = thermo.getProblem().getVariableCount();
        int constraints = thermo.getProblem().getConstraintCount();
        // LC_A, LC_B, DG_T, FU_T, BU_T and six constraints
        assertThat(variables - baseVariables, equalTo(5));
        assertThat(constraints - baseConstraints, equalTo(6));
        thermo.prepare();
        thermo.convert();
        assertThat(thermo.getProblem().getVariableCount(), equalTo(variables));
        assertThat(thermo.getProblem().getConstraintCount(), equalTo(constraints));
        thermo.prepare();
        model.getReaction("T").getThermo().setComputed(false);
        thermo.convert();
        assertThat(thermo.getProblem().getVariableCount(), equalTo(baseVariables));
        assertThat(thermo.getProblem().getConstraintCount(), equalTo(baseConstraints));
    }

    @Test
    public void testKilocalories() {
        ThermoDatabase kcal = new ThermoDatabase("kcal", ThermoDatabase.KCAL_PER_MOL, Map.of());
        assertThat(kcal.getGasConstant() * 298.15, closeTo(0.5925, 1e-4));
        assertThat(ThermoDatabase.empty().getGasConstant() * 298.15, closeTo(2.479, 1e-3));
    }
}
