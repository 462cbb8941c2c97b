package com.metabolic.lumping.service;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.metabolic.lumping.ToyNetworks;
import com.metabolic.lumping.config.LumpGemProperties;
import com.metabolic.lumping.domain.LumpedReaction;
import com.metabolic.lumping.domain.LumpingParams;
import com.metabolic.lumping.domain.LumpingResult;
import com.metabolic.lumping.domain.MetabolicModel;
import com.metabolic.lumping.domain.Reaction;
import com.metabolic.lumping.io.ModelLoadException;
import com.metabolic.lumping.problem.OptimizationFailedException;
import com.metabolic.lumping.thermo.ThermoDatabase;

public class LumpingServiceTest {

    private static final double TOL = 1e-6;

    private final LumpingService service = new LumpingService(new LumpGemProperties());

    private static String resource(String name) throws URISyntaxException {
        return Path.of(LumpingServiceTest.class.getResource("/" + name).toURI()).toString();
    }

    @Test
    public void testExplicitGrowth() throws Exception {
        LumpingParams params = LumpingParams.builder().carbonUptake(10.0).growthRate(2.0).build();
        LumpingResult result = service.lumpModel(resource("toy_model.json"), resource("thermo_db.json"),
                List.of("BIOMASS"), List.of(ToyNetworks.CORE), params);
        assertThat(result.getModelId(), equalTo("toy_json"));
        assertThat(result.getStatus(), equalTo("COMPLETE"));
        assertThat(result.getBiomassCount(), equalTo(1));
        assertThat(result.getCoreCount(), equalTo(2));
        assertThat(result.getNonCoreCount(), equalTo(2));
        assertThat(result.getGrowthRate(), equalTo(2.0));
        assertThat(result.isGrowthRateEstimated(), equalTo(false));
        assertThat(result.getFailures().isEmpty(), equalTo(true));
        assertThat(result.getLumps().size(), equalTo(1));
        LumpedReaction lump = result.getLumps().get(0);
        assertThat(lump.getBiomassReactionId(), equalTo("BIOMASS"));
        assertThat(lump.getFluxes().get("BIOMASS"), nullValue());
        assertThat(lump.getFluxes().get("R1"), closeTo(2.0, TOL));
        assertThat(lump.getFluxes().get("R3"), closeTo(4.0, TOL));
        // Both non-core reactions carry the uptake, so neither can be switched off
        assertThat(lump.getIndicatorValues().get("R3"), closeTo(0.0, TOL));
        assertThat(lump.getIndicatorValues().get("EX_S"), closeTo(0.0, TOL));
        assertThat(lump.getStoichiometry().get("M1"), closeTo(-4.0, TOL));
        assertThat(lump.getStoichiometry().get("M2"), closeTo(2.0, TOL));
        assertThat(lump.getStoichiometry().get("M3"), closeTo(2.0, TOL));
        assertThat(lump.getStoichiometry().get("S"), closeTo(0.0, TOL));
    }

    @Test
    public void testAutoGrowth() throws Exception {
        LumpingParams params = LumpingParams.builder().carbonUptake(10.0).build();
        LumpingResult result = service.lumpModel(resource("toy_model.json"), resource("thermo_db.json"),
                List.of("BIOMASS"), List.of(ToyNetworks.CORE), params);
        assertThat(result.isGrowthRateEstimated(), equalTo(true));
        // Uptake is capped at 8 and each unit of biomass needs two units of M1
        assertThat(result.getGrowthRate(), closeTo(0.95 * 4.0, TOL));
        assertThat(result.getStatus(), equalTo("COMPLETE"));
        assertThat(result.getLumps().get(0).getFluxes().get("R3"), closeTo(7.6, TOL));
    }

    @Test
    public void testInfeasibleGrowth() throws Exception {
        LumpingParams params = LumpingParams.builder().carbonUptake(10.0).growthRate(5.0).build();
        LumpingResult result = service.lumpModel(resource("toy_model.json"), resource("thermo_db.json"),
                List.of("BIOMASS"), List.of(ToyNetworks.CORE), params);
        assertThat(result.getStatus(), equalTo("FAILED"));
        assertThat(result.getLumps(), empty());
        assertThat(result.getFailures().keySet(), contains("BIOMASS"));
    }

    @Test
    public void testDefaultParams() {
        // Unknown biomass ids are skipped; the growth rate is estimated from R0's bound of 10
        LumpingResult result = service.lump(ToyNetworks.allCoreToy(), ThermoDatabase.empty(),
                List.of("B", "NOT_THERE"), List.of(ToyNetworks.CORE), null);
        assertThat(result.isGrowthRateEstimated(), equalTo(true));
        assertThat(result.getGrowthRate(), closeTo(0.95 * 5.0, TOL));
        assertThat(result.getBiomassCount(), equalTo(1));
        assertThat(result.getNonCoreCount(), equalTo(0));
        assertThat(result.getStatus(), equalTo("COMPLETE"));
    }

    @Test
    public void testGrowthEstimationFailure() {
        // R1 must run while R2 cannot, so biomass has no feasible flux at all
        MetabolicModel model = new MetabolicModel("stuck");
        model.addReaction(Reaction.builder().id("R1").subsystem(ToyNetworks.CORE).lowerBound(1.0)
                .metabolite("M1", -1.0).metabolite("M2", 1.0).build());
        model.addReaction(Reaction.builder().id("R2").subsystem(ToyNetworks.CORE).upperBound(0.0)
                .metabolite("M1", -1.0).metabolite("M3", 1.0).build());
        model.addReaction(Reaction.builder().id("B").subsystem("Biomass")
                .metabolite("M2", -1.0).metabolite("M3", -1.0).build());
        LumpingParams params = LumpingParams.builder().carbonUptake(10.0).build();
        OptimizationFailedException e = assertThrows(OptimizationFailedException.class,
                () -> service.lump(model, ThermoDatabase.empty(), List.of("B"), List.of(ToyNetworks.CORE), params));
        assertThat(e.getStatus(), is(oneOf("INFEASIBLE", "ABNORMAL")));
    }

    @Test
    public void testValidation() throws Exception {
        LumpingParams params = LumpingParams.builder().carbonUptake(10.0).growthRate(1.0).build();
        String model = resource("toy_model.json");
        String thermo = resource("thermo_db.json");
        assertThrows(IllegalArgumentException.class,
                () -> service.lumpModel(" ", thermo, List.of("BIOMASS"), List.of(), params));
        assertThrows(IllegalArgumentException.class,
                () -> service.lumpModel(model, null, List.of("BIOMASS"), List.of(), params));
        assertThrows(IllegalArgumentException.class,
                () -> service.lumpModel(model, thermo, List.of(), List.of(), params));
        assertThrows(IllegalArgumentException.class,
                () -> service.lumpModel(model, thermo, List.of("NOT_THERE"), List.of(), params));
        LumpingParams noUptake = params.toBuilder().carbonUptake(0.0).build();
        assertThrows(IllegalArgumentException.class,
                () -> service.lumpModel(model, thermo, List.of("BIOMASS"), List.of(), noUptake));
        assertThrows(ModelLoadException.class,
                () -> service.lumpModel("missing.json", thermo, List.of("BIOMASS"), List.of(), params));
    }
}
