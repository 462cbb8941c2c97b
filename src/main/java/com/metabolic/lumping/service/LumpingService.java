package com.metabolic.lumping.service;

import com.metabolic.lumping.config.LumpGemProperties;
import com.metabolic.lumping.domain.LumpedReaction;
import com.metabolic.lumping.domain.LumpingParams;
import com.metabolic.lumping.domain.LumpingResult;
import com.metabolic.lumping.domain.MetabolicModel;
import com.metabolic.lumping.domain.Reaction;
import com.metabolic.lumping.engine.GrowthRateEstimator;
import com.metabolic.lumping.engine.LumpGem;
import com.metabolic.lumping.io.ModelLoaders;
import com.metabolic.lumping.io.ThermoDatabaseLoader;
import com.metabolic.lumping.problem.OptimizationFailedException;
import com.metabolic.lumping.problem.SolverSettings;
import com.metabolic.lumping.thermo.ThermoDatabase;
import com.metabolic.lumping.thermo.ThermoModel;
import com.metabolic.lumping.thermo.ThermoSettings;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class LumpingService {

    private final LumpGemProperties properties;
    private final ThermoDatabaseLoader databaseLoader = new ThermoDatabaseLoader();

    /**
     * Loads the model and the thermodynamic database, then lumps every biomass reaction.
     */
    public LumpingResult lumpModel(String modelPath, String thermoDbPath, List<String> biomassReactions,
                                   List<String> coreSubsystems, LumpingParams params) {
        if (modelPath == null || modelPath.isBlank()) {
            throw new IllegalArgumentException("Model path cannot be empty");
        }
        if (thermoDbPath == null || thermoDbPath.isBlank()) {
            throw new IllegalArgumentException("Thermodynamic database path cannot be empty");
        }
        MetabolicModel model = ModelLoaders.load(Path.of(modelPath));
        ThermoDatabase database = databaseLoader.load(Path.of(thermoDbPath));
        return lump(model, database, biomassReactions, coreSubsystems, params);
    }

    /**
     * Lumps the biomass reactions of a loaded model one after the other. A biomass
     * reaction whose solve fails is reported in the failures and does not stop the
     * others.
     */
    public LumpingResult lump(MetabolicModel model, ThermoDatabase database, Collection<String> biomassReactions,
                              Collection<String> coreSubsystems, LumpingParams params) {
        long startTime = System.currentTimeMillis();

        // Fallback to defaults if params are missing
        if (params == null) {
            params = properties.defaultParams();
        }

        // Basic Validation
        if (biomassReactions == null || biomassReactions.isEmpty()) {
            throw new IllegalArgumentException("Biomass reaction list cannot be empty");
        }
        if (params.getCarbonUptake() <= 0) {
            throw new IllegalArgumentException("Carbon uptake must be positive");
        }
        Set<String> biomassIds = new LinkedHashSet<>();
        for (String id : biomassReactions) {
            if (model.findReaction(id).isPresent()) {
                biomassIds.add(id);
            } else {
                log.warn("Biomass reaction {} is not in model {}", id, model.getId());
            }
        }
        if (biomassIds.isEmpty()) {
            throw new IllegalArgumentException("None of the biomass reactions are in model " + model.getId());
        }
        Set<String> core = coreSubsystems == null ? new LinkedHashSet<>() : new LinkedHashSet<>(coreSubsystems);
        boolean coreFound = model.getReactions().stream()
                .filter(r -> !biomassIds.contains(r.getId()))
                .anyMatch(r -> r.getSubsystem() != null && core.contains(r.getSubsystem()));
        if (!coreFound) {
            log.warn("No reaction of model {} belongs to the core subsystems {}; every reaction is non-core",
                    model.getId(), core);
        }

        ThermoSettings thermoSettings = properties.getThermo().toSettings();
        SolverSettings solverSettings = properties.solverSettings(params);

        // Growth Rate Resolution
        double growthRate;
        if (params.isAutoGrowthRate()) {
            Reaction first = model.getReaction(biomassIds.iterator().next());
            double maxGrowth = new GrowthRateEstimator().maximalGrowth(
                    new ThermoModel(model, database, thermoSettings, solverSettings), first);
            growthRate = params.getAutoGrowthFraction() * maxGrowth;
            log.info("Auto growth rate: {} x {} = {}", params.getAutoGrowthFraction(), maxGrowth, growthRate);
        } else {
            growthRate = params.getGrowthRate();
        }

        LumpGem lumpGem = new LumpGem(model, database, biomassIds, core, params.getCarbonUptake(), growthRate,
                thermoSettings, solverSettings);

        // Biomass reactions are lumped strictly one after the other
        List<LumpedReaction> lumps = new ArrayList<>();
        Map<String, String> failures = new LinkedHashMap<>();
        for (Reaction biomass : lumpGem.getPartition().getBiomass()) {
            try {
                lumps.add(lumpGem.lumpReaction(biomass));
            } catch (OptimizationFailedException e) {
                log.warn("Could not lump {}: {}", biomass.getId(), e.getMessage());
                failures.put(biomass.getId(), e.getStatus());
            }
        }

        String status = failures.isEmpty() ? "COMPLETE" : (lumps.isEmpty() ? "FAILED" : "PARTIAL");
        long elapsed = System.currentTimeMillis() - startTime;
        log.info("Lumping of {} {}: {} lumps, {} failures in {} ms", model.getId(), status, lumps.size(),
                failures.size(), elapsed);

        return LumpingResult.builder()
                .modelId(model.getId())
                .status(status)
                .biomassCount(lumpGem.getPartition().getBiomass().size())
                .coreCount(lumpGem.getPartition().getCore().size())
                .nonCoreCount(lumpGem.getPartition().getNonCore().size())
                .coreMetaboliteCount(lumpGem.getPartition().getCoreMetabolites().size())
                .growthRate(growthRate)
                .growthRateEstimated(params.isAutoGrowthRate())
                .lumps(lumps)
                .failures(failures)
                .computationTimeMs(elapsed)
                .build();
    }
}
