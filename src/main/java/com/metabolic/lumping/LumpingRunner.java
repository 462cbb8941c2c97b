package com.metabolic.lumping;

import com.metabolic.lumping.config.LumpGemProperties;
import com.metabolic.lumping.domain.LumpedReaction;
import com.metabolic.lumping.domain.LumpingParams;
import com.metabolic.lumping.domain.LumpingResult;
import com.metabolic.lumping.service.LumpingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Lumps the model configured under {@code lumpgem.run} at startup.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "lumpgem.run", name = "model-path")
public class LumpingRunner implements CommandLineRunner {

    private final LumpingService service;
    private final LumpGemProperties properties;

    @Override
    public void run(String... args) {
        LumpGemProperties.Run run = properties.getRun();
        LumpingParams params = properties.defaultParams().toBuilder()
                .growthRate(run.getGrowthRate())
                .build();
        if (run.getCarbonUptake() != null) {
            params.setCarbonUptake(run.getCarbonUptake());
        }

        LumpingResult result = service.lumpModel(run.getModelPath(), run.getThermoDbPath(),
                run.getBiomassReactions(), run.getCoreSubsystems(), params);

        log.info("Model {}: {} biomass, {} core, {} non-core reactions; growth rate {}{}", result.getModelId(),
                result.getBiomassCount(), result.getCoreCount(), result.getNonCoreCount(), result.getGrowthRate(),
                result.isGrowthRateEstimated() ? " (auto)" : "");
        for (LumpedReaction lump : result.getLumps()) {
            log.info("{}: {}", lump.getBiomassReactionId(), lump.getFormula());
        }
        result.getFailures().forEach((id, status) -> log.warn("{}: no lump ({})", id, status));
    }
}
