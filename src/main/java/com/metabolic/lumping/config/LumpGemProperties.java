package com.metabolic.lumping.config;

import com.metabolic.lumping.domain.LumpingParams;
import com.metabolic.lumping.problem.SolverSettings;
import com.metabolic.lumping.thermo.ThermoSettings;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "lumpgem")
public class LumpGemProperties {

    private Solver solver = new Solver();
    private Thermo thermo = new Thermo();

    // Default per-run parameters
    private double carbonUptake = 10.0;
    private double autoGrowthFraction = 0.95;

    // Batch run executed at startup when a model path is set
    private Run run = new Run();

    @Data
    public static class Solver {
        private String id = "SCIP";
        private double timeLimitSec = 300.0;
    }

    @Data
    public static class Thermo {
        private double bigM = 1000.0;
        private double epsilon = 1e-6;
        private double minConcentration = 1e-5;
        private double maxConcentration = 2e-2;
        private double temperature = 298.15;

        public ThermoSettings toSettings() {
            return ThermoSettings.builder()
                    .bigM(bigM)
                    .epsilon(epsilon)
                    .minConcentration(minConcentration)
                    .maxConcentration(maxConcentration)
                    .temperature(temperature)
                    .build();
        }
    }

    @Data
    public static class Run {
        private String modelPath;
        private String thermoDbPath;
        private List<String> biomassReactions = new ArrayList<>();
        private List<String> coreSubsystems = new ArrayList<>();
        private Double carbonUptake;
        private Double growthRate; // unset means auto
    }

    public LumpingParams defaultParams() {
        return LumpingParams.builder()
                .carbonUptake(carbonUptake)
                .autoGrowthFraction(autoGrowthFraction)
                .solverId(solver.getId())
                .solverTimeoutSec(solver.getTimeLimitSec())
                .build();
    }

    public SolverSettings solverSettings(LumpingParams params) {
        return SolverSettings.builder()
                .solverId(params.getSolverId() != null ? params.getSolverId() : solver.getId())
                .timeLimitSec(params.getSolverTimeoutSec() > 0 ? params.getSolverTimeoutSec() : solver.getTimeLimitSec())
                .build();
    }
}
