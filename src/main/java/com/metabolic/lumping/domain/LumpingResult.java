package com.metabolic.lumping.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LumpingResult {
    private String modelId;
    private String status; // "COMPLETE", "PARTIAL", "FAILED"

    // Partition sizes
    private int biomassCount;
    private int coreCount;
    private int nonCoreCount;
    private int coreMetaboliteCount;

    private double growthRate;
    private boolean growthRateEstimated;

    private List<LumpedReaction> lumps;
    private Map<String, String> failures; // Biomass reaction ID -> reason

    // Metrics
    private long computationTimeMs;
}
