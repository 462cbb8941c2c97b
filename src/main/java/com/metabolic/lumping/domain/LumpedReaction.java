package com.metabolic.lumping.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LumpedReaction {
    private String biomassReactionId;

    // Flux-weighted sum of core and indicator-gated non-core stoichiometries
    private Stoichiometry stoichiometry;

    // What the lump was computed from
    private Map<String, Double> fluxes;          // Reaction ID -> flux
    private Map<String, Double> indicatorValues; // Non-core reaction ID -> indicator primal
    private double objectiveValue;
    private String solverStatus;

    public String getFormula() {
        return stoichiometry == null ? "" : stoichiometry.toFormula();
    }
}
