package com.metabolic.lumping.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Metabolite {
    private String id;
    private String name;
    private String compartment;

    // Key into the thermodynamic database (SEED compound id), null if not annotated
    private String seedId;

    // Boundary species are sources/sinks and take no part in the mass balance
    private boolean boundary;
}
