package com.metabolic.lumping.engine;

import com.metabolic.lumping.domain.Partition;
import com.metabolic.lumping.domain.Reaction;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Splits the reactions of a network into biomass, core and non-core sets. A biomass
 * id match takes priority over a core subsystem match; everything else is non-core.
 */
public class NetworkPartitioner {

    public Partition partition(Collection<Reaction> reactions, Set<String> biomassReactionIds,
                               Set<String> coreSubsystems) {
        Set<Reaction> biomass = new LinkedHashSet<>();
        Set<Reaction> core = new LinkedHashSet<>();
        Set<Reaction> nonCore = new LinkedHashSet<>();
        Set<String> coreMetabolites = new LinkedHashSet<>();

        for (Reaction reaction : reactions) {
            if (biomassReactionIds.contains(reaction.getId())) {
                biomass.add(reaction);
            } else if (reaction.getSubsystem() != null && coreSubsystems.contains(reaction.getSubsystem())) {
                core.add(reaction);
                coreMetabolites.addAll(reaction.getMetabolites().keySet());
            } else {
                nonCore.add(reaction);
            }
        }
        return new Partition(biomass, core, nonCore, coreMetabolites);
    }
}
