package com.metabolic.lumping.domain;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Disjoint classification of the reactions of a network into biomass, core and
 * non-core sets, plus the metabolites touched by core reactions.
 */
@Getter
public class Partition {

    public enum ReactionClass {
        BIOMASS,
        CORE,
        NON_CORE
    }

    private final Set<Reaction> biomass;
    private final Set<Reaction> core;
    private final Set<Reaction> nonCore;
    private final Set<String> coreMetabolites;

    public Partition(Set<Reaction> biomass, Set<Reaction> core, Set<Reaction> nonCore, Set<String> coreMetabolites) {
        this.biomass = Collections.unmodifiableSet(new LinkedHashSet<>(biomass));
        this.core = Collections.unmodifiableSet(new LinkedHashSet<>(core));
        this.nonCore = Collections.unmodifiableSet(new LinkedHashSet<>(nonCore));
        this.coreMetabolites = Collections.unmodifiableSet(new LinkedHashSet<>(coreMetabolites));
    }

    public ReactionClass classOf(Reaction reaction) {
        if (biomass.contains(reaction)) {
            return ReactionClass.BIOMASS;
        }
        if (core.contains(reaction)) {
            return ReactionClass.CORE;
        }
        if (nonCore.contains(reaction)) {
            return ReactionClass.NON_CORE;
        }
        throw new IllegalArgumentException("Reaction " + reaction.getId() + " is not part of this partition");
    }

    public int size() {
        return biomass.size() + core.size() + nonCore.size();
    }

    @Override
    public String toString() {
        return String.format("Partition[biomass=%d, core=%d, nonCore=%d, coreMetabolites=%d]",
                biomass.size(), core.size(), nonCore.size(), coreMetabolites.size());
    }
}
