package com.metabolic.lumping.domain;

import lombok.Getter;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A loaded metabolic network. Reactions and metabolites keep their file order, which
 * keeps the generated optimization problems deterministic.
 */
public class MetabolicModel {

    @Getter
    private final String id;
    private final Map<String, Metabolite> metabolites = new LinkedHashMap<>();
    private final Map<String, Reaction> reactions = new LinkedHashMap<>();

    public MetabolicModel(String id) {
        this.id = id;
    }

    public void addMetabolite(Metabolite metabolite) {
        metabolites.put(metabolite.getId(), metabolite);
    }

    /**
     * Adds a reaction. Metabolites it references that were never declared are created
     * with default attributes.
     */
    public void addReaction(Reaction reaction) {
        if (reactions.containsKey(reaction.getId())) {
            throw new IllegalArgumentException("Duplicate reaction id " + reaction.getId());
        }
        for (String metId : reaction.getMetabolites().keySet()) {
            metabolites.computeIfAbsent(metId, k -> Metabolite.builder().id(k).name(k).build());
        }
        reactions.put(reaction.getId(), reaction);
    }

    public Collection<Reaction> getReactions() {
        return Collections.unmodifiableCollection(reactions.values());
    }

    public Collection<Metabolite> getMetabolites() {
        return Collections.unmodifiableCollection(metabolites.values());
    }

    public Optional<Reaction> findReaction(String reactionId) {
        return Optional.ofNullable(reactions.get(reactionId));
    }

    public Reaction getReaction(String reactionId) {
        return findReaction(reactionId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown reaction " + reactionId));
    }

    public Metabolite getMetabolite(String metaboliteId) {
        return metabolites.get(metaboliteId);
    }

    public int getReactionCount() {
        return reactions.size();
    }

    public int getMetaboliteCount() {
        return metabolites.size();
    }
}
