package com.metabolic.lumping.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.metabolic.lumping.domain.MetabolicModel;
import com.metabolic.lumping.domain.Metabolite;
import com.metabolic.lumping.domain.Reaction;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;

/**
 * Reads the cobra dictionary layout shared by the JSON and YAML model formats:
 * top-level {@code id}, {@code metabolites} and {@code reactions}, with reaction
 * stoichiometry as a metabolite -> coefficient map.
 */
public abstract class CobraModelLoader implements ModelLoader {

    private final ObjectMapper mapper;

    protected CobraModelLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public MetabolicModel load(Path path) throws IOException {
        JsonNode root;
        try (InputStream in = Files.newInputStream(path)) {
            root = normalize(mapper.readTree(in));
        }
        if (root == null || !root.isObject()) {
            throw new ModelLoadException("Model file " + path + " does not contain a model object");
        }
        String defaultId = path.getFileName().toString().replaceFirst("\\.[^.]+$", "");
        MetabolicModel model = new MetabolicModel(root.path("id").asText(defaultId));

        for (JsonNode metNode : root.path("metabolites")) {
            model.addMetabolite(Metabolite.builder()
                    .id(requireText(metNode, "id", "metabolite"))
                    .name(metNode.path("name").asText(""))
                    .compartment(metNode.path("compartment").asText(null))
                    .seedId(seedId(metNode.path("annotation")))
                    .build());
        }

        for (JsonNode rxnNode : root.path("reactions")) {
            Reaction.ReactionBuilder reaction = Reaction.builder()
                    .id(requireText(rxnNode, "id", "reaction"))
                    .name(rxnNode.path("name").asText(""))
                    .subsystem(rxnNode.path("subsystem").asText(""))
                    .lowerBound(rxnNode.path("lower_bound").asDouble(-Reaction.DEFAULT_BOUND))
                    .upperBound(rxnNode.path("upper_bound").asDouble(Reaction.DEFAULT_BOUND));
            Iterator<Map.Entry<String, JsonNode>> stoich = rxnNode.path("metabolites").fields();
            while (stoich.hasNext()) {
                Map.Entry<String, JsonNode> term = stoich.next();
                reaction.metabolite(term.getKey(), term.getValue().asDouble());
            }
            model.addReaction(reaction.build());
        }
        return model;
    }

    private static String requireText(JsonNode node, String field, String kind) {
        JsonNode value = node.get(field);
        if (value == null || value.asText().isEmpty()) {
            throw new ModelLoadException("A " + kind + " entry has no " + field);
        }
        return value.asText();
    }

    /**
     * The seed annotation is a single id or a list of ids; the first one is used.
     */
    private static String seedId(JsonNode annotation) {
        JsonNode seed = annotation.path("seed.compound");
        if (seed.isMissingNode()) {
            seed = annotation.path("seed_id");
        }
        if (seed.isArray()) {
            seed = seed.path(0);
        }
        return seed.isValueNode() ? seed.asText() : null;
    }

    /**
     * cobra writes ordered maps as lists of single-entry maps; fold those back into
     * plain objects, bottom-up.
     */
    static JsonNode normalize(JsonNode node) {
        if (node == null) {
            return null;
        }
        if (node.isObject()) {
            ObjectNode copy = JsonNodeFactory.instance.objectNode();
            node.fields().forEachRemaining(e -> copy.set(e.getKey(), normalize(e.getValue())));
            return copy;
        }
        if (node.isArray()) {
            ArrayNode copy = JsonNodeFactory.instance.arrayNode();
            boolean pairs = node.size() > 0;
            for (JsonNode element : node) {
                JsonNode normalized = normalize(element);
                copy.add(normalized);
                pairs = pairs && normalized.isObject() && normalized.size() == 1;
            }
            if (pairs && looksLikeOrderedMap(copy)) {
                ObjectNode merged = JsonNodeFactory.instance.objectNode();
                copy.forEach(pair -> pair.fields().forEachRemaining(e -> merged.set(e.getKey(), e.getValue())));
                return merged;
            }
            return copy;
        }
        return node;
    }

    // Distinct keys: a list of single-field records would repeat the same key
    private static boolean looksLikeOrderedMap(ArrayNode pairs) {
        Set<String> keys = new HashSet<>();
        for (JsonNode pair : pairs) {
            if (!keys.add(pair.fieldNames().next())) {
                return false;
            }
        }
        return pairs.size() > 1 || !pairs.get(0).fieldNames().next().equals("id");
    }
}
