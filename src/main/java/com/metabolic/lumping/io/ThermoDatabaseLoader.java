package com.metabolic.lumping.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.metabolic.lumping.thermo.ThermoDatabase;
import lombok.extern.slf4j.Slf4j;
import net.razorvine.pickle.Unpickler;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.zip.InflaterInputStream;

/**
 * Loads a thermodynamic database. {@code .thermodb} files are zlib-compressed, as
 * written by pyTFA: the payload is a pickled dictionary, or JSON text. Other files
 * are read uncompressed, again as JSON or pickle. The layout has {@code name},
 * {@code units} and a {@code metabolites} dictionary keyed by compound id, each
 * entry carrying {@code deltaGf_std} and {@code deltaGf_err}.
 */
@Slf4j
public class ThermoDatabaseLoader {

    private final ObjectMapper mapper = new ObjectMapper();

    /**
     * @throws ModelLoadException if the file is missing or malformed
     */
    public ThermoDatabase load(Path path) {
        if (!Files.isReadable(path)) {
            throw new ModelLoadException("Thermodynamic database not found or not readable: " + path);
        }
        JsonNode root;
        try (InputStream raw = Files.newInputStream(path);
             InputStream in = path.getFileName().toString().endsWith(".thermodb")
                     ? new InflaterInputStream(raw) : raw) {
            byte[] content = in.readAllBytes();
            root = isJson(content) ? mapper.readTree(content) : mapper.valueToTree(new Unpickler().loads(content));
        } catch (IOException | RuntimeException e) {
            throw new ModelLoadException("Could not read thermodynamic database " + path + ": " + e.getMessage(), e);
        }
        if (root == null || !root.path("metabolites").isObject()) {
            throw new ModelLoadException("Thermodynamic database " + path + " has no metabolites section");
        }

        Map<String, ThermoDatabase.Entry> entries = new LinkedHashMap<>();
        int unknown = 0;
        Iterator<Map.Entry<String, JsonNode>> metabolites = root.path("metabolites").fields();
        while (metabolites.hasNext()) {
            Map.Entry<String, JsonNode> met = metabolites.next();
            JsonNode deltaGf = met.getValue().path("deltaGf_std");
            if (!deltaGf.isNumber() || deltaGf.asDouble() >= ThermoDatabase.UNKNOWN_DELTA_G) {
                unknown++;
                continue;
            }
            entries.put(met.getKey(), new ThermoDatabase.Entry(met.getKey(), deltaGf.asDouble(),
                    met.getValue().path("deltaGf_err").asDouble(0.0)));
        }

        String units = root.path("units").asText(ThermoDatabase.KJ_PER_MOL);
        ThermoDatabase database;
        try {
            database = new ThermoDatabase(root.path("name").asText(path.getFileName().toString()), units, entries);
        } catch (IllegalArgumentException e) {
            throw new ModelLoadException("Thermodynamic database " + path + ": " + e.getMessage(), e);
        }
        log.info("Loaded thermodynamic database {} ({}): {} compounds, {} without formation energy",
                database.getName(), database.getUnits(), entries.size(), unknown);
        return database;
    }

    private static boolean isJson(byte[] content) {
        for (byte b : content) {
            if (!Character.isWhitespace(b)) {
                return b == '{';
            }
        }
        return true;
    }
}
