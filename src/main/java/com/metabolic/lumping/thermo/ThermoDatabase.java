package com.metabolic.lumping.thermo;

import com.metabolic.lumping.domain.Metabolite;
import lombok.Getter;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Standard formation energies of compounds, keyed by SEED compound id.
 */
public class ThermoDatabase {

    /** Formation energies at or above this value mark a compound with unknown energy */
    public static final double UNKNOWN_DELTA_G = 1e7;

    public static final String KJ_PER_MOL = "kJ/mol";
    public static final String KCAL_PER_MOL = "kcal/mol";

    private static final double GAS_CONSTANT_KJ = 8.314462618e-3;
    private static final double GAS_CONSTANT_KCAL = 1.9872036e-3;

    @Value
    public static class Entry {
        String id;
        double deltaGfStd;
        double deltaGfErr;
    }

    @Getter
    private final String name;
    @Getter
    private final String units;
    private final Map<String, Entry> entries;

    public ThermoDatabase(String name, String units, Map<String, Entry> entries) {
        if (!KJ_PER_MOL.equalsIgnoreCase(units) && !KCAL_PER_MOL.equalsIgnoreCase(units)) {
            throw new IllegalArgumentException("Unsupported energy units " + units);
        }
        this.name = name;
        this.units = units;
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public static ThermoDatabase empty() {
        return new ThermoDatabase("empty", KJ_PER_MOL, Collections.emptyMap());
    }

    /**
     * Looks up a metabolite by its SEED annotation, falling back to its own id.
     */
    public Optional<Entry> find(Metabolite metabolite) {
        Entry entry = null;
        if (metabolite.getSeedId() != null) {
            entry = entries.get(metabolite.getSeedId());
        }
        if (entry == null) {
            entry = entries.get(metabolite.getId());
        }
        return Optional.ofNullable(entry);
    }

    public Map<String, Entry> getEntries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    /**
     * @return the gas constant in the energy units of this database, per kelvin
     */
    public double getGasConstant() {
        return KCAL_PER_MOL.equalsIgnoreCase(units) ? GAS_CONSTANT_KCAL : GAS_CONSTANT_KJ;
    }
}
