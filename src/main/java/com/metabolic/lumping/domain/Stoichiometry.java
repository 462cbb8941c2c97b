package com.metabolic.lumping.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable metabolite -> coefficient mapping. Lumped reactions are built by scaling
 * reaction stoichiometries with their fluxes and adding them up.
 */
public final class Stoichiometry {

    /** Coefficients smaller than this are treated as cancelled out */
    public static final double ZERO_TOLERANCE = 1e-9;

    private static final Stoichiometry EMPTY = new Stoichiometry(Collections.emptyMap());

    private final Map<String, Double> coefficients;

    private Stoichiometry(Map<String, Double> coefficients) {
        this.coefficients = Collections.unmodifiableMap(coefficients);
    }

    public static Stoichiometry empty() {
        return EMPTY;
    }

    public static Stoichiometry of(Map<String, Double> coefficients) {
        return new Stoichiometry(new LinkedHashMap<>(coefficients));
    }

    public Stoichiometry scale(double factor) {
        Map<String, Double> scaled = new LinkedHashMap<>();
        coefficients.forEach((met, coef) -> scaled.put(met, coef * factor));
        return new Stoichiometry(scaled);
    }

    public Stoichiometry plus(Stoichiometry other) {
        Map<String, Double> sum = new LinkedHashMap<>(coefficients);
        other.coefficients.forEach((met, coef) -> sum.merge(met, coef, Double::sum));
        return new Stoichiometry(sum);
    }

    public double get(String metaboliteId) {
        return coefficients.getOrDefault(metaboliteId, 0.0);
    }

    @JsonValue
    public Map<String, Double> getCoefficients() {
        return coefficients;
    }

    /**
     * @return the entries whose magnitude is not negligible
     */
    public Stoichiometry trimmed() {
        Map<String, Double> kept = new LinkedHashMap<>();
        coefficients.forEach((met, coef) -> {
            if (Math.abs(coef) >= ZERO_TOLERANCE) {
                kept.put(met, coef);
            }
        });
        return new Stoichiometry(kept);
    }

    public boolean isEmpty() {
        return trimmed().coefficients.isEmpty();
    }

    /**
     * Renders the stoichiometry as a reaction formula, e.g. {@code 2 A + B --> C}.
     */
    public String toFormula() {
        List<String> left = new ArrayList<>();
        List<String> right = new ArrayList<>();
        trimmed().coefficients.forEach((met, coef) -> {
            String term = formatCoefficient(Math.abs(coef)) + met;
            if (coef < 0) {
                left.add(term);
            } else {
                right.add(term);
            }
        });
        return String.join(" + ", left) + " --> " + String.join(" + ", right);
    }

    private static String formatCoefficient(double coef) {
        if (Math.abs(coef - 1.0) < ZERO_TOLERANCE) {
            return "";
        }
        String text = String.format(Locale.ROOT, "%.6g", coef);
        if (text.contains(".") && !text.contains("e")) {
            text = text.replaceAll("0+$", "").replaceAll("\\.$", "");
        }
        return text + " ";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Stoichiometry)) return false;
        return coefficients.equals(((Stoichiometry) o).coefficients);
    }

    @Override
    public int hashCode() {
        return Objects.hash(coefficients);
    }

    @Override
    public String toString() {
        return toFormula();
    }
}
