package com.metabolic.lumping.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Thermodynamic data attached to a reaction. The computed flag decides whether
 * the reaction receives the full set of thermodynamic constraints on conversion.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ThermoInfo {
    private boolean computed;
    private double deltaGrStd; // kJ/mol or kcal/mol, following the database units
    private double deltaGrErr;

    public static ThermoInfo notComputed() {
        return new ThermoInfo(false, 0.0, 0.0);
    }
}
