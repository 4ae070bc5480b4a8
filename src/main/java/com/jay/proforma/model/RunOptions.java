package com.jay.proforma.model;

import com.jay.proforma.config.ModelConfig;

/**
 * Switches that affect one calculation run. Resolved once from the scenario (falling back to
 * proforma.yaml) and passed explicitly to the projectors that need them.
 */
public record RunOptions(
    boolean circularReferences,
    boolean actual365,
    boolean simpleMonthlyPref,
    double discountRate
) {
    public static RunOptions resolve(ScenarioParameters p, ModelConfig.Defaults defaults) {
        return new RunOptions(
            p.getCircularReferences() != null ? p.getCircularReferences() : defaults.isCircularReferences(),
            p.getActual365() != null ? p.getActual365() : defaults.isActual365(),
            p.getSimpleMonthlyPref() != null ? p.getSimpleMonthlyPref() : defaults.isSimpleMonthlyPref(),
            p.getDiscountRate() != null ? p.getDiscountRate() : defaults.getDiscountRate()
        );
    }

    public static RunOptions defaults() {
        return resolve(new ScenarioParameters(), new ModelConfig.Defaults());
    }
}
