package com.jay.proforma.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * The single structured payload a calculation run consumes. Treated as read-only for the
 * duration of a run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScenarioInput {

    private ScenarioParameters parameters;

    @Builder.Default
    private List<Tenant> tenants = new ArrayList<>();

    @Builder.Default
    private List<Loan> loans = new ArrayList<>();

    private RateCurve rateCurve;

    /** Ordered hurdles ending with the final split. Null or empty → configured default. */
    private List<WaterfallTier> waterfallTiers;
}
