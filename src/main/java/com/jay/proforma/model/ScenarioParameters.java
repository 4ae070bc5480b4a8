package com.jay.proforma.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Property-level assumptions of one scenario. All money in one unit; per-area rates are
 * annual, parking/storage rates are monthly.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScenarioParameters {

    // Timing
    private LocalDate acquisitionDate;
    @Builder.Default
    private int holdPeriodMonths = 120;
    private int stabilizationMonth;

    // Acquisition
    private double purchasePrice;
    private double closingCosts;
    private double buildingArea;

    // Revenue deductions
    private double vacancyRate;
    private double collectionLossRate;

    // Expenses
    private double fixedOpexPerArea;
    private double variableOpexPerArea;
    @Builder.Default
    private double managementFeeRate = 0.04;
    private double propertyTaxBase;          // annual amount at tax start
    @Builder.Default
    private double propertyTaxGrowth = 0.025;
    @Builder.Default
    private int taxStartPeriod = 1;
    private double capitalReservePerArea;

    // Ancillary income
    private int parkingStalls;
    private double parkingRatePerStall;
    private int storageUnits;
    private double storageRatePerUnit;
    private double parkingExpenseRate;       // share of parking income

    // Escalation
    @Builder.Default
    private double rentGrowth = 0.025;
    private Double postStabilizationRentGrowth;  // null → rentGrowth throughout
    @Builder.Default
    private double expenseGrowth = 0.025;

    // Exit
    @Builder.Default
    private double exitCapRate = 0.05;
    @Builder.Default
    private double salesCostRate = 0.01;

    // Lease structure
    @Builder.Default
    private boolean nnnLease = true;

    // Equity
    @Builder.Default
    private double lpEquityShare = 0.90;
    @Builder.Default
    private double gpEquityShare = 0.10;

    // Per-run switches; null falls back to proforma.yaml defaults
    private Boolean circularReferences;
    private Boolean actual365;
    private Boolean simpleMonthlyPref;
    private Double discountRate;

    public double totalAcquisitionCost() {
        return purchasePrice + closingCosts;
    }

    /** Surfaced periods 0..hold plus the 12 forward periods the exit valuation reads. */
    public int projectionPeriods() {
        return holdPeriodMonths + 12 + 1;
    }
}
