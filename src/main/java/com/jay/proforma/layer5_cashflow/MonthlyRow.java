package com.jay.proforma.layer5_cashflow;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.jay.proforma.layer2_operations.OperatingPeriod;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * One surfaced period of the cash-flow table. Built once per run and never mutated.
 * Debt columns are summed across tranches.
 */
@Value
@Builder
public class MonthlyRow {
    int period;
    LocalDate date;

    OperatingPeriod operating;

    // Capital events
    double acquisitionCosts;
    double leaseCommissions;
    double tenantImprovements;
    double exitProceeds;
    double unleveredCashFlow;

    // Debt
    double loanDraws;
    double interest;
    double capitalizedInterest;
    double principal;
    double debtService;
    double loanFees;
    double loanPayoff;
    double loanBalance;
    double leveredCashFlow;

    @JsonIgnore
    public double getNoi() {
        return operating.getNoi();
    }

    /** Levered cash from operations: NOI less leasing costs and cash debt service. */
    @JsonIgnore
    public double leveredOperatingCashFlow() {
        return operating.getNoi() - leaseCommissions - tenantImprovements - debtService;
    }
}
