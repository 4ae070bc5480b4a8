package com.jay.proforma.layer2_operations;

import lombok.Builder;
import lombok.Value;

/**
 * Revenue, expense and NOI lines of one period, as produced by the NOI aggregator.
 * Signed: deductions (free rent, concessions, vacancy, collection loss) are negative.
 */
@Value
@Builder
public class OperatingPeriod {
    int period;

    // Revenue
    double grossRent;
    double freeRent;
    double concession;
    double parkingIncome;
    double storageIncome;
    double fixedReimbursement;
    double variableReimbursement;
    double potentialRevenue;
    double vacancyLoss;
    double collectionLoss;
    double effectiveRevenue;

    // Expenses
    double fixedOpex;
    double variableOpex;
    double parkingExpense;
    double managementFee;
    double propertyTax;
    double capitalReserve;
    double totalExpenses;

    double noi;
}
