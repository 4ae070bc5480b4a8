package com.jay.proforma.model;

import com.jay.proforma.layer2_operations.RentRollProjector.LeasingCost;
import com.jay.proforma.layer3_debt.LoanSchedule;
import com.jay.proforma.layer4_valuation.ExitValuator.ExitValuation;
import com.jay.proforma.layer5_cashflow.CashFlowAssembler.AnnualSummary;
import com.jay.proforma.layer5_cashflow.MonthlyRow;
import com.jay.proforma.layer6_returns.ReturnsSolver.ReturnsSummary;
import com.jay.proforma.layer7_waterfall.WaterfallEngine.WaterfallResult;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Everything one successful run produces. Returned whole or not at all.
 */
@Value
@Builder
public class ProFormaResult {
    RunOptions options;
    List<MonthlyRow> monthly;
    List<AnnualSummary> annual;
    List<LeasingCost> leasingCosts;
    List<LoanSchedule> loans;
    ExitValuation exit;
    ReturnsSummary returns;
    WaterfallResult waterfall;
    List<String> warnings;
}
