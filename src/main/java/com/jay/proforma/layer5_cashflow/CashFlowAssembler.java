package com.jay.proforma.layer5_cashflow;

import com.jay.proforma.layer2_operations.OperatingPeriod;
import com.jay.proforma.layer2_operations.RentRollProjector.LeasingCost;
import com.jay.proforma.layer3_debt.LoanPeriod;
import com.jay.proforma.layer3_debt.LoanSchedule;
import com.jay.proforma.layer4_valuation.ExitValuator.ExitValuation;
import com.jay.proforma.model.ScenarioParameters;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Layer 5 — Cash Flow Assembler.
 * Merges NOI, capital events, exit proceeds and every tranche's debt service into the
 * surfaced monthly table (periods 0..hold). The forward exit periods never reach this table.
 *
 *   unlevered = NOI + exit proceeds − acquisition costs (period 0) − leasing costs
 *   levered   = unlevered + draws − debt service − loan fees − loan payoff (exit period)
 */
@Slf4j
@Component
public class CashFlowAssembler {

    public record AnnualSummary(
        int year,
        double potentialRevenue,
        double effectiveRevenue,
        double totalExpenses,
        double noi,
        double debtService,
        double unleveredCashFlow,
        double leveredCashFlow
    ) {}

    public List<MonthlyRow> assemble(ScenarioParameters p, List<LocalDate> dates, List<OperatingPeriod> operating,
                                     List<LeasingCost> leasingCosts, List<LoanSchedule> loans, ExitValuation exit) {
        int hold = p.getHoldPeriodMonths();
        Map<Integer, double[]> leasingByPeriod = new LinkedHashMap<>();
        for (LeasingCost cost : leasingCosts) {
            double[] acc = leasingByPeriod.computeIfAbsent(cost.period(), k -> new double[2]);
            acc[0] += cost.leaseCommission();
            acc[1] += cost.tenantImprovements();
        }

        List<MonthlyRow> rows = new ArrayList<>(hold + 1);
        for (int t = 0; t <= hold; t++) {
            OperatingPeriod op = operating.get(t);
            double acquisition = t == 0 ? p.totalAcquisitionCost() : 0.0;
            double exitProceeds = t == exit.exitPeriod() ? exit.netProceeds() : 0.0;
            double[] leasing = leasingByPeriod.getOrDefault(t, new double[2]);

            double draws = 0, interest = 0, capitalized = 0, principal = 0;
            double debtService = 0, fees = 0, balance = 0;
            for (LoanSchedule loan : loans) {
                LoanPeriod lp = loan.at(t);
                draws       += lp.getDraws();
                interest    += lp.getInterest();
                capitalized += lp.getCapitalizedInterest();
                principal   += lp.getPrincipal();
                debtService += lp.getDebtService();
                fees        += lp.getLoanFees();
                balance     += lp.getEndingBalance();
            }
            double payoff = t == exit.exitPeriod() ? balance : 0.0;

            double unlevered = op.getNoi() + exitProceeds - acquisition - leasing[0] - leasing[1];
            double levered = unlevered + draws - debtService - fees - payoff;

            rows.add(MonthlyRow.builder()
                .period(t)
                .date(dates.get(t))
                .operating(op)
                .acquisitionCosts(acquisition)
                .leaseCommissions(leasing[0])
                .tenantImprovements(leasing[1])
                .exitProceeds(exitProceeds)
                .unleveredCashFlow(unlevered)
                .loanDraws(draws)
                .interest(interest)
                .capitalizedInterest(capitalized)
                .principal(principal)
                .debtService(debtService)
                .loanFees(fees)
                .loanPayoff(payoff)
                .loanBalance(t == exit.exitPeriod() ? 0.0 : balance)
                .leveredCashFlow(levered)
                .build());
        }
        log.debug("Assembled {} monthly rows; exit-period levered cash flow {}",
            rows.size(), String.format("%.2f", rows.get(hold).getLeveredCashFlow()));
        return rows;
    }

    /**
     * Rolls the monthly table up to hold years. Months 1-12 are year 1; the acquisition
     * period is counted in year 1 as well.
     */
    public List<AnnualSummary> annualize(List<MonthlyRow> rows) {
        Map<Integer, double[]> byYear = new LinkedHashMap<>();
        for (MonthlyRow row : rows) {
            int year = Math.max(1, (row.getPeriod() + 11) / 12);
            double[] acc = byYear.computeIfAbsent(year, k -> new double[7]);
            OperatingPeriod op = row.getOperating();
            acc[0] += op.getPotentialRevenue();
            acc[1] += op.getEffectiveRevenue();
            acc[2] += op.getTotalExpenses();
            acc[3] += op.getNoi();
            acc[4] += row.getDebtService();
            acc[5] += row.getUnleveredCashFlow();
            acc[6] += row.getLeveredCashFlow();
        }
        List<AnnualSummary> years = new ArrayList<>(byYear.size());
        byYear.forEach((year, a) ->
            years.add(new AnnualSummary(year, a[0], a[1], a[2], a[3], a[4], a[5], a[6])));
        return years;
    }

    public static double[] unlevered(List<MonthlyRow> rows) {
        return rows.stream().mapToDouble(MonthlyRow::getUnleveredCashFlow).toArray();
    }

    public static double[] levered(List<MonthlyRow> rows) {
        return rows.stream().mapToDouble(MonthlyRow::getLeveredCashFlow).toArray();
    }
}
