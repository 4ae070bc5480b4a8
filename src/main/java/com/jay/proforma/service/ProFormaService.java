package com.jay.proforma.service;

import com.jay.proforma.config.ModelConfig;
import com.jay.proforma.exception.NumericFailureException;
import com.jay.proforma.exception.ScenarioValidationException;
import com.jay.proforma.layer0_validation.ScenarioValidator;
import com.jay.proforma.layer0_validation.ScenarioValidator.ValidationResult;
import com.jay.proforma.layer1_escalation.EscalationEngine;
import com.jay.proforma.layer1_escalation.EscalationEngine.EscalationSeries;
import com.jay.proforma.layer2_operations.NOIAggregator;
import com.jay.proforma.layer2_operations.OperatingPeriod;
import com.jay.proforma.layer2_operations.RentRollProjector;
import com.jay.proforma.layer2_operations.RentRollProjector.LeasingCost;
import com.jay.proforma.layer2_operations.RentRollProjector.RentRollPeriod;
import com.jay.proforma.layer3_debt.DebtScheduler;
import com.jay.proforma.layer3_debt.LoanSchedule;
import com.jay.proforma.layer4_valuation.ExitValuator;
import com.jay.proforma.layer4_valuation.ExitValuator.ExitValuation;
import com.jay.proforma.layer5_cashflow.CashFlowAssembler;
import com.jay.proforma.layer5_cashflow.MonthlyRow;
import com.jay.proforma.layer6_returns.ReturnsSolver;
import com.jay.proforma.layer6_returns.ReturnsSolver.ReturnsSummary;
import com.jay.proforma.layer7_waterfall.WaterfallEngine;
import com.jay.proforma.layer7_waterfall.WaterfallEngine.WaterfallResult;
import com.jay.proforma.model.CalculationResponse;
import com.jay.proforma.model.Loan;
import com.jay.proforma.model.PeriodSeries;
import com.jay.proforma.model.ProFormaResult;
import com.jay.proforma.model.RunOptions;
import com.jay.proforma.model.ScenarioInput;
import com.jay.proforma.model.ScenarioParameters;
import com.jay.proforma.model.WaterfallTier;
import com.jay.proforma.model.enums.CalculationStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs the full pro forma for one scenario in a single forward pass:
 * validation → escalation → rent roll → NOI → debt → exit → cash flow → returns → waterfall.
 *
 * Holds no state between runs. {@link #run} is the calculation boundary: validation and numeric
 * failures become a structured response there, invariant violations propagate.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProFormaService {

    private final ModelConfig config;
    private final ScenarioValidator validator;
    private final EscalationEngine escalationEngine;
    private final RentRollProjector rentRollProjector;
    private final NOIAggregator noiAggregator;
    private final DebtScheduler debtScheduler;
    private final ExitValuator exitValuator;
    private final CashFlowAssembler cashFlowAssembler;
    private final ReturnsSolver returnsSolver;
    private final WaterfallEngine waterfallEngine;

    public CalculationResponse run(ScenarioInput input) {
        try {
            return CalculationResponse.success(calculate(input));
        } catch (ScenarioValidationException e) {
            return CalculationResponse.failure(CalculationStatus.VALIDATION_ERROR, e.getFailures());
        } catch (NumericFailureException e) {
            log.error("Calculation failed: {} — {}", e.getClass().getSimpleName(), e.getMessage());
            return CalculationResponse.failure(CalculationStatus.NUMERIC_ERROR, List.of(e.getMessage()));
        }
    }

    /**
     * Calculates a scenario, throwing on any failure.
     */
    public ProFormaResult calculate(ScenarioInput input) {
        List<WaterfallTier> tiers = resolveTiers(input);
        ValidationResult validation = validator.validate(input, tiers);
        if (!validation.passed()) {
            throw new ScenarioValidationException(validation.failures());
        }

        ScenarioParameters p = input.getParameters();
        RunOptions options = RunOptions.resolve(p, config.defaults());
        int hold = p.getHoldPeriodMonths();
        log.info("Pro forma run: {} tenants, {} loans, hold {} months from {}",
            input.getTenants().size(), input.getLoans().size(), hold, p.getAcquisitionDate());

        // ── Operations (hold + forward year) ─────────────────────────────────
        EscalationSeries esc = escalationEngine.project(p);
        List<RentRollPeriod> rentRoll = rentRollProjector.project(p, input.getTenants(), esc);
        List<OperatingPeriod> operating = noiAggregator.aggregate(p, rentRoll, esc, options);
        List<LeasingCost> leasingCosts = rentRollProjector.leasingCosts(p, input.getTenants(), esc);

        // ── Debt ──────────────────────────────────────────────────────────────
        List<LocalDate> dates = periodDates(p.getAcquisitionDate(), hold);
        PeriodSeries noi = new PeriodSeries("NOI",
            operating.stream().mapToDouble(OperatingPeriod::getNoi).toArray());
        List<LoanSchedule> loans = new ArrayList<>();
        for (Loan loan : input.getLoans()) {
            loans.add(debtScheduler.schedule(loan, dates, noi, input.getRateCurve(), options.actual365()));
        }

        // ── Exit and cash flow ────────────────────────────────────────────────
        ExitValuation exit = exitValuator.value(operating, hold, p.getExitCapRate(), p.getSalesCostRate());
        List<MonthlyRow> monthly = cashFlowAssembler.assemble(p, dates, operating, leasingCosts, loans, exit);

        // ── Returns and waterfall ─────────────────────────────────────────────
        double[] unlevered = CashFlowAssembler.unlevered(monthly);
        double[] levered = CashFlowAssembler.levered(monthly);
        WaterfallResult waterfall = waterfallEngine.distribute(levered, dates, tiers,
            p.getLpEquityShare(), p.getGpEquityShare(), options.simpleMonthlyPref());
        ReturnsSummary returns = summarize(monthly, dates, unlevered, levered, waterfall, options);

        log.info("Pro forma complete: unlevered IRR {}% | levered IRR {}% | net exit {}",
            String.format("%.2f", returns.unleveredIrr() * 100),
            String.format("%.2f", returns.leveredIrr() * 100),
            String.format("%.2f", exit.netProceeds()));

        return ProFormaResult.builder()
            .options(options)
            .monthly(monthly)
            .annual(cashFlowAssembler.annualize(monthly))
            .leasingCosts(leasingCosts)
            .loans(loans)
            .exit(exit)
            .returns(returns)
            .waterfall(waterfall)
            .warnings(validation.warnings())
            .build();
    }

    /** Period dates 0..hold, one calendar month apart from the acquisition date. */
    public static List<LocalDate> periodDates(LocalDate acquisitionDate, int hold) {
        List<LocalDate> dates = new ArrayList<>(hold + 1);
        for (int t = 0; t <= hold; t++) {
            dates.add(acquisitionDate.plusMonths(t));
        }
        return dates;
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private List<WaterfallTier> resolveTiers(ScenarioInput input) {
        List<WaterfallTier> tiers = input.getWaterfallTiers();
        return (tiers == null || tiers.isEmpty()) ? config.waterfall().getTiers() : tiers;
    }

    private ReturnsSummary summarize(List<MonthlyRow> monthly, List<LocalDate> dates, double[] unlevered,
                                     double[] levered, WaterfallResult waterfall, RunOptions options) {
        double monthlyDiscount = Math.pow(1 + options.discountRate(), 1.0 / 12) - 1;
        double equity = returnsSolver.invested(levered);

        double yearOne = 0;
        for (int t = 1; t <= Math.min(12, monthly.size() - 1); t++) {
            yearOne += monthly.get(t).leveredOperatingCashFlow();
        }

        double[] lp = waterfall.lpCashFlows();
        double[] gp = waterfall.gpCashFlows();
        boolean hasGp = hasBothSigns(gp);

        return new ReturnsSummary(
            returnsSolver.xirr(unlevered, dates),
            returnsSolver.xirr(levered, dates),
            returnsSolver.multiple(unlevered),
            returnsSolver.multiple(levered),
            returnsSolver.profit(unlevered),
            returnsSolver.profit(levered),
            returnsSolver.invested(unlevered),
            equity,
            returnsSolver.npv(monthlyDiscount, unlevered),
            returnsSolver.npv(monthlyDiscount, levered),
            returnsSolver.cashOnCash(yearOne, equity),
            hasBothSigns(lp) ? returnsSolver.xirr(lp, dates) : null,
            hasGp ? returnsSolver.xirr(gp, dates) : null,
            hasBothSigns(lp) ? returnsSolver.multiple(lp) : null,
            hasGp ? returnsSolver.multiple(gp) : null
        );
    }

    // A zero equity share leaves that class with no flows; its returns are reported as absent.
    private static boolean hasBothSigns(double[] cf) {
        boolean pos = false, neg = false;
        for (double v : cf) {
            if (v > 0) pos = true;
            if (v < 0) neg = true;
        }
        return pos && neg;
    }
}
