package com.jay.proforma.layer0_validation;

import com.jay.proforma.config.ModelConfig;
import com.jay.proforma.model.Loan;
import com.jay.proforma.model.RateCurve;
import com.jay.proforma.model.ScenarioInput;
import com.jay.proforma.model.ScenarioParameters;
import com.jay.proforma.model.Tenant;
import com.jay.proforma.model.WaterfallTier;
import com.jay.proforma.model.enums.RateMode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Layer 0 — Scenario Validator.
 * Checks a scenario before any projection runs. Every rule is evaluated and every failure
 * reported; warnings never block a run.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScenarioValidator {

    private final ModelConfig config;

    public record ValidationResult(boolean passed, List<String> failures, List<String> warnings) {
        public static ValidationResult pass(List<String> warnings) {
            return new ValidationResult(true, List.of(), warnings);
        }
        public static ValidationResult fail(List<String> failures, List<String> warnings) {
            return new ValidationResult(false, failures, warnings);
        }
    }

    /**
     * @param tiers the waterfall that will actually run (scenario override or configured default)
     */
    public ValidationResult validate(ScenarioInput input, List<WaterfallTier> tiers) {
        List<String> failures = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        ScenarioParameters p = input.getParameters();
        if (p == null) {
            failures.add("Scenario parameters are missing");
            return ValidationResult.fail(failures, warnings);
        }
        ModelConfig.Validation v = config.validation();

        // ── Property ──────────────────────────────────────────────────────────
        if (p.getAcquisitionDate() == null) {
            failures.add("Acquisition date is required");
        }
        if (p.getHoldPeriodMonths() < 1) {
            failures.add(String.format("Hold period must be at least 1 month (was %d)", p.getHoldPeriodMonths()));
        }
        if (p.getPurchasePrice() <= 0) {
            failures.add(String.format("Purchase price must be positive (was %.2f)", p.getPurchasePrice()));
        }
        if (p.getClosingCosts() < 0) {
            failures.add("Closing costs cannot be negative");
        }
        if (p.getBuildingArea() <= 0) {
            failures.add(String.format("Building area must be positive (was %.2f)", p.getBuildingArea()));
        }
        if (p.getTaxStartPeriod() < 0) {
            failures.add("Property tax start period cannot be negative");
        }

        // ── Rates ─────────────────────────────────────────────────────────────
        requireFraction(failures, "Vacancy rate", p.getVacancyRate());
        requireFraction(failures, "Collection loss rate", p.getCollectionLossRate());
        requireFraction(failures, "Management fee rate", p.getManagementFeeRate());
        requireFraction(failures, "Sales cost rate", p.getSalesCostRate());
        requireFraction(failures, "Parking expense rate", p.getParkingExpenseRate());
        if (p.getRentGrowth() <= -1 || p.getExpenseGrowth() <= -1 || p.getPropertyTaxGrowth() <= -1) {
            failures.add("Growth rates must be greater than -100%");
        }
        if (Math.abs(p.getLpEquityShare() + p.getGpEquityShare() - 1.0) > v.getSplitTolerance()) {
            failures.add(String.format("LP and GP equity shares must sum to 1 (%.4f + %.4f)",
                p.getLpEquityShare(), p.getGpEquityShare()));
        }

        // ── Rent roll ─────────────────────────────────────────────────────────
        List<Tenant> tenants = input.getTenants() == null ? List.of() : input.getTenants();
        double leasedArea = 0;
        for (Tenant t : tenants) {
            String name = t.getName() == null ? "(unnamed)" : t.getName();
            if (t.getArea() <= 0) {
                failures.add(String.format("Tenant '%s' area must be positive (was %.2f)", name, t.getArea()));
            }
            if (t.getLeaseEndMonth() < t.getLeaseStartMonth()) {
                failures.add(String.format("Tenant '%s' lease ends (month %d) before it starts (month %d)",
                    name, t.getLeaseEndMonth(), t.getLeaseStartMonth()));
            }
            if (t.getTiBuildoutMonths() < 0 || t.getFreeRentMonths() < 0 || t.getFreeRentStartMonth() < 0) {
                failures.add(String.format("Tenant '%s' buildout and free-rent months cannot be negative", name));
            }
            if (t.getInPlaceRentPerArea() < 0 || t.getMarketRentPerArea() < 0) {
                failures.add(String.format("Tenant '%s' rents cannot be negative", name));
            }
            leasedArea += t.getArea();
        }
        if (tenants.isEmpty()) {
            warnings.add("Rent roll is empty — the property earns no rent");
        } else if (p.getBuildingArea() > 0 && Math.abs(leasedArea - p.getBuildingArea()) > v.getAreaTolerance()) {
            failures.add(String.format("Tenant areas sum to %.2f but building area is %.2f",
                leasedArea, p.getBuildingArea()));
        }

        // ── Debt ──────────────────────────────────────────────────────────────
        List<Loan> loans = input.getLoans() == null ? List.of() : input.getLoans();
        for (Loan loan : loans) {
            validateLoan(loan, p, input.getRateCurve(), failures, warnings);
        }

        // ── Waterfall ─────────────────────────────────────────────────────────
        if (tiers == null || tiers.isEmpty()) {
            failures.add("Waterfall needs at least a final split");
        } else {
            for (WaterfallTier tier : tiers) {
                double sum = tier.getLpSplit() + tier.getGpSplit() + tier.getGpPromote();
                if (Math.abs(sum - 1.0) > v.getSplitTolerance()) {
                    failures.add(String.format("Tier '%s' splits sum to %.4f, not 1", tier.getName(), sum));
                }
                if (tier.getLpSplit() < 0 || tier.getGpSplit() < 0 || tier.getGpPromote() < 0) {
                    failures.add(String.format("Tier '%s' has a negative split", tier.getName()));
                }
            }
        }

        if (!failures.isEmpty()) {
            log.warn("Scenario validation FAILED — {} violations: {}", failures.size(), String.join("; ", failures));
            return ValidationResult.fail(failures, warnings);
        }
        log.info("Scenario validation PASSED — {} tenants, {} loans, {} warnings",
            tenants.size(), loans.size(), warnings.size());
        return ValidationResult.pass(warnings);
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private void validateLoan(Loan loan, ScenarioParameters p, RateCurve curve,
                              List<String> failures, List<String> warnings) {
        String name = loan.getName();
        if (loan.getPrincipal() < 0) {
            failures.add(String.format("Loan '%s' principal cannot be negative", name));
        }
        if (loan.getInterestOnlyMonths() < 0) {
            failures.add(String.format("Loan '%s' interest-only months cannot be negative", name));
        }
        if (loan.getAmortizationYears() <= 0) {
            failures.add(String.format("Loan '%s' amortization term must be positive", name));
        }
        if (loan.getRateMode() == RateMode.FIXED && loan.getFixedRate() < 0) {
            failures.add(String.format("Loan '%s' fixed rate cannot be negative", name));
        }
        if (loan.getRateMode() == RateMode.FLOATING) {
            if (curve == null || curve.isEmpty()) {
                failures.add(String.format("Floating loan '%s' needs a rate curve", name));
            } else if (p.getAcquisitionDate() != null
                    && !curve.covers(p.getAcquisitionDate().plusMonths(p.getHoldPeriodMonths()))) {
                warnings.add(String.format("Rate curve ends %s, before the exit date — floating loan '%s' will fail",
                    curve.lastDate(), name));
            }
        }

        Map<Integer, Double> draws = loan.getDrawSchedule();
        if (draws != null && !draws.isEmpty()) {
            double total = 0;
            for (Map.Entry<Integer, Double> e : draws.entrySet()) {
                if (e.getKey() < 0 || e.getKey() > p.getHoldPeriodMonths()) {
                    failures.add(String.format("Loan '%s' draw at period %d is outside the hold", name, e.getKey()));
                }
                if (e.getValue() == null || e.getValue() < 0) {
                    failures.add(String.format("Loan '%s' draw at period %d must be non-negative", name, e.getKey()));
                } else {
                    total += e.getValue();
                }
            }
            if (Math.abs(total - loan.getPrincipal()) > config.validation().getAmountTolerance()) {
                failures.add(String.format("Loan '%s' draws sum to %.2f but principal is %.2f",
                    name, total, loan.getPrincipal()));
            }
        }
    }

    private static void requireFraction(List<String> failures, String label, double value) {
        if (value < 0 || value >= 1) {
            failures.add(String.format("%s must be in [0, 1) (was %.4f)", label, value));
        }
    }
}
