package com.jay.proforma.layer6_returns;

import com.jay.proforma.config.ModelConfig;
import com.jay.proforma.exception.ConvergenceException;
import com.jay.proforma.exception.DegenerateCashFlowException;
import com.jay.proforma.exception.ScenarioValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Layer 6 — Returns Solver.
 * IRR (date-weighted and periodic), NPV, equity multiple, profit and cash-on-cash.
 *
 * Root finding: Newton–Raphson from the configured guess; if that does not settle within the
 * iteration cap, bisection over the configured bracket. An unconverged estimate is never returned.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReturnsSolver {

    private final ModelConfig config;

    public record ReturnsSummary(
        double unleveredIrr,
        double leveredIrr,
        double unleveredMultiple,
        double leveredMultiple,
        double unleveredProfit,
        double leveredProfit,
        double totalInvestment,
        double equityInvested,
        double unleveredNpv,
        double leveredNpv,
        double cashOnCash,
        Double lpIrr,
        Double gpIrr,
        Double lpMultiple,
        Double gpMultiple
    ) {}

    // ── IRR ───────────────────────────────────────────────────────────────────

    /** Annual rate that zeroes Σ CF / (1+r)^(days/365), days counted from the first date. */
    public double xirr(double[] cashFlows, List<LocalDate> dates) {
        return xirr(cashFlows, dates, config.solver().getInitialGuess());
    }

    public double xirr(double[] cashFlows, List<LocalDate> dates, double guess) {
        if (dates.size() != cashFlows.length) {
            throw new ScenarioValidationException(String.format(
                "XIRR needs one date per cash flow (%d flows, %d dates)", cashFlows.length, dates.size()));
        }
        requireMixedSigns(cashFlows);
        double[] exponents = new double[cashFlows.length];
        LocalDate start = dates.get(0);
        for (int i = 0; i < exponents.length; i++) {
            exponents[i] = ChronoUnit.DAYS.between(start, dates.get(i)) / 365.0;
        }
        return solve(cashFlows, exponents, guess);
    }

    /** Rate per period for equally spaced cash flows. */
    public double periodicIrr(double[] cashFlows) {
        requireMixedSigns(cashFlows);
        double[] exponents = new double[cashFlows.length];
        for (int i = 0; i < exponents.length; i++) {
            exponents[i] = i;
        }
        double annualGuess = config.solver().getInitialGuess();
        return solve(cashFlows, exponents, Math.pow(1 + annualGuess, 1.0 / 12) - 1);
    }

    /** Monthly IRR annualized as (1 + r)^12 − 1. */
    public double annualizedIrr(double[] monthlyCashFlows) {
        return Math.pow(1 + periodicIrr(monthlyCashFlows), 12) - 1;
    }

    // ── Closed-form measures ──────────────────────────────────────────────────

    /** Σ CF_t / (1+rate)^t with period 0 undiscounted. */
    public double npv(double periodRate, double[] cashFlows) {
        double[] exponents = new double[cashFlows.length];
        for (int i = 0; i < exponents.length; i++) {
            exponents[i] = i;
        }
        return presentValue(cashFlows, exponents, periodRate);
    }

    public double xnpv(double annualRate, double[] cashFlows, List<LocalDate> dates) {
        LocalDate start = dates.get(0);
        double[] exponents = new double[cashFlows.length];
        for (int i = 0; i < exponents.length; i++) {
            exponents[i] = ChronoUnit.DAYS.between(start, dates.get(i)) / 365.0;
        }
        return presentValue(cashFlows, exponents, annualRate);
    }

    /** Total inflows over total outflows. */
    public double multiple(double[] cashFlows) {
        double in = 0, out = 0;
        for (double cf : cashFlows) {
            if (cf > 0) in += cf;
            else out -= cf;
        }
        if (out == 0) {
            throw new DegenerateCashFlowException("Equity multiple needs at least one outflow");
        }
        return in / out;
    }

    public double profit(double[] cashFlows) {
        double sum = 0;
        for (double cf : cashFlows) sum += cf;
        return sum;
    }

    /** Total outflows of a series, reported as a positive amount. */
    public double invested(double[] cashFlows) {
        double out = 0;
        for (double cf : cashFlows) {
            if (cf < 0) out -= cf;
        }
        return out;
    }

    public double cashOnCash(double yearOneOperatingCashFlow, double equity) {
        if (equity <= 0) {
            throw new DegenerateCashFlowException("Cash-on-cash needs positive equity invested");
        }
        return yearOneOperatingCashFlow / equity;
    }

    // ── Root finding ──────────────────────────────────────────────────────────

    private double solve(double[] cf, double[] exponents, double guess) {
        ModelConfig.Solver s = config.solver();
        double low = s.getBisectionLow();
        double pvTolerance = s.getTolerance() * Math.max(1.0, grossFlow(cf));

        double rate = guess;
        for (int i = 0; i < s.getMaxIterations(); i++) {
            double value = presentValue(cf, exponents, rate);
            double slope = derivative(cf, exponents, rate);
            if (slope == 0 || !Double.isFinite(slope) || !Double.isFinite(value)) {
                break;
            }
            double next = rate - value / slope;
            if (next < low) {
                log.debug("Newton stepped below {} at iteration {}", low, i + 1);
                break;
            }
            if (Math.abs(next - rate) < s.getTolerance()
                    && Math.abs(presentValue(cf, exponents, next)) <= pvTolerance) {
                log.debug("IRR converged by Newton in {} iterations: {}", i + 1, next);
                return next;
            }
            rate = next;
        }

        log.debug("Newton did not settle from guess {}; bisecting [{}, {}]", guess, low, s.getBisectionHigh());
        return bisect(cf, exponents, low, s.getBisectionHigh(), s.getBisectionIterations(), s.getTolerance());
    }

    private double bisect(double[] cf, double[] exponents, double lo, double hi, int iterations, double tolerance) {
        double fLo = presentValue(cf, exponents, lo);
        double fHi = presentValue(cf, exponents, hi);
        if (!Double.isFinite(fLo) || !Double.isFinite(fHi) || fLo * fHi > 0) {
            throw new ConvergenceException(String.format(
                "IRR has no sign change between %.2f and %.2f", lo, hi));
        }
        for (int i = 0; i < iterations; i++) {
            double mid = 0.5 * (lo + hi);
            double fMid = presentValue(cf, exponents, mid);
            if (fMid == 0 || (hi - lo) / 2 < tolerance) {
                return mid;
            }
            if (fLo * fMid < 0) {
                hi = mid;
            } else {
                lo = mid;
                fLo = fMid;
            }
        }
        throw new ConvergenceException("IRR bisection did not converge in " + iterations + " iterations");
    }

    private static double presentValue(double[] cf, double[] exponents, double rate) {
        double pv = 0;
        for (int i = 0; i < cf.length; i++) {
            pv += cf[i] / Math.pow(1 + rate, exponents[i]);
        }
        return pv;
    }

    private static double grossFlow(double[] cf) {
        double sum = 0;
        for (double v : cf) sum += Math.abs(v);
        return sum;
    }

    private static double derivative(double[] cf, double[] exponents, double rate) {
        double d = 0;
        for (int i = 0; i < cf.length; i++) {
            d -= exponents[i] * cf[i] / Math.pow(1 + rate, exponents[i] + 1);
        }
        return d;
    }

    private static void requireMixedSigns(double[] cf) {
        if (cf == null || cf.length < 2) {
            throw new DegenerateCashFlowException("IRR needs at least two cash flows");
        }
        boolean positive = false, negative = false;
        for (double v : cf) {
            if (v > 0) positive = true;
            if (v < 0) negative = true;
        }
        if (!positive || !negative) {
            throw new DegenerateCashFlowException("IRR is undefined for a cash-flow series of a single sign");
        }
    }
}
