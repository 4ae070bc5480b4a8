package com.jay.proforma.layer1_escalation;

import com.jay.proforma.model.PeriodSeries;
import com.jay.proforma.model.ScenarioParameters;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Layer 1 — Escalation Engine.
 * Builds the multiplier series every projector scales its base amounts by. Each series starts
 * at 1.0 in period 0 and is built recursively from the previous period, the way the model's
 * escalation rows are.
 *
 * Rent and expense conventions are NOT interchangeable:
 *   rent     f[t] = f[t-1] * (1 + rate/12)          → 2.5% becomes ~2.529% after 12 months
 *   expense  f[t] = f[t-1] * (1 + rate)^(1/12)      → exactly 2.5% after 12 months
 */
@Slf4j
@Component
public class EscalationEngine {

    public record EscalationSeries(PeriodSeries rent, PeriodSeries expense, PeriodSeries propertyTax) {}

    public EscalationSeries project(ScenarioParameters p) {
        int periods = p.projectionPeriods();
        EscalationSeries series = new EscalationSeries(
            rentSeries(p.getRentGrowth(), p.getPostStabilizationRentGrowth(), p.getStabilizationMonth(), periods),
            expenseSeries(p.getExpenseGrowth(), periods),
            propertyTaxSeries(p.getPropertyTaxGrowth(), p.getTaxStartPeriod(), periods)
        );
        log.debug("Escalation over {} periods: rent x{} expense x{} tax x{} at period {}",
            periods,
            String.format("%.6f", series.rent().get(12)),
            String.format("%.6f", series.expense().get(12)),
            String.format("%.6f", series.propertyTax().get(periods - 1)),
            periods - 1);
        return series;
    }

    /**
     * Monthly-compounded rent factors. Once the period passes {@code stabilizationMonth} the
     * post-stabilization rate applies, when one is given.
     */
    public PeriodSeries rentSeries(double annualRate, Double postStabilizationRate,
                                   int stabilizationMonth, int periods) {
        double[] f = new double[periods];
        f[0] = 1.0;
        for (int t = 1; t < periods; t++) {
            double rate = (postStabilizationRate != null && t > stabilizationMonth)
                ? postStabilizationRate : annualRate;
            f[t] = f[t - 1] * (1 + rate / 12);
        }
        return new PeriodSeries("rentEscalation", f);
    }

    public PeriodSeries rentSeries(double annualRate, int periods) {
        return rentSeries(annualRate, null, 0, periods);
    }

    /** Annual rate applied at its monthly root. */
    public PeriodSeries expenseSeries(double annualRate, int periods) {
        double[] f = new double[periods];
        f[0] = 1.0;
        double monthly = Math.pow(1 + annualRate, 1.0 / 12);
        for (int t = 1; t < periods; t++) {
            f[t] = f[t - 1] * monthly;
        }
        return new PeriodSeries("expenseEscalation", f);
    }

    /**
     * Stepped tax factors: flat for the first 12 periods after tax start, then one
     * {@code (1 + growth)} step at every 12-period boundary.
     */
    public PeriodSeries propertyTaxSeries(double annualGrowth, int taxStartPeriod, int periods) {
        double[] f = new double[periods];
        f[0] = 1.0;
        for (int t = 1; t < periods; t++) {
            int sinceStart = t - taxStartPeriod;
            boolean boundary = sinceStart > 0 && sinceStart % 12 == 0;
            f[t] = boundary ? f[t - 1] * (1 + annualGrowth) : f[t - 1];
        }
        return new PeriodSeries("propertyTaxEscalation", f);
    }
}
