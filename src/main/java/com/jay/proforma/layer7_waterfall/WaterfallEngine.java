package com.jay.proforma.layer7_waterfall;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.jay.proforma.exception.InvariantViolationException;
import com.jay.proforma.exception.ScenarioValidationException;
import com.jay.proforma.model.WaterfallTier;
import com.jay.proforma.model.enums.EquityClass;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Layer 7 — Waterfall Engine.
 * Distributes levered cash flow to the LP and GP through sequential pref hurdles and a final split.
 *
 * Each hurdle keeps one equity account per class. Every period an account accrues pref on its
 * beginning balance and takes the class's share of that period's contribution. Cash then runs
 * down the hurdles in order: a class is paid what it is still owed at the hurdle, capped at the
 * hurdle's split of the cash left, and the GP earns promote in proportion to what the classes
 * were paid. A class still owed after that draws the rest of the cash at the same hurdle, so no
 * later hurdle is paid while an earlier one is short. Whatever clears the last hurdle goes out at
 * the final split.
 *
 * Accounts are never force-paid at the end of the hold; unpaid balances are reported.
 */
@Slf4j
@Component
public class WaterfallEngine {

    private static final double EPSILON = 1e-6;

    public record EquityAccount(
        EquityClass equityClass,
        double beginning,
        double accrual,
        double contribution,
        double distribution,
        double ending
    ) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record TierDistribution(
        String tier,
        double cashAvailable,
        double lpPaid,
        double gpPaid,
        double gpPromote,
        EquityAccount lpAccount,
        EquityAccount gpAccount
    ) {}

    public record WaterfallPeriod(
        int period,
        LocalDate date,
        double leveredCashFlow,
        double lpContribution,
        double gpContribution,
        List<TierDistribution> tiers,
        TierDistribution finalSplit
    ) {
        public double lpDistribution() {
            return tiers.stream().mapToDouble(TierDistribution::lpPaid).sum() + finalSplit.lpPaid();
        }

        public double gpDistribution() {
            return tiers.stream().mapToDouble(d -> d.gpPaid() + d.gpPromote()).sum()
                + finalSplit.gpPaid() + finalSplit.gpPromote();
        }

        public double lpCashFlow() {
            return lpDistribution() - lpContribution;
        }

        public double gpCashFlow() {
            return gpDistribution() - gpContribution;
        }
    }

    public record TierSummary(
        String tier,
        double prefRate,
        double lpPaid,
        double gpPaid,
        double gpPromote,
        double lpUnpaid,
        double gpUnpaid
    ) {}

    public record WaterfallResult(
        List<WaterfallPeriod> periods,
        List<TierSummary> tiers,
        double totalAvailable,
        double totalDistributed
    ) {
        public double[] lpCashFlows() {
            return periods.stream().mapToDouble(WaterfallPeriod::lpCashFlow).toArray();
        }

        public double[] gpCashFlows() {
            return periods.stream().mapToDouble(WaterfallPeriod::gpCashFlow).toArray();
        }
    }

    /**
     * @param leveredCashFlows levered cash flow for periods 0..hold
     * @param tiers            hurdles in order; the last entry is the final split
     */
    public WaterfallResult distribute(double[] leveredCashFlows, List<LocalDate> dates, List<WaterfallTier> tiers,
                                      double lpShare, double gpShare, boolean simpleMonthlyPref) {
        if (tiers == null || tiers.isEmpty()) {
            throw new ScenarioValidationException("Waterfall needs at least a final split");
        }
        List<WaterfallTier> hurdles = tiers.subList(0, tiers.size() - 1);
        WaterfallTier finalSplit = tiers.get(tiers.size() - 1);
        int n = hurdles.size();

        double[] monthlyPref = new double[n];
        for (int k = 0; k < n; k++) {
            double annual = hurdles.get(k).getPrefRate();
            monthlyPref[k] = simpleMonthlyPref ? annual / 12 : Math.pow(1 + annual, 1.0 / 12) - 1;
        }

        // [tier][class] with class 0 = LP, 1 = GP
        double[][] balance = new double[n][2];
        double[][] tierPaid = new double[n + 1][3];
        double totalAvailable = 0;
        double totalDistributed = 0;
        List<WaterfallPeriod> periods = new ArrayList<>(leveredCashFlows.length);

        for (int t = 0; t < leveredCashFlows.length; t++) {
            double cf = leveredCashFlows[t];
            double[] contribution = {Math.max(-cf, 0) * lpShare, Math.max(-cf, 0) * gpShare};
            double remaining = Math.max(cf, 0);
            totalAvailable += remaining;

            double[][] begin = new double[n][2];
            double[][] accrual = new double[n][2];
            double[][] owedBase = new double[n][2];
            double[][] tierLines = new double[n][4];   // available, lp, gp, promote
            double[] paid = new double[2];

            for (int k = 0; k < n; k++) {
                WaterfallTier tier = hurdles.get(k);
                for (int c = 0; c < 2; c++) {
                    begin[k][c] = balance[k][c];
                    accrual[k][c] = balance[k][c] * monthlyPref[k];
                    owedBase[k][c] = begin[k][c] + accrual[k][c] + contribution[c];
                }
                if (remaining < -EPSILON) {
                    throw new InvariantViolationException(String.format(
                        "Tier '%s' received negative cash %.2f in period %d", tier.getName(), remaining, t));
                }
                tierLines[k][0] = remaining;
                if (remaining <= 0) {
                    continue;
                }
                double dueLp = Math.max(owedBase[k][0] - paid[0], 0);
                double dueGp = Math.max(owedBase[k][1] - paid[1], 0);
                double lp = Math.min(dueLp, remaining * tier.getLpSplit());
                double gp = Math.min(dueGp, remaining * tier.getGpSplit());
                double promote = (tier.getGpPromote() > 0 && lp + gp > 0)
                    ? Math.min(remaining - lp - gp, (lp + gp) * tier.promotePerInvestorDollar())
                    : 0.0;
                remaining -= lp + gp + promote;

                // A class capped by its split while still owed keeps drawing here before any later hurdle
                double perDollar = 1 + tier.promotePerInvestorDollar();
                if (tier.getLpSplit() > 0 && dueLp - lp > EPSILON && remaining > EPSILON) {
                    double extra = Math.min(dueLp - lp, remaining / perDollar);
                    lp += extra;
                    promote += extra * (perDollar - 1);
                    remaining -= extra * perDollar;
                }
                if (tier.getGpSplit() > 0 && dueGp - gp > EPSILON && remaining > EPSILON) {
                    double extra = Math.min(dueGp - gp, remaining / perDollar);
                    gp += extra;
                    promote += extra * (perDollar - 1);
                    remaining -= extra * perDollar;
                }
                paid[0] += lp;
                paid[1] += gp;
                tierLines[k][1] = lp;
                tierLines[k][2] = gp;
                tierLines[k][3] = promote;
            }

            if (remaining < -EPSILON) {
                throw new InvariantViolationException(String.format(
                    "Final split received negative cash %.2f in period %d", remaining, t));
            }
            double residual = Math.max(remaining, 0);
            double finalLp = residual * finalSplit.getLpSplit();
            double finalGp = residual * finalSplit.getGpSplit();
            double finalPromote = residual * finalSplit.getGpPromote();
            paid[0] += finalLp;
            paid[1] += finalGp;

            List<TierDistribution> lines = new ArrayList<>(n);
            double periodDistributed = finalLp + finalGp + finalPromote;
            for (int k = 0; k < n; k++) {
                EquityAccount[] accounts = new EquityAccount[2];
                for (int c = 0; c < 2; c++) {
                    double applied = Math.min(owedBase[k][c], paid[c]);
                    balance[k][c] = Math.max(0, owedBase[k][c] - paid[c]);
                    accounts[c] = new EquityAccount(EquityClass.values()[c], begin[k][c], accrual[k][c],
                        contribution[c], applied, balance[k][c]);
                }
                lines.add(new TierDistribution(hurdles.get(k).getName(), tierLines[k][0],
                    tierLines[k][1], tierLines[k][2], tierLines[k][3], accounts[0], accounts[1]));
                tierPaid[k][0] += tierLines[k][1];
                tierPaid[k][1] += tierLines[k][2];
                tierPaid[k][2] += tierLines[k][3];
                periodDistributed += tierLines[k][1] + tierLines[k][2] + tierLines[k][3];
            }
            tierPaid[n][0] += finalLp;
            tierPaid[n][1] += finalGp;
            tierPaid[n][2] += finalPromote;
            totalDistributed += periodDistributed;

            TierDistribution finalLine = new TierDistribution(finalSplit.getName(), residual,
                finalLp, finalGp, finalPromote, null, null);
            periods.add(new WaterfallPeriod(t, dates.get(t), cf, contribution[0], contribution[1], lines, finalLine));
        }

        if (Math.abs(totalDistributed - totalAvailable) > EPSILON * Math.max(1.0, totalAvailable)) {
            throw new InvariantViolationException(String.format(
                "Waterfall distributed %.2f of %.2f available", totalDistributed, totalAvailable));
        }

        List<TierSummary> summaries = new ArrayList<>(n + 1);
        for (int k = 0; k < n; k++) {
            WaterfallTier tier = hurdles.get(k);
            summaries.add(new TierSummary(tier.getName(), tier.getPrefRate(),
                tierPaid[k][0], tierPaid[k][1], tierPaid[k][2], balance[k][0], balance[k][1]));
        }
        summaries.add(new TierSummary(finalSplit.getName(), 0.0,
            tierPaid[n][0], tierPaid[n][1], tierPaid[n][2], 0.0, 0.0));

        log.debug("Waterfall distributed {} across {} hurdles and final split",
            String.format("%.2f", totalDistributed), n);
        return new WaterfallResult(periods, summaries, totalAvailable, totalDistributed);
    }
}
