package com.jay.proforma.layer3_debt;

import com.jay.proforma.exception.InvariantViolationException;
import com.jay.proforma.exception.RateCurveRangeException;
import com.jay.proforma.model.Loan;
import com.jay.proforma.model.PeriodSeries;
import com.jay.proforma.model.RateCurve;
import com.jay.proforma.model.enums.RateMode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Layer 3 — Debt Scheduler.
 * Builds the period-by-period schedule of one loan tranche: draws, interest accrual,
 * interest-only window, level-payment amortization and one-time loan costs.
 *
 * Interest = AVERAGE(begin, begin + draws) × rate × days / 365, where days are the actual days
 * since the previous period date. The rate is fixed, or index + spread looked up on the period
 * date for floating tranches.
 */
@Slf4j
@Component
public class DebtScheduler {

    private static final double BALANCE_EPSILON = 1e-6;

    /**
     * @param dates  period dates 0..hold
     * @param noi    NOI by period; only read when the tranche capitalizes interest
     * @param curve  index curve; required for floating tranches
     */
    public LoanSchedule schedule(Loan loan, List<LocalDate> dates, PeriodSeries noi,
                                 RateCurve curve, boolean actual365) {
        int io = loan.getInterestOnlyMonths();
        int amortMonths = loan.amortizationMonths();
        int firstDraw = loan.firstDrawPeriod();

        List<LoanPeriod> periods = new ArrayList<>(dates.size());
        double balance = 0.0;
        double levelPayment = Double.NaN;

        for (int t = 0; t < dates.size(); t++) {
            double begin = balance;
            if (begin < -BALANCE_EPSILON) {
                throw new InvariantViolationException(String.format(
                    "Loan '%s' entered period %d with negative balance %.2f", loan.getName(), t, begin));
            }
            double draws = loan.drawAt(t);
            boolean accruing = t > 0 && (begin + draws) > 0;

            int days = t > 0 ? (int) ChronoUnit.DAYS.between(dates.get(t - 1), dates.get(t)) : 0;
            double rate = accruing ? rateFor(loan, dates.get(t), curve) : 0.0;

            double interest = 0.0;
            if (accruing) {
                double averageBalance = (begin + (begin + draws)) / 2;
                interest = actual365
                    ? averageBalance * rate * days / 365
                    : averageBalance * rate / 12;
            }

            double capitalized = 0.0;
            if (loan.isCapitalizeInterest() && accruing && t <= io) {
                capitalized = Math.max(0.0, interest - Math.max(noi.get(t), 0.0));
            }

            double principal = 0.0;
            if (t > io && begin > 0) {
                int remaining = amortMonths - (t - io - 1);
                if (remaining <= 0) {
                    principal = begin;
                } else {
                    if (Double.isNaN(levelPayment) || loan.getRateMode() == RateMode.FLOATING) {
                        levelPayment = payment(rate / 12, remaining, begin);
                    }
                    principal = Math.max(0.0, Math.min(levelPayment - interest, begin));
                }
            }

            double fees = (t == firstDraw && loan.getPrincipal() > 0)
                ? loan.getPrincipal() * (loan.getOriginationFeeRate() + loan.getClosingCostRate())
                : 0.0;

            double ending = begin + draws + capitalized - principal;
            if (ending < -BALANCE_EPSILON) {
                throw new InvariantViolationException(String.format(
                    "Loan '%s' balance would go negative in period %d (%.2f)", loan.getName(), t, ending));
            }

            periods.add(LoanPeriod.builder()
                .period(t)
                .date(dates.get(t))
                .days(days)
                .effectiveRate(rate)
                .beginningBalance(begin)
                .draws(draws)
                .interest(interest)
                .capitalizedInterest(capitalized)
                .principal(principal)
                .debtService(interest - capitalized + principal)
                .loanFees(fees)
                .endingBalance(Math.max(ending, 0.0))
                .build());
            balance = Math.max(ending, 0.0);
        }

        LoanSchedule schedule = new LoanSchedule(loan.getName(), loan.getPrincipal(), periods);
        log.debug("Loan '{}' scheduled: interest {} principal {} balance at exit {}",
            loan.getName(),
            String.format("%.2f", schedule.totalInterest()),
            String.format("%.2f", schedule.totalPrincipal()),
            String.format("%.2f", balance));
        return schedule;
    }

    /**
     * Level payment that retires {@code balance} over {@code months} at {@code monthlyRate}.
     */
    public double payment(double monthlyRate, int months, double balance) {
        if (months <= 0) {
            throw new IllegalArgumentException("Amortization term must be positive");
        }
        if (monthlyRate == 0) {
            return balance / months;
        }
        double growth = Math.pow(1 + monthlyRate, months);
        return balance * monthlyRate * growth / (growth - 1);
    }

    private double rateFor(Loan loan, LocalDate date, RateCurve curve) {
        if (loan.getRateMode() == RateMode.FIXED) {
            return loan.getFixedRate();
        }
        if (curve == null) {
            throw new RateCurveRangeException("Floating loan '" + loan.getName() + "' has no rate curve");
        }
        return curve.rateAt(date) + loan.getFloatingSpread();
    }
}
