package com.jay.proforma.layer3_debt;

import com.jay.proforma.exception.ScheduleLookupException;

import java.util.List;

/**
 * Complete schedule of one tranche over periods 0..hold. Lookups are by period index and fail
 * explicitly when the period is not in the schedule.
 */
public record LoanSchedule(String loanName, double principal, List<LoanPeriod> periods) {

    public LoanSchedule {
        periods = List.copyOf(periods);
        for (int i = 0; i < periods.size(); i++) {
            if (periods.get(i).getPeriod() != i) {
                throw new IllegalArgumentException("Loan schedule periods must run 0..n in order");
            }
        }
    }

    public LoanPeriod at(int period) {
        if (period < 0 || period >= periods.size()) {
            throw new ScheduleLookupException("Loan schedule '" + loanName + "'", period, periods.size());
        }
        return periods.get(period);
    }

    /** Outstanding balance after the given period's activity. */
    public double balanceAfter(int period) {
        return at(period).getEndingBalance();
    }

    public double totalInterest() {
        return periods.stream().mapToDouble(LoanPeriod::getInterest).sum();
    }

    public double totalPrincipal() {
        return periods.stream().mapToDouble(LoanPeriod::getPrincipal).sum();
    }
}
