package com.jay.proforma.layer3_debt;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * One row of a tranche's schedule. {@code debtService} is the cash paid:
 * interest − capitalized interest + principal.
 */
@Value
@Builder
public class LoanPeriod {
    int period;
    LocalDate date;
    int days;
    double effectiveRate;

    double beginningBalance;
    double draws;
    double interest;
    double capitalizedInterest;
    double principal;
    double debtService;
    double loanFees;
    double endingBalance;
}
