package com.jay.proforma.layer2_operations;

import com.jay.proforma.layer1_escalation.EscalationEngine.EscalationSeries;
import com.jay.proforma.model.ScenarioParameters;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Layer 2 — Operating Expense Projector.
 * Fixed and variable opex, parking expense, property tax and capital reserve for one period,
 * and the management fee once effective revenue is known.
 *
 * Period 0 (acquisition day) has no operating activity: every line is forced to zero there,
 * independently of the revenue side.
 */
@Slf4j
@Component
public class OperatingExpenseProjector {

    public record ExpensePeriod(
        int period,
        double fixedOpex,
        double variableOpex,
        double parkingExpense,
        double propertyTax,
        double capitalReserve
    ) {
        public static ExpensePeriod zero(int period) {
            return new ExpensePeriod(period, 0, 0, 0, 0, 0);
        }

        /** Everything except the management fee. */
        public double totalBeforeFee() {
            return fixedOpex + variableOpex + parkingExpense + propertyTax + capitalReserve;
        }
    }

    public ExpensePeriod project(ScenarioParameters p, int period, EscalationSeries esc, double parkingIncome) {
        if (period == 0) {
            return ExpensePeriod.zero(0);
        }
        double area = p.getBuildingArea();
        double expense = esc.expense().get(period);

        double fixedOpex = area * p.getFixedOpexPerArea() * expense / 12;
        double variableOpex = area * p.getVariableOpexPerArea() * expense / 12;
        double parkingExpense = parkingIncome * p.getParkingExpenseRate();
        double propertyTax = p.getPropertyTaxBase() * esc.propertyTax().get(period) / 12;
        double capitalReserve = area * p.getCapitalReservePerArea() * expense / 12;

        return new ExpensePeriod(period, fixedOpex, variableOpex, parkingExpense, propertyTax, capitalReserve);
    }

    /**
     * Management fee as a share of effective revenue.
     *
     * Under NNN the fee is itself recovered as variable reimbursement, so effective revenue
     * depends on the fee. With {@code circularReferences} on, the fixed point
     * {@code fee = rate × (E + fee × (1 − vacancy))} is solved in closed form; with it off the
     * fee is charged on E alone.
     *
     * @param effectiveRevenueBeforeFee effective revenue excluding the fee's own reimbursement (E)
     * @param feeReimbursed             whether the fee flows back as NNN revenue
     */
    public double managementFee(int period, double effectiveRevenueBeforeFee, double feeRate,
                                double vacancyRate, boolean feeReimbursed, boolean circularReferences) {
        if (period == 0 || feeRate == 0) {
            return 0.0;
        }
        if (feeReimbursed && circularReferences) {
            double denominator = 1 - feeRate * (1 - vacancyRate);
            return feeRate * effectiveRevenueBeforeFee / denominator;
        }
        return feeRate * effectiveRevenueBeforeFee;
    }
}
