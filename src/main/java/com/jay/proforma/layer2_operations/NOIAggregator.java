package com.jay.proforma.layer2_operations;

import com.jay.proforma.layer1_escalation.EscalationEngine.EscalationSeries;
import com.jay.proforma.layer2_operations.OperatingExpenseProjector.ExpensePeriod;
import com.jay.proforma.layer2_operations.RentRollProjector.RentRollPeriod;
import com.jay.proforma.model.RunOptions;
import com.jay.proforma.model.ScenarioParameters;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Layer 2 — NOI Aggregator.
 * Combines the rent roll and the expense lines into potential revenue, effective revenue and
 * net operating income per period.
 *
 *   potential  = tenant rent + free rent + parking + storage + reimbursements
 *   vacancy    = −vacancyRate × potential
 *   collection = −collectionLossRate × tenant rent after free rent
 *   effective  = potential + vacancy + collection
 *   NOI        = effective − total expenses
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NOIAggregator {

    private final RentRollProjector rentRollProjector;
    private final OperatingExpenseProjector expenseProjector;

    public List<OperatingPeriod> aggregate(ScenarioParameters p, List<RentRollPeriod> rentRoll,
                                           EscalationSeries esc, RunOptions options) {
        List<OperatingPeriod> result = new ArrayList<>(rentRoll.size());
        for (RentRollPeriod rent : rentRoll) {
            result.add(aggregatePeriod(p, rent, esc, options.circularReferences()));
        }
        if (result.size() > 1) {
            log.debug("NOI month 1: {} | month {}: {}",
                String.format("%.2f", result.get(1).getNoi()),
                p.getHoldPeriodMonths(),
                String.format("%.2f", result.get(p.getHoldPeriodMonths()).getNoi()));
        }
        return result;
    }

    OperatingPeriod aggregatePeriod(ScenarioParameters p, RentRollPeriod rent, EscalationSeries esc,
                                    boolean circularReferences) {
        int t = rent.period();
        boolean nnn = p.isNnnLease();
        ExpensePeriod exp = expenseProjector.project(p, t, esc, rent.parkingIncome());

        double fixedReimbursement = rentRollProjector.fixedReimbursement(nnn, t, exp.fixedOpex(), exp.propertyTax());
        double variableBeforeFee = rentRollProjector.variableReimbursement(
            nnn, t, exp.variableOpex(), exp.parkingExpense(), 0.0);

        double rental = rent.rentalRevenue();
        double collectionLoss = -rental * p.getCollectionLossRate();

        double potentialBeforeFee = rental + rent.otherIncome() + fixedReimbursement + variableBeforeFee;
        double effectiveBeforeFee = potentialBeforeFee * (1 - p.getVacancyRate()) + collectionLoss;

        double managementFee = expenseProjector.managementFee(
            t, effectiveBeforeFee, p.getManagementFeeRate(), p.getVacancyRate(), nnn, circularReferences);

        double variableReimbursement = rentRollProjector.variableReimbursement(
            nnn, t, exp.variableOpex(), exp.parkingExpense(), managementFee);
        double potential = rental + rent.otherIncome() + fixedReimbursement + variableReimbursement;
        double vacancyLoss = -potential * p.getVacancyRate();
        double effective = potential + vacancyLoss + collectionLoss;

        double totalExpenses = exp.totalBeforeFee() + managementFee;

        return OperatingPeriod.builder()
            .period(t)
            .grossRent(rent.grossRent())
            .freeRent(rent.freeRent())
            .concession(rent.concession())
            .parkingIncome(rent.parkingIncome())
            .storageIncome(rent.storageIncome())
            .fixedReimbursement(fixedReimbursement)
            .variableReimbursement(variableReimbursement)
            .potentialRevenue(potential)
            .vacancyLoss(vacancyLoss)
            .collectionLoss(collectionLoss)
            .effectiveRevenue(effective)
            .fixedOpex(exp.fixedOpex())
            .variableOpex(exp.variableOpex())
            .parkingExpense(exp.parkingExpense())
            .managementFee(managementFee)
            .propertyTax(exp.propertyTax())
            .capitalReserve(exp.capitalReserve())
            .totalExpenses(totalExpenses)
            .noi(effective - totalExpenses)
            .build();
    }
}
