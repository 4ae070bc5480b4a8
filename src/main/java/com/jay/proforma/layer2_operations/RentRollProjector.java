package com.jay.proforma.layer2_operations;

import com.jay.proforma.layer1_escalation.EscalationEngine;
import com.jay.proforma.layer1_escalation.EscalationEngine.EscalationSeries;
import com.jay.proforma.model.PeriodSeries;
import com.jay.proforma.model.ScenarioParameters;
import com.jay.proforma.model.Tenant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Layer 2 — Rent Roll Projector.
 * Projects each tenant's monthly revenue through lease expiry and rollover, plus the
 * ancillary and reimbursement lines that sit on the revenue side of the NOI statement.
 *
 * Timeline for a tenant with rollover costs (lease end 50, 6 months buildout, 10 months free):
 *   1..50   in-place rent
 *   51..56  buildout gap, no revenue
 *   57..66  market rent with an equal negative free-rent line
 *   67+     market rent
 * Without rollover costs the tenant moves straight to market rent at month 51.
 *
 * Before the lease start month the space earns nothing. A free-rent start month inside the
 * in-place term gives a concession line of the same length at the in-place rent; the rollover
 * free-rent line never touches in-place periods.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RentRollProjector {

    private final EscalationEngine escalationEngine;

    /** {@code concession} is free rent granted inside the in-place term, kept apart from rollover free rent. */
    public record TenantRevenue(String tenant, double grossRent, double freeRent, double concession) {
        public double netRent() { return grossRent + freeRent + concession; }
    }

    public record RentRollPeriod(
        int period,
        List<TenantRevenue> tenants,
        double grossRent,
        double freeRent,
        double concession,
        double parkingIncome,
        double storageIncome
    ) {
        /** Tenant rent after free rent; the base for collection loss. */
        public double rentalRevenue() { return grossRent + freeRent + concession; }
        public double otherIncome()   { return parkingIncome + storageIncome; }
    }

    public record LeasingCost(int period, String tenant, double leaseCommission, double tenantImprovements) {
        public double total() { return leaseCommission + tenantImprovements; }
    }

    /**
     * Projects every period of the horizon, forward exit periods included.
     */
    public List<RentRollPeriod> project(ScenarioParameters p, List<Tenant> tenants, EscalationSeries esc) {
        int periods = p.projectionPeriods();
        Map<Tenant, PeriodSeries> factors = tenantFactors(tenants, esc.rent(), periods);

        List<RentRollPeriod> result = new ArrayList<>(periods);
        for (int t = 0; t < periods; t++) {
            List<TenantRevenue> lines = new ArrayList<>(tenants.size());
            double gross = 0;
            double free = 0;
            double concession = 0;
            for (Tenant tenant : tenants) {
                TenantRevenue line = tenantRevenue(tenant, t, factors.get(tenant));
                lines.add(line);
                gross += line.grossRent();
                free  += line.freeRent();
                concession += line.concession();
            }
            double parking = ancillaryIncome(p.getParkingStalls(), p.getParkingRatePerStall(), t, esc.rent());
            double storage = ancillaryIncome(p.getStorageUnits(), p.getStorageRatePerUnit(), t, esc.rent());
            result.add(new RentRollPeriod(t, List.copyOf(lines), gross, free, concession, parking, storage));
        }
        log.debug("Rent roll projected: {} tenants over {} periods", tenants.size(), periods);
        return result;
    }

    /**
     * Gross rent and free-rent deduction of one tenant in one period. Period 0 is acquisition
     * and never carries revenue.
     */
    public TenantRevenue tenantRevenue(Tenant tenant, int period, PeriodSeries rentFactors) {
        if (period == 0 || period < tenant.getLeaseStartMonth()) {
            return new TenantRevenue(tenant.getName(), 0.0, 0.0, 0.0);
        }
        double escalation = rentFactors.get(period);

        if (period <= tenant.getLeaseEndMonth()) {
            double rent = tenant.getArea() * tenant.getInPlaceRentPerArea() * escalation / 12;
            int freeStart = tenant.getFreeRentStartMonth();
            boolean inPlaceFree = freeStart > 0
                && period >= freeStart && period < freeStart + tenant.getFreeRentMonths();
            return new TenantRevenue(tenant.getName(), rent, 0.0, inPlaceFree ? -rent : 0.0);
        }

        int buildoutEnd = tenant.getLeaseEndMonth() + (tenant.isRolloverCosts() ? tenant.getTiBuildoutMonths() : 0);
        if (period <= buildoutEnd) {
            return new TenantRevenue(tenant.getName(), 0.0, 0.0, 0.0);
        }

        double market = tenant.getArea() * tenant.getMarketRentPerArea() * escalation / 12;
        boolean inFreeRent = tenant.isRolloverCosts() && period <= buildoutEnd + tenant.getFreeRentMonths();
        return new TenantRevenue(tenant.getName(), market, inFreeRent ? -market : 0.0, 0.0);
    }

    /** Parking stalls or storage units × monthly rate, escalated with rent. */
    public double ancillaryIncome(int count, double monthlyRate, int period, PeriodSeries rentFactors) {
        if (period == 0) return 0.0;
        return count * monthlyRate * rentFactors.get(period);
    }

    // ── NNN recoveries ────────────────────────────────────────────────────────

    public double fixedReimbursement(boolean nnnLease, int period, double fixedOpex, double propertyTax) {
        if (!nnnLease || period == 0) return 0.0;
        return fixedOpex + propertyTax;
    }

    public double variableReimbursement(boolean nnnLease, int period, double variableOpex,
                                        double parkingExpense, double managementFee) {
        if (!nnnLease || period == 0) return 0.0;
        return variableOpex + parkingExpense + managementFee;
    }

    // ── Leasing costs at rollover ────────────────────────────────────────────

    /**
     * One-time lease commission and TI allowance for every tenant that rolls over inside the
     * hold period with rollover costs applied. Commissions follow the new lease year by year:
     * year-1 rent is reduced by the free-rent months, years 1-5 and 6+ carry their own rate.
     */
    public List<LeasingCost> leasingCosts(ScenarioParameters p, List<Tenant> tenants, EscalationSeries esc) {
        List<LeasingCost> costs = new ArrayList<>();
        Map<Tenant, PeriodSeries> factors = tenantFactors(tenants, esc.rent(), p.projectionPeriods());
        for (Tenant tenant : tenants) {
            int rollover = tenant.rolloverMonth();
            if (!tenant.isRolloverCosts() || rollover <= 0 || rollover > p.getHoldPeriodMonths()) {
                continue;
            }
            double escalation = factors.get(tenant).get(rollover);
            double growth = tenant.getRentBumpRate() != null ? tenant.getRentBumpRate() : p.getRentGrowth();
            double yearOneRent = tenant.getArea() * tenant.getMarketRentPerArea() * escalation;

            double commission = 0;
            for (int year = 1; year <= tenant.getNewLeaseTermYears(); year++) {
                double annualRent = yearOneRent * Math.pow(1 + growth, year - 1);
                if (year == 1 && tenant.getFreeRentMonths() > 0) {
                    annualRent = annualRent * Math.max(0, 12 - tenant.getFreeRentMonths()) / 12;
                }
                double rate = year <= 5
                    ? tenant.getLeaseCommissionRateYears1To5()
                    : tenant.getLeaseCommissionRateYears6Plus();
                commission += annualRent * rate;
            }
            double ti = tenant.getArea() * tenant.getTiAllowancePerArea() * escalation;
            if (commission > 0 || ti > 0) {
                costs.add(new LeasingCost(rollover, tenant.getName(), commission, ti));
                log.debug("Rollover costs for {} at month {}: LC {} TI {}", tenant.getName(), rollover,
                    String.format("%.2f", commission), String.format("%.2f", ti));
            }
        }
        return costs;
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private Map<Tenant, PeriodSeries> tenantFactors(List<Tenant> tenants, PeriodSeries scenarioRent, int periods) {
        Map<Tenant, PeriodSeries> factors = new LinkedHashMap<>();
        for (Tenant tenant : tenants) {
            factors.put(tenant, tenant.getRentBumpRate() == null
                ? scenarioRent
                : escalationEngine.rentSeries(tenant.getRentBumpRate(), periods));
        }
        return factors;
    }
}
