package com.jay.proforma.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One space on the rent roll. Rents are annual per unit of area; periods are month indexes
 * counted from acquisition (period 0).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Tenant {

    private String name;
    private double area;

    private double inPlaceRentPerArea;
    private double marketRentPerArea;

    @Builder.Default
    private int leaseStartMonth = 0;
    private int leaseEndMonth;           // last month billed at the in-place rent

    // Rollover: TI buildout gap, free rent, leasing costs apply only when set
    private boolean rolloverCosts;
    private int tiBuildoutMonths;
    private int freeRentMonths;
    private int freeRentStartMonth;      // 0 → no free rent during the in-place lease

    private Double rentBumpRate;         // null → scenario rent growth

    // Leasing costs charged at rollover
    private double tiAllowancePerArea;
    private double leaseCommissionRateYears1To5;
    private double leaseCommissionRateYears6Plus;
    @Builder.Default
    private int newLeaseTermYears = 10;

    public int rolloverMonth() {
        return leaseEndMonth + 1;
    }
}
