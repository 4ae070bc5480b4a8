package com.jay.proforma.model;

import com.jay.proforma.model.enums.RateMode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;
import java.util.TreeMap;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Loan {

    @Builder.Default
    private String name = "Senior";
    private double principal;

    @Builder.Default
    private RateMode rateMode = RateMode.FIXED;
    private double fixedRate;
    private double floatingSpread;

    private int interestOnlyMonths;
    @Builder.Default
    private int amortizationYears = 30;

    private double originationFeeRate;
    private double closingCostRate;

    /** Period → draw amount. Empty means the full principal funds at acquisition. */
    @Builder.Default
    private Map<Integer, Double> drawSchedule = new TreeMap<>();

    private boolean capitalizeInterest;

    public int amortizationMonths() {
        return amortizationYears * 12;
    }

    public double drawAt(int period) {
        if (drawSchedule == null || drawSchedule.isEmpty()) {
            return period == 0 ? principal : 0.0;
        }
        return drawSchedule.getOrDefault(period, 0.0);
    }

    public int firstDrawPeriod() {
        if (drawSchedule == null || drawSchedule.isEmpty()) return 0;
        return drawSchedule.entrySet().stream()
            .filter(e -> e.getValue() != null && e.getValue() > 0)
            .mapToInt(Map.Entry::getKey)
            .min().orElse(0);
    }
}
