package com.jay.proforma.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One hurdle of the distribution waterfall. LP split + GP split + GP promote must equal 1.
 * The final split of a structure is a tier with no pref rate.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WaterfallTier {
    private String name;
    private double prefRate;     // annual
    private double lpSplit;
    private double gpSplit;
    private double gpPromote;

    public double investorSplit() {
        return lpSplit + gpSplit;
    }

    /** Promote earned per unit of pref paid to the investor classes. */
    public double promotePerInvestorDollar() {
        return investorSplit() > 0 ? gpPromote / investorSplit() : 0.0;
    }
}
