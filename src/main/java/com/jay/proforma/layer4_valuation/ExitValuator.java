package com.jay.proforma.layer4_valuation;

import com.jay.proforma.exception.InvalidCapRateException;
import com.jay.proforma.exception.ScheduleLookupException;
import com.jay.proforma.layer2_operations.OperatingPeriod;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Layer 4 — Exit Valuator.
 * Capitalizes the buyer's forward twelve months of NOI into a sale price.
 * Capital reserves for those months are added back: the buyer underwrites its own reserves.
 */
@Slf4j
@Component
public class ExitValuator {

    public static final int FORWARD_MONTHS = 12;

    public record ExitValuation(
        int exitPeriod,
        double forwardNoi,
        double reserveAddBack,
        double capRate,
        double grossValue,
        double salesCosts,
        double netProceeds
    ) {
        public double underwrittenNoi() {
            return forwardNoi + reserveAddBack;
        }
    }

    public ExitValuation value(List<OperatingPeriod> periods, int exitPeriod,
                               double capRate, double salesCostRate) {
        int last = exitPeriod + FORWARD_MONTHS;
        if (last >= periods.size()) {
            throw new ScheduleLookupException("Forward NOI projection", last, periods.size());
        }
        if (capRate <= 0) {
            throw new InvalidCapRateException(capRate);
        }

        double forwardNoi = 0;
        double reserves = 0;
        for (int t = exitPeriod + 1; t <= last; t++) {
            OperatingPeriod op = periods.get(t);
            forwardNoi += op.getNoi();
            reserves += op.getCapitalReserve();
        }

        double gross = (forwardNoi + reserves) / capRate;
        double salesCosts = gross * salesCostRate;
        ExitValuation valuation = new ExitValuation(
            exitPeriod, forwardNoi, reserves, capRate, gross, salesCosts, gross - salesCosts);

        log.info("Exit at month {}: forward NOI {} (+{} reserves) @ {}% cap → net proceeds {}",
            exitPeriod,
            String.format("%.2f", forwardNoi),
            String.format("%.2f", reserves),
            String.format("%.2f", capRate * 100),
            String.format("%.2f", valuation.netProceeds()));
        return valuation;
    }
}
