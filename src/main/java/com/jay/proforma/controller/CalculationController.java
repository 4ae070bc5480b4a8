package com.jay.proforma.controller;

import com.jay.proforma.layer6_returns.ReturnsSolver;
import com.jay.proforma.model.CalculationResponse;
import com.jay.proforma.model.ScenarioInput;
import com.jay.proforma.service.ProFormaService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * REST API — Pro Forma Calculations.
 *
 * Endpoints:
 *   POST /api/calculate/cashflows — Full scenario run: monthly table, returns, waterfall
 *   POST /api/calculate/irr       — IRR of an arbitrary cash-flow series
 */
@Slf4j
@RestController
@RequestMapping("/api/calculate")
@RequiredArgsConstructor
public class CalculationController {

    private final ProFormaService proFormaService;
    private final ReturnsSolver returnsSolver;

    /** Dates are optional: with them the rate is XIRR, without them a monthly IRR annualized. */
    public record IrrRequest(double[] cashFlows, List<LocalDate> dates) {}

    // ── POST /api/calculate/cashflows ──────────────────────────────────────────

    @PostMapping("/cashflows")
    public ResponseEntity<CalculationResponse> cashFlows(@RequestBody ScenarioInput input) {
        CalculationResponse response = proFormaService.run(input);
        if (!response.isSuccess()) {
            log.warn("Calculation rejected ({}): {}", response.getStatus(), String.join("; ", response.getErrors()));
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(response);
        }
        return ResponseEntity.ok(response);
    }

    // ── POST /api/calculate/irr ────────────────────────────────────────────────

    @PostMapping("/irr")
    public ResponseEntity<Map<String, Object>> irr(@RequestBody IrrRequest request) {
        double[] cf = request.cashFlows() == null ? new double[0] : request.cashFlows();
        if (request.dates() != null && !request.dates().isEmpty()) {
            return ResponseEntity.ok(Map.of(
                "method", "XIRR",
                "irr", returnsSolver.xirr(cf, request.dates()),
                "multiple", returnsSolver.multiple(cf),
                "profit", returnsSolver.profit(cf)
            ));
        }
        return ResponseEntity.ok(Map.of(
            "method", "PERIODIC",
            "monthlyIrr", returnsSolver.periodicIrr(cf),
            "irr", returnsSolver.annualizedIrr(cf),
            "multiple", returnsSolver.multiple(cf),
            "profit", returnsSolver.profit(cf)
        ));
    }
}
