package com.jay.proforma.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jay.proforma.BenchmarkScenario;
import com.jay.proforma.config.ModelConfig;
import com.jay.proforma.exception.InvariantViolationException;
import com.jay.proforma.layer6_returns.ReturnsSolver;
import com.jay.proforma.model.CalculationResponse;
import com.jay.proforma.model.ProFormaResult;
import com.jay.proforma.model.enums.CalculationStatus;
import com.jay.proforma.service.ProFormaService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.hamcrest.Matchers.closeTo;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(CalculationController.class)
@Import({ReturnsSolver.class, ModelConfig.class})
class CalculationControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private ProFormaService proFormaService;

    @Test
    @DisplayName("Successful run returns 200 with the result")
    void cashFlowsSuccess() throws Exception {
        ProFormaResult result = ProFormaResult.builder().warnings(List.of()).monthly(List.of()).build();
        when(proFormaService.run(any())).thenReturn(CalculationResponse.success(result));

        mockMvc.perform(post("/api/calculate/cashflows")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(BenchmarkScenario.input())))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("SUCCESS"))
            .andExpect(jsonPath("$.result.monthly").isArray());
    }

    @Test
    @DisplayName("Rejected run returns 422 with the failures")
    void cashFlowsValidationError() throws Exception {
        when(proFormaService.run(any())).thenReturn(CalculationResponse.failure(
            CalculationStatus.VALIDATION_ERROR, List.of("Building area must be positive (was 0.00)")));

        mockMvc.perform(post("/api/calculate/cashflows")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(BenchmarkScenario.input())))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.status").value("VALIDATION_ERROR"))
            .andExpect(jsonPath("$.errors[0]").value("Building area must be positive (was 0.00)"))
            .andExpect(jsonPath("$.result").doesNotExist());
    }

    @Test
    @DisplayName("Invariant violation surfaces as 500")
    void invariantViolation() throws Exception {
        when(proFormaService.run(any())).thenThrow(new InvariantViolationException("Loan 'Senior' balance would go negative"));

        mockMvc.perform(post("/api/calculate/cashflows")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(BenchmarkScenario.input())))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.success").value(false))
            .andExpect(jsonPath("$.message").value("Invariant violated"));
    }

    @Test
    @DisplayName("Malformed JSON returns 400")
    void malformedJson() throws Exception {
        mockMvc.perform(post("/api/calculate/cashflows")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"parameters\": "))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    @DisplayName("XIRR of dated cash flows")
    void xirr() throws Exception {
        String body = """
            {"cashFlows": [-1000, 1100], "dates": ["2025-01-01", "2026-01-01"]}
            """;

        mockMvc.perform(post("/api/calculate/irr").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.method").value("XIRR"))
            .andExpect(jsonPath("$.irr", closeTo(0.10, 1e-6), Double.class))
            .andExpect(jsonPath("$.multiple", closeTo(1.1, 1e-9), Double.class));
    }

    @Test
    @DisplayName("Periodic IRR without dates is annualized")
    void periodicIrr() throws Exception {
        String body = """
            {"cashFlows": [-1000, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 1126.825030131969720661201]}
            """;

        mockMvc.perform(post("/api/calculate/irr").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.method").value("PERIODIC"))
            .andExpect(jsonPath("$.monthlyIrr", closeTo(0.01, 1e-7), Double.class))
            .andExpect(jsonPath("$.irr", closeTo(0.126825, 1e-5), Double.class));
    }

    @Test
    @DisplayName("Dates that do not match the flows return 422")
    void xirrDateMismatch() throws Exception {
        String body = """
            {"cashFlows": [-1000, 100, 1100], "dates": ["2025-01-01", "2026-01-01"]}
            """;

        mockMvc.perform(post("/api/calculate/irr").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.message").value("Validation failed"));
    }

    @Test
    @DisplayName("Single-sign series returns 422")
    void degenerateSeries() throws Exception {
        mockMvc.perform(post("/api/calculate/irr")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"cashFlows\": [100, 200, 300]}"))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.message").value("Calculation failed"));
    }
}
